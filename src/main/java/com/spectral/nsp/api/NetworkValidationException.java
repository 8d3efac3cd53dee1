package com.spectral.nsp.api;

/**
 * Raised when the inputs describing a network, a base set or a dynamics run
 * are malformed: non-square adjacency, wrong-length or duplicate labels,
 * unknown or mixed base-set identifiers, and similar caller errors.
 */
public class NetworkValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public NetworkValidationException(String message) {
        super(message);
    }

    public NetworkValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

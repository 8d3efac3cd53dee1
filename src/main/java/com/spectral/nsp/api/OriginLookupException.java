package com.spectral.nsp.api;

/**
 * A canonical label could not be resolved through the origin mapping.
 *
 * Every node of a network, specialized or not, must trace back to a cell of
 * the original functional matrix. Seeing this exception means that invariant
 * was broken somewhere upstream; it is not a recoverable input error.
 */
public class OriginLookupException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final String canonicalLabel;

    public OriginLookupException(String label, String canonicalLabel) {
        super("Label '" + label + "' (canonical '" + canonicalLabel + "') has no origin index");
        this.canonicalLabel = canonicalLabel;
    }

    public String canonicalLabel() {
        return canonicalLabel;
    }
}

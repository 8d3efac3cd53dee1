package com.spectral.nsp.api;

/**
 * Raised when a state vector handed to the dynamics engine does not have one
 * entry per node.
 */
public class DimensionMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("State length " + actual + " does not match node count " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}

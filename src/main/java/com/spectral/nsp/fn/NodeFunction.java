package com.spectral.nsp.fn;

/**
 * A scalar function used as one cell of a functional matrix.
 *
 * <p>
 * On the diagonal it describes a node's own dynamics; off the diagonal, cell
 * (i, j) transforms node j's state before it is weighted by the edge j -> i.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code x -> 0.5 * x}</li>
 * <li>{@code Math::tanh}</li>
 * </ul>
 *
 * Implementations that know their derivative in closed form should override
 * {@link #derivative(double)}; the default is a central difference.
 */
@FunctionalInterface
public interface NodeFunction {

    /** Relative step used by the default central difference. */
    double DIFFERENCE_STEP = 1e-6;

    /**
     * Applies the function.
     *
     * @param x The input value.
     * @return The result.
     */
    double apply(double x);

    /**
     * First derivative at {@code x}.
     */
    default double derivative(double x) {
        double h = DIFFERENCE_STEP * Math.max(1.0, Math.abs(x));
        return (apply(x + h) - apply(x - h)) / (2.0 * h);
    }
}

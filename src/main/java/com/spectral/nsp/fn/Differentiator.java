package com.spectral.nsp.fn;

/**
 * Elementwise differentiation of a scalar function over a vector of sample
 * points. The stability analyzer only depends on this contract, not on how the
 * derivative is obtained.
 */
@FunctionalInterface
public interface Differentiator {

    /**
     * @param function The function to differentiate.
     * @param points   Sample points. Not modified.
     * @return A new array, {@code result[k] = f'(points[k])}.
     */
    double[] differentiate(NodeFunction function, double[] points);

    /**
     * Uses each function's own {@link NodeFunction#derivative(double)}, which is
     * exact for the {@link NodeFunctions} library.
     */
    static Differentiator elementwise() {
        return (function, points) -> {
            double[] out = new double[points.length];
            for (int k = 0; k < points.length; k++) {
                out[k] = function.derivative(points[k]);
            }
            return out;
        };
    }

    /**
     * Central difference with a fixed absolute step, ignoring any closed form.
     */
    static Differentiator centralDifference(double step) {
        if (!(step > 0.0)) {
            throw new IllegalArgumentException("Difference step must be positive: " + step);
        }
        return (function, points) -> {
            double[] out = new double[points.length];
            for (int k = 0; k < points.length; k++) {
                double x = points[k];
                out[k] = (function.apply(x + step) - function.apply(x - step)) / (2.0 * step);
            }
            return out;
        };
    }
}

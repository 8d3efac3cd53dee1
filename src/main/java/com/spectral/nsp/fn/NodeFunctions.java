package com.spectral.nsp.fn;

/**
 * Library of common node functions with closed-form derivatives.
 */
public final class NodeFunctions {

    private static final NodeFunction ZERO = new Constant(0.0);

    private NodeFunctions() {
    }

    /** f(x) = 0. Used for absent couplings. */
    public static NodeFunction zero() {
        return ZERO;
    }

    /** f(x) = c */
    public static NodeFunction constant(double value) {
        return new Constant(value);
    }

    /** f(x) = slope * x */
    public static NodeFunction linear(double slope) {
        return new Affine(slope, 0.0);
    }

    /** f(x) = slope * x + intercept */
    public static NodeFunction affine(double slope, double intercept) {
        return new Affine(slope, intercept);
    }

    /** f(x) = scale * tanh(gain * x) */
    public static NodeFunction tanh(double scale, double gain) {
        return new Tanh(scale, gain);
    }

    /** f(x) = 1 / (1 + exp(-gain * x)) */
    public static NodeFunction sigmoid(double gain) {
        return new Sigmoid(gain);
    }

    /** f(x) = amplitude * sin(frequency * x) */
    public static NodeFunction sin(double amplitude, double frequency) {
        return new Sine(amplitude, frequency);
    }

    record Constant(double value) implements NodeFunction {
        @Override
        public double apply(double x) {
            return value;
        }

        @Override
        public double derivative(double x) {
            return 0.0;
        }
    }

    record Affine(double slope, double intercept) implements NodeFunction {
        @Override
        public double apply(double x) {
            return slope * x + intercept;
        }

        @Override
        public double derivative(double x) {
            return slope;
        }
    }

    record Tanh(double scale, double gain) implements NodeFunction {
        @Override
        public double apply(double x) {
            return scale * Math.tanh(gain * x);
        }

        @Override
        public double derivative(double x) {
            double t = Math.tanh(gain * x);
            return scale * gain * (1.0 - t * t);
        }
    }

    record Sigmoid(double gain) implements NodeFunction {
        @Override
        public double apply(double x) {
            return 1.0 / (1.0 + Math.exp(-gain * x));
        }

        @Override
        public double derivative(double x) {
            double s = apply(x);
            return gain * s * (1.0 - s);
        }
    }

    record Sine(double amplitude, double frequency) implements NodeFunction {
        @Override
        public double apply(double x) {
            return amplitude * Math.sin(frequency * x);
        }

        @Override
        public double derivative(double x) {
            return amplitude * frequency * Math.cos(frequency * x);
        }
    }
}

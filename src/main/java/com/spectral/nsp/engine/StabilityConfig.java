package com.spectral.nsp.engine;

import com.spectral.nsp.api.NetworkValidationException;

/**
 * Sampling domain and threshold for stability analysis.
 *
 * @param lower     Lower end of the sampled domain.
 * @param upper     Upper end of the sampled domain.
 * @param samples   Number of evenly spaced points, both ends included.
 * @param threshold A spectral radius strictly below this counts as stable.
 * @throws NetworkValidationException for an empty domain, fewer than two
 *                                    samples or a non-positive threshold.
 */
public record StabilityConfig(double lower, double upper, int samples, double threshold) {

    public static final StabilityConfig DEFAULT = new StabilityConfig(-10.0, 10.0, 50_000, 1.0);

    public StabilityConfig {
        if (!(lower < upper)) {
            throw new NetworkValidationException("Sample domain must satisfy lower < upper: [" + lower + ", " + upper + "]");
        }
        if (samples < 2) {
            throw new NetworkValidationException("Need at least 2 samples, got " + samples);
        }
        if (!(threshold > 0.0)) {
            throw new NetworkValidationException("Stability threshold must be positive: " + threshold);
        }
    }

    public StabilityConfig withSamples(int samples) {
        return new StabilityConfig(lower, upper, samples, threshold);
    }

    public StabilityConfig withThreshold(double threshold) {
        return new StabilityConfig(lower, upper, samples, threshold);
    }

    /** The sample points, like {@code linspace(lower, upper, samples)}. */
    public double[] samplePoints() {
        double[] points = new double[samples];
        double stepSize = (upper - lower) / (samples - 1);
        for (int k = 0; k < samples; k++) {
            points[k] = lower + k * stepSize;
        }
        points[samples - 1] = upper;
        return points;
    }
}

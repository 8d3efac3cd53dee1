package com.spectral.nsp.engine;

/**
 * Outcome of a stability check.
 *
 * @param spectralRadius Largest eigenvalue modulus of the stability matrix.
 * @param threshold      Value the radius was compared against.
 * @param stable         {@code spectralRadius < threshold}.
 */
public record StabilityVerdict(double spectralRadius, double threshold, boolean stable) {

    static StabilityVerdict of(double spectralRadius, double threshold) {
        return new StabilityVerdict(spectralRadius, threshold, spectralRadius < threshold);
    }
}

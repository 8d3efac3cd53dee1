package com.spectral.nsp.util;

import com.spectral.nsp.api.DynamicsListener;

import lombok.extern.log4j.Log4j2;

import java.util.Arrays;

/**
 * Logs the iteration lifecycle at DEBUG and non-finite node values at WARN.
 *
 * Warnings are capped per iteration so a diverging simulation cannot flood
 * the log.
 */
@Log4j2
public final class LoggingDynamicsListener implements DynamicsListener {
    private final int maxWarningsPerIteration;
    private int warnings;
    private long startNanos;

    public LoggingDynamicsListener() {
        this(10);
    }

    public LoggingDynamicsListener(int maxWarningsPerIteration) {
        this.maxWarningsPerIteration = maxWarningsPerIteration;
    }

    @Override
    public void onIterationStart(int steps, int nodeCount) {
        warnings = 0;
        startNanos = System.nanoTime();
        log.debug("Iterating {} steps over {} nodes", steps, nodeCount);
    }

    @Override
    public void onStep(int step, double[] state) {
        if (log.isTraceEnabled()) {
            log.trace("Step {}: {}", step, Arrays.toString(state));
        }
    }

    @Override
    public void onNonFiniteState(int step, int nodeIndex, String label, double value) {
        if (warnings++ < maxWarningsPerIteration) {
            log.warn("Node {} [{}] became {} at step {}", label, nodeIndex, value, step);
        }
    }

    @Override
    public void onIterationEnd(int steps) {
        log.debug("Finished {} steps in {} us ({} non-finite values)", steps,
                (System.nanoTime() - startNanos) / 1_000, warnings);
    }

    /** Non-finite values seen during the current or last iteration. */
    public int nonFiniteCount() {
        return warnings;
    }
}

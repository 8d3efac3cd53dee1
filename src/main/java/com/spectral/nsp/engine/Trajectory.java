package com.spectral.nsp.engine;

import java.util.List;

/**
 * States of every node over a simulation: row t is the state after t updates,
 * row 0 the initial condition.
 */
public final class Trajectory {
    private final double[][] states;
    private final List<String> labels;

    Trajectory(double[][] states, List<String> labels) {
        this.states = states;
        this.labels = List.copyOf(labels);
    }

    public int steps() {
        return states.length;
    }

    public int nodeCount() {
        return labels.size();
    }

    public List<String> labels() {
        return labels;
    }

    public double value(int step, int node) {
        return states[step][node];
    }

    /** Copy of row {@code step}. */
    public double[] state(int step) {
        return states[step].clone();
    }

    /** Copy of the final row. */
    public double[] last() {
        return states[states.length - 1].clone();
    }

    /** Values of one node over time. */
    public double[] series(int node) {
        double[] out = new double[states.length];
        for (int t = 0; t < states.length; t++) {
            out[t] = states[t][node];
        }
        return out;
    }

    public double[] series(String label) {
        int node = labels.indexOf(label);
        if (node < 0) {
            throw new IllegalArgumentException("Unknown node label: " + label);
        }
        return series(node);
    }

    /** Deep copy as a (steps x n) array. */
    public double[][] toArray() {
        double[][] out = new double[states.length][];
        for (int t = 0; t < states.length; t++) {
            out[t] = states[t].clone();
        }
        return out;
    }
}

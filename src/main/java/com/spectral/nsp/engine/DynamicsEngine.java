package com.spectral.nsp.engine;

import com.spectral.nsp.api.DimensionMismatchException;
import com.spectral.nsp.api.DynamicsListener;
import com.spectral.nsp.api.NetworkValidationException;
import com.spectral.nsp.api.TrajectoryPlotter;
import com.spectral.nsp.fn.NodeFunction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

import java.util.Arrays;

/**
 * Iterates node-update rules over a network, specialized or not.
 *
 * <h2>Modes</h2>
 * <ul>
 * <li><b>Linear</b> (no functional matrix): {@code x' = A x}, a sparse
 * matrix-vector product.</li>
 * <li><b>Nonlinear</b>:
 * {@code x'[i] = F[oi,oi](x[i]) + sum_{j != i} A[i,j] * F[oi,oj](x[j])} where
 * {@code oi = original(i)}. The self term is always applied; cross terms are
 * visited only for stored nonzero entries of A, and stored diagonal weights
 * are ignored.</li>
 * </ul>
 *
 * Original indices are resolved once at construction, so a broken origin
 * mapping fails here rather than mid-simulation.
 *
 * Not thread-safe; one engine per simulating thread.
 */
public final class DynamicsEngine {
    private static final Logger log = LogManager.getLogger(DynamicsEngine.class);

    private final Network network;
    private final DMatrixSparseCSC adjacency;
    private final FunctionalSystem system;

    // originalIndex[i] == network.original(i); empty in linear mode.
    private final int[] originalIndex;

    private DynamicsListener listener;

    public DynamicsEngine(Network network) {
        this.network = network;
        this.adjacency = network.matrix();
        this.system = network.functionalSystem();
        if (system.isLinear()) {
            this.originalIndex = new int[0];
        } else {
            int n = network.nodeCount();
            this.originalIndex = new int[n];
            for (int i = 0; i < n; i++) {
                originalIndex[i] = network.original(i);
            }
        }
    }

    public void setListener(DynamicsListener listener) {
        this.listener = listener;
    }

    public Network network() {
        return network;
    }

    public boolean isLinear() {
        return system.isLinear();
    }

    /**
     * Applies one update to {@code state}.
     *
     * @return A new state vector.
     * @throws DimensionMismatchException if state.length != n.
     */
    public double[] step(double[] state) {
        checkDimension(state);
        return system.isLinear() ? linearStep(state) : nonlinearStep(state);
    }

    /**
     * Simulates {@code steps} rows starting from {@code initial}.
     *
     * @param steps   Number of rows in the trajectory, at least 1. Row 0 is the
     *                initial state.
     * @param initial Initial state, one entry per node. Not modified.
     * @throws NetworkValidationException if steps < 1.
     * @throws DimensionMismatchException if initial.length != n.
     */
    public Trajectory iterate(int steps, double[] initial) {
        if (steps < 1) {
            throw new NetworkValidationException("Step count must be positive: " + steps);
        }
        checkDimension(initial);

        final int n = network.nodeCount();
        final DynamicsListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener) {
            l.onIterationStart(steps, n);
        }

        double[][] states = new double[steps][];
        states[0] = initial.clone();
        int nonFinite = 0;
        for (int t = 1; t < steps; t++) {
            double[] next = system.isLinear() ? linearStep(states[t - 1]) : nonlinearStep(states[t - 1]);
            states[t] = next;

            for (int i = 0; i < n; i++) {
                if (!Double.isFinite(next[i])) {
                    nonFinite++;
                    if (hasListener) {
                        l.onNonFiniteState(t, i, network.label(i), next[i]);
                    }
                }
            }
            if (hasListener) {
                l.onStep(t, next);
            }
        }

        if (hasListener) {
            l.onIterationEnd(steps);
        }
        if (nonFinite > 0) {
            log.warn("{} non-finite node values over {} steps on {}", nonFinite, steps, network);
        }

        return new Trajectory(states, network.labels());
    }

    /**
     * Simulates and hands the trajectory to an external plotter.
     */
    public Trajectory iterate(int steps, double[] initial, TrajectoryPlotter plotter, String title) {
        Trajectory trajectory = iterate(steps, initial);
        if (plotter != null) {
            plotter.plot(trajectory, title);
        }
        return trajectory;
    }

    private double[] linearStep(double[] state) {
        final int n = state.length;
        if (n == 0) {
            return new double[0];
        }
        DMatrixRMaj x = new DMatrixRMaj(n, 1, true, state.clone());
        DMatrixRMaj y = new DMatrixRMaj(n, 1);
        CommonOps_DSCC.mult(adjacency, x, y);
        return Arrays.copyOf(y.data, n);
    }

    private double[] nonlinearStep(double[] state) {
        final int n = state.length;
        final int[] o = originalIndex;
        double[] next = new double[n];

        for (int i = 0; i < n; i++) {
            next[i] = system.function(o[i], o[i]).apply(state[i]);
        }

        for (int j = 0; j < n; j++) {
            final double xj = state[j];
            for (int k = adjacency.col_idx[j]; k < adjacency.col_idx[j + 1]; k++) {
                int i = adjacency.nz_rows[k];
                double w = adjacency.nz_values[k];
                if (i == j || w == 0.0) {
                    continue;
                }
                NodeFunction f = system.function(o[i], o[j]);
                next[i] += w * f.apply(xj);
            }
        }
        return next;
    }

    private void checkDimension(double[] state) {
        int n = network.nodeCount();
        if (state == null || state.length != n) {
            throw new DimensionMismatchException(n, state == null ? 0 : state.length);
        }
    }
}

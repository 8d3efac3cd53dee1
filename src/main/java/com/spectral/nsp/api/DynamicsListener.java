package com.spectral.nsp.api;

/**
 * Callbacks from the dynamics engine while a trajectory is being produced.
 *
 * Invoked on the iterating thread, once per step, so implementations should
 * stay cheap.
 */
public interface DynamicsListener {

    /**
     * Called before the first update.
     *
     * @param steps     Number of rows the trajectory will have.
     * @param nodeCount Number of nodes being simulated.
     */
    void onIterationStart(int steps, int nodeCount);

    /**
     * Called after row {@code step} of the trajectory has been filled.
     *
     * @param step  Row index, starting at 1 (row 0 is the initial state).
     * @param state The freshly computed state. Do not retain or modify.
     */
    void onStep(int step, double[] state);

    /**
     * Called when an update produced NaN or an infinite value for a node.
     * Iteration continues; the value is kept in the trajectory.
     */
    void onNonFiniteState(int step, int nodeIndex, String label, double value);

    /**
     * Called once the trajectory is complete.
     */
    void onIterationEnd(int steps);
}

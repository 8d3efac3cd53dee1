package com.spectral.nsp.api;

import com.spectral.nsp.engine.Trajectory;

/**
 * External rendering facility for simulated trajectories: one line per node
 * over the time domain, legend from the node labels. The library itself never
 * renders or writes figures; it only hands over the finished trajectory.
 */
@FunctionalInterface
public interface TrajectoryPlotter {

    /**
     * @param trajectory Completed trajectory, labels included.
     * @param title      Caller-supplied title, also usable as a file name. May
     *                   be null.
     */
    void plot(Trajectory trajectory, String title);
}

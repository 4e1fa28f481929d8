package com.control.cfs.api;

import com.control.cfs.input.TimeGrid;
import com.control.cfs.ode.Trajectory;

/**
 * ODE integration collaborator. Used only to produce reference trajectories
 * that a truncated series is compared against; the series engines never call
 * it.
 */
public interface OdeSolver {

    /**
     * Integrates {@code dynamics} from {@code z0} at {@code grid.t0()} and
     * reports the state on every grid sample.
     */
    Trajectory solve(Dynamics dynamics, double[] z0, TimeGrid grid);
}

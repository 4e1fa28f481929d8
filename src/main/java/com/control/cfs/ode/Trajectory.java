package com.control.cfs.ode;

import com.control.cfs.api.CompiledExpr;
import com.control.cfs.input.TimeGrid;

/**
 * States z(t_j) on every sample of a time grid.
 */
public final class Trajectory {
    private final TimeGrid grid;
    // states[j] = z(t_j)
    private final double[][] states;

    public Trajectory(TimeGrid grid, double[][] states) {
        if (states.length != grid.samples())
            throw new IllegalArgumentException("Trajectory has " + states.length + " states for "
                    + grid.samples() + " samples");
        this.grid = grid;
        this.states = states;
    }

    public TimeGrid grid() {
        return grid;
    }

    public int samples() {
        return states.length;
    }

    public int dimension() {
        return states[0].length;
    }

    /** Copy of z(t_j). */
    public double[] state(int j) {
        return states[j].clone();
    }

    /** Time series of state component {@code i}. */
    public double[] component(int i) {
        double[] c = new double[states.length];
        for (int j = 0; j < states.length; j++)
            c[j] = states[j][i];
        return c;
    }

    /** y(t_j) = h(z(t_j)) on every sample. */
    public double[] map(CompiledExpr h) {
        double[] y = new double[states.length];
        for (int j = 0; j < states.length; j++)
            y[j] = h.evaluate(states[j]);
        return y;
    }
}

package com.control.cfs.ode;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.Dynamics;
import com.control.cfs.api.OdeSolver;
import com.control.cfs.input.TimeGrid;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;
import org.apache.commons.math3.ode.FirstOrderIntegrator;
import org.apache.commons.math3.ode.nonstiff.ClassicalRungeKuttaIntegrator;

/**
 * Classical fourth-order Runge-Kutta with a fixed step, backed by the
 * commons-math {@link ClassicalRungeKuttaIntegrator}.
 *
 * Each grid interval is integrated on its own with step dt / substeps, so the
 * trajectory is reported exactly on the grid samples.
 */
public final class RungeKutta4Solver implements OdeSolver {
    private final int substeps;

    public RungeKutta4Solver() {
        this(1);
    }

    public RungeKutta4Solver(int substeps) {
        if (substeps < 1)
            throw new ConfigurationException("Sub-step count must be >= 1, got " + substeps);
        this.substeps = substeps;
    }

    public int substeps() {
        return substeps;
    }

    @Override
    public Trajectory solve(Dynamics f, double[] z0, TimeGrid grid) {
        FirstOrderIntegrator integrator = new ClassicalRungeKuttaIntegrator(grid.dt() / substeps);
        FirstOrderDifferentialEquations equations = new DynamicsEquations(f, z0.length);

        double[][] states = new double[grid.samples()][];
        double[] z = z0.clone();
        states[0] = z.clone();
        try {
            for (int j = 1; j < grid.samples(); j++) {
                // z is both start and end state of the interval
                integrator.integrate(equations, grid.time(j - 1), z, grid.time(j), z);
                states[j] = z.clone();
            }
        } catch (MathIllegalArgumentException e) {
            throw new ConfigurationException("Cannot integrate over " + grid + ": " + e.getMessage(), e);
        }
        return new Trajectory(grid, states);
    }

    /** Adapts {@link Dynamics} to the commons-math ODE interface. */
    private static final class DynamicsEquations implements FirstOrderDifferentialEquations {
        private final Dynamics dynamics;
        private final int dimension;

        DynamicsEquations(Dynamics dynamics, int dimension) {
            this.dynamics = dynamics;
            this.dimension = dimension;
        }

        @Override
        public int getDimension() {
            return dimension;
        }

        @Override
        public void computeDerivatives(double t, double[] y, double[] yDot) {
            dynamics.derivative(t, y, yDot);
        }
    }
}

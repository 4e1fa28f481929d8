package com.control.cfs.engine;

/**
 * Cumulative quadrature on a uniform grid.
 *
 * Every rule starts at 0 on the first sample, so E_w(t0) = 0 for every
 * non-empty word. The same rule must be used at every depth: a depth k+1
 * integral integrates a product that already carries the depth k
 * discretisation error.
 */
public enum IntegrationRule {
    /** Trapezoidal rule, second order in dt. Exact for inputs linear in t at depth 1. */
    TRAPEZOID {
        @Override
        public double increment(double previous, double current, double dt) {
            return 0.5 * dt * (previous + current);
        }
    },
    /** Left-point rectangle rule, first order in dt. */
    RECTANGLE {
        @Override
        public double increment(double previous, double current, double dt) {
            return dt * previous;
        }
    };

    /**
     * Area added when moving from sample j-1 to sample j.
     *
     * @param previous Integrand at sample j-1.
     * @param current  Integrand at sample j.
     * @param dt       Grid step.
     */
    public abstract double increment(double previous, double current, double dt);

    /**
     * out[j] = ∫_{t0}^{t_j} u(τ) e(τ) dτ, the running integral of the
     * pointwise product of {@code u} and {@code e}.
     */
    public void integrateProduct(double[] u, double[] e, double dt, double[] out) {
        double prev = u[0] * e[0];
        out[0] = 0.0;
        for (int j = 1; j < out.length; j++) {
            double cur = u[j] * e[j];
            out[j] = out[j - 1] + increment(prev, cur, dt);
            prev = cur;
        }
    }

    /** Running integral of {@code f}, written into {@code out}. */
    public void integrate(double[] f, double dt, double[] out) {
        out[0] = 0.0;
        for (int j = 1; j < out.length; j++)
            out[j] = out[j - 1] + increment(f[j - 1], f[j], dt);
    }
}

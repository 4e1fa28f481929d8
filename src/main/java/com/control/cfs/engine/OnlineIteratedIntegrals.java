package com.control.cfs.engine;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.word.WordIndex;

/**
 * Streaming iterated integrals: holds E_η(t_j) for every word and advances
 * all of them by one sample per {@link #advance(double[])} call.
 *
 * Rows are updated in index order, so every parent η is already at sample j
 * when its extensions x_i η integrate u_i(t_j) E_η(t_j). With the same rule
 * and grid, the values after sample j equal column j of the batch
 * {@link IteratedIntegralEngine} table exactly.
 *
 * Not thread-safe; owned by a single consumer.
 */
public final class OnlineIteratedIntegrals {
    private final WordIndex index;
    private final IntegrationRule rule;
    private final double t0;
    private final double dt;

    // Flattened copies of the index's parent / symbol arrays for the hot loop
    private final int[] parent;
    private final int[] symbol;

    private final double[] values;
    private final double[] previousIntegrand;
    private final int channels;
    private long samples;

    public OnlineIteratedIntegrals(WordIndex index, double t0, double dt, IntegrationRule rule) {
        if (!(dt > 0))
            throw new ConfigurationException("Time step must be > 0, got " + dt);
        this.index = index;
        this.rule = rule;
        this.t0 = t0;
        this.dt = dt;
        this.channels = index.alphabet().controlledChannels();

        int n = index.size();
        this.parent = new int[n];
        this.symbol = new int[n];
        for (int r = 0; r < n; r++) {
            parent[r] = index.parentRow(r);
            symbol[r] = index.symbolOf(r);
        }
        this.values = new double[n];
        this.previousIntegrand = new double[n];
        reset();
    }

    /**
     * Consumes the controlled inputs u1..um at the next grid sample.
     *
     * @throws ShapeMismatchException if {@code u} does not have m entries.
     */
    public void advance(double[] u) {
        if (u.length != channels)
            throw new ShapeMismatchException("Sample has " + u.length + " channels, expected " + channels);
        final boolean first = samples == 0;
        for (int r = 1; r < values.length; r++) {
            int s = symbol[r];
            double ui = s == 0 ? 1.0 : u[s - 1];
            double cur = ui * values[parent[r]];
            if (first)
                values[r] = 0.0;
            else
                values[r] += rule.increment(previousIntegrand[r], cur, dt);
            previousIntegrand[r] = cur;
        }
        samples++;
    }

    /** Restarts at t0 with E_ε = 1 and every other integral at 0. */
    public void reset() {
        java.util.Arrays.fill(values, 0.0);
        java.util.Arrays.fill(previousIntegrand, 0.0);
        values[0] = 1.0;
        samples = 0;
    }

    public WordIndex index() {
        return index;
    }

    public double valueAt(int row) {
        return values[row];
    }

    /** Copies the current value of every word into {@code out}, in row order. */
    public void copyValues(double[] out) {
        System.arraycopy(values, 0, out, 0, values.length);
    }

    /** Number of samples consumed since the last reset. */
    public long samplesProcessed() {
        return samples;
    }

    /** Time of the last consumed sample, or NaN before the first one. */
    public double currentTime() {
        return samples == 0 ? Double.NaN : t0 + (samples - 1) * dt;
    }
}

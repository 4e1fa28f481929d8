package com.control.cfs.series;

import com.control.cfs.input.TimeGrid;

/**
 * F_c^N[u](t) on a time grid, together with the contribution of each word
 * length so lower truncations can be read off without recomputation.
 */
public final class TruncatedSeries {
    private final TimeGrid grid;
    // contributions[k][j] = Σ_{|η| = k} (c, η) E_η(t_j); contributions[0] = h(z0)
    private final double[][] contributions;
    private final double[] values;

    TruncatedSeries(TimeGrid grid, double[][] contributions) {
        this.grid = grid;
        this.contributions = contributions;
        this.values = partialSum(contributions.length - 1);
    }

    public TimeGrid grid() {
        return grid;
    }

    /** Truncation depth N. */
    public int depth() {
        return contributions.length - 1;
    }

    public int samples() {
        return values.length;
    }

    public double valueAt(int j) {
        return values[j];
    }

    /** Copy of F_c^N on every sample. */
    public double[] values() {
        return values.clone();
    }

    /** F_c^k on every sample, for k ≤ N. */
    public double[] partialSum(int k) {
        if (k < 0 || k >= contributions.length)
            throw new IndexOutOfBoundsException("Depth " + k + " outside [0, " + depth() + "]");
        double[] out = new double[grid.samples()];
        for (int d = 0; d <= k; d++) {
            double[] c = contributions[d];
            for (int j = 0; j < out.length; j++)
                out[j] += c[j];
        }
        return out;
    }

    /** Contribution of all words of length exactly k. */
    public double[] depthContribution(int k) {
        if (k < 0 || k >= contributions.length)
            throw new IndexOutOfBoundsException("Depth " + k + " outside [0, " + depth() + "]");
        return contributions[k].clone();
    }

    /** Error of this series against a reference output on the same grid. */
    public ErrorReport compareWith(double[] reference) {
        return ErrorReport.of(grid, values, reference);
    }
}

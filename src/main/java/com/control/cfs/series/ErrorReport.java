package com.control.cfs.series;

import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.input.TimeGrid;

/**
 * Pointwise and aggregate error of an approximation against a reference
 * trajectory sampled on the same grid.
 *
 * Purely a reporting structure; nothing in the series computation reads it.
 */
public final class ErrorReport {
    private final TimeGrid grid;
    private final double[] pointwise;
    private final double maxAbs;
    private final double rms;
    private final double meanAbs;
    private final int argMax;

    private ErrorReport(TimeGrid grid, double[] pointwise, double maxAbs, double rms, double meanAbs, int argMax) {
        this.grid = grid;
        this.pointwise = pointwise;
        this.maxAbs = maxAbs;
        this.rms = rms;
        this.meanAbs = meanAbs;
        this.argMax = argMax;
    }

    /**
     * error[j] = approximation[j] - reference[j].
     *
     * @throws ShapeMismatchException if the arrays do not both span the grid.
     */
    public static ErrorReport of(TimeGrid grid, double[] approximation, double[] reference) {
        if (approximation.length != grid.samples() || reference.length != grid.samples())
            throw new ShapeMismatchException("Cannot compare " + approximation.length + " samples against "
                    + reference.length + " reference samples on a grid of " + grid.samples());
        int n = approximation.length;
        double[] err = new double[n];
        double max = 0, sumSq = 0, sumAbs = 0;
        int at = 0;
        for (int j = 0; j < n; j++) {
            double e = approximation[j] - reference[j];
            err[j] = e;
            double a = Math.abs(e);
            if (a > max || Double.isNaN(a)) {
                max = a;
                at = j;
            }
            sumSq += e * e;
            sumAbs += a;
        }
        return new ErrorReport(grid, err, max, Math.sqrt(sumSq / n), sumAbs / n, at);
    }

    /** Copy of the signed pointwise error. */
    public double[] pointwise() {
        return pointwise.clone();
    }

    public double maxAbsError() {
        return maxAbs;
    }

    public double rmsError() {
        return rms;
    }

    public double meanAbsError() {
        return meanAbs;
    }

    /** Time at which the absolute error peaks. */
    public double timeOfMaxError() {
        return grid.time(argMax);
    }

    public int samples() {
        return pointwise.length;
    }

    @Override
    public String toString() {
        return String.format("ErrorReport[max=%.3e at t=%.4f, rms=%.3e, mean=%.3e, samples=%d]",
                maxAbs, timeOfMaxError(), rms, meanAbs, pointwise.length);
    }
}

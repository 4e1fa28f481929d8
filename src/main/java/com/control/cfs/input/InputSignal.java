package com.control.cfs.input;

import com.control.cfs.api.ShapeMismatchException;

import java.util.function.DoubleUnaryOperator;

/**
 * Samples of the m controlled input channels u1..um on a {@link TimeGrid}.
 *
 * Stored as one row per channel. The drift channel's input is the constant 1
 * and is never stored; {@link #channel(int)} with id 0 synthesises it.
 */
public final class InputSignal {
    private final TimeGrid grid;
    private final double[][] rows;

    private InputSignal(TimeGrid grid, double[][] rows) {
        this.grid = grid;
        this.rows = rows;
    }

    /**
     * Wraps sampled channels. Each row must have exactly
     * {@code grid.samples()} columns. Rows are copied.
     *
     * @throws ShapeMismatchException if a row length disagrees with the grid.
     */
    public static InputSignal of(TimeGrid grid, double[][] channels) {
        double[][] copy = new double[channels.length][];
        for (int i = 0; i < channels.length; i++) {
            if (channels[i].length != grid.samples())
                throw new ShapeMismatchException("Input channel u" + (i + 1) + " has " + channels[i].length
                        + " samples, time grid implies " + grid.samples());
            copy[i] = channels[i].clone();
        }
        return new InputSignal(grid, copy);
    }

    /** Samples each channel function u_i(t) on the grid. */
    public static InputSignal sample(TimeGrid grid, DoubleUnaryOperator... channels) {
        double[][] rows = new double[channels.length][grid.samples()];
        for (int i = 0; i < channels.length; i++)
            for (int j = 0; j < grid.samples(); j++)
                rows[i][j] = channels[i].applyAsDouble(grid.time(j));
        return new InputSignal(grid, rows);
    }

    /** An input whose m channels are all the constant {@code value}. */
    public static InputSignal constant(TimeGrid grid, int channels, double value) {
        double[][] rows = new double[channels][grid.samples()];
        for (double[] row : rows)
            java.util.Arrays.fill(row, value);
        return new InputSignal(grid, rows);
    }

    public TimeGrid grid() {
        return grid;
    }

    /** Number of controlled channels m. */
    public int channelCount() {
        return rows.length;
    }

    public int samples() {
        return grid.samples();
    }

    /**
     * Sample j of channel {@code symbol}: symbol 0 is the drift channel
     * (always 1), symbols 1..m are u1..um.
     */
    public double valueAt(int symbol, int j) {
        return symbol == 0 ? 1.0 : rows[symbol - 1][j];
    }

    /**
     * The samples of the channel driven by {@code symbol}. For the drift
     * symbol 0 a fresh array of ones is returned. Callers must not modify the
     * returned controlled-channel arrays.
     */
    public double[] channel(int symbol) {
        if (symbol == 0) {
            double[] ones = new double[grid.samples()];
            java.util.Arrays.fill(ones, 1.0);
            return ones;
        }
        if (symbol < 1 || symbol > rows.length)
            throw new IndexOutOfBoundsException("Channel x" + symbol + " outside [0, " + rows.length + "]");
        return rows[symbol - 1];
    }

    /**
     * Value of controlled channel u_i (1-based) at an arbitrary time, by
     * linear interpolation between samples. Times outside the grid clamp to
     * the first or last sample.
     */
    public double interpolate(int channel, double t) {
        double[] row = rows[channel - 1];
        double x = (t - grid.t0()) / grid.dt();
        if (x <= 0)
            return row[0];
        int last = row.length - 1;
        if (x >= last)
            return row[last];
        int j = (int) x;
        double w = x - j;
        return row[j] + w * (row[j + 1] - row[j]);
    }
}

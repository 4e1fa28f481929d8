package com.control.cfs.input;

import com.control.cfs.api.ConfigurationException;

/**
 * A uniform sampling grid t_j = t0 + j * dt for j = 0..samples-1.
 */
public final class TimeGrid {
    private static final double SPAN_TOLERANCE = 1e-9;

    private final double t0;
    private final double dt;
    private final int samples;

    private TimeGrid(double t0, double dt, int samples) {
        this.t0 = t0;
        this.dt = dt;
        this.samples = samples;
    }

    /**
     * Grid of {@code samples} points starting at {@code t0} with step {@code dt}.
     */
    public static TimeGrid of(double t0, double dt, int samples) {
        checkStep(dt);
        if (!Double.isFinite(t0))
            throw new ConfigurationException("Start time must be finite, got " + t0);
        if (samples < 1)
            throw new ConfigurationException("Time grid needs at least one sample, got " + samples);
        return new TimeGrid(t0, dt, samples);
    }

    /**
     * Grid covering [t0, tf] with step dt. The span must be an integral
     * multiple of dt.
     */
    public static TimeGrid span(double t0, double tf, double dt) {
        checkStep(dt);
        if (!(tf > t0))
            throw new ConfigurationException("End time " + tf + " must be after start time " + t0);
        double steps = (tf - t0) / dt;
        long n = Math.round(steps);
        if (Math.abs(steps - n) > SPAN_TOLERANCE * Math.max(1.0, steps))
            throw new ConfigurationException("Span [" + t0 + ", " + tf + "] is not a multiple of dt=" + dt);
        if (n + 1 > Integer.MAX_VALUE)
            throw new ConfigurationException("Time grid too long: " + (n + 1) + " samples");
        return new TimeGrid(t0, dt, (int) n + 1);
    }

    /**
     * Grid matching explicit sample times.
     *
     * @throws ConfigurationException if the times are not uniformly spaced.
     */
    public static TimeGrid fromTimes(double[] times) {
        if (times.length < 2)
            throw new ConfigurationException("Need at least two sample times to infer a step, got " + times.length);
        double dt = (times[times.length - 1] - times[0]) / (times.length - 1);
        checkStep(dt);
        for (int j = 1; j < times.length; j++) {
            double step = times[j] - times[j - 1];
            if (Math.abs(step - dt) > SPAN_TOLERANCE * Math.max(1.0, Math.abs(times[j])) + 1e-6 * dt)
                throw new ConfigurationException("Non-uniform time step at sample " + j + ": " + step
                        + " vs " + dt);
        }
        return new TimeGrid(times[0], dt, times.length);
    }

    private static void checkStep(double dt) {
        if (!(dt > 0) || !Double.isFinite(dt))
            throw new ConfigurationException("Time step must be > 0, got " + dt);
    }

    public double t0() {
        return t0;
    }

    public double dt() {
        return dt;
    }

    public int samples() {
        return samples;
    }

    /** Last grid time. */
    public double tf() {
        return time(samples - 1);
    }

    public double time(int j) {
        return t0 + j * dt;
    }

    public double[] times() {
        double[] t = new double[samples];
        for (int j = 0; j < samples; j++)
            t[j] = time(j);
        return t;
    }

    /** Grids are interchangeable when start, step and sample count agree. */
    public boolean sameAs(TimeGrid other) {
        return samples == other.samples
                && Math.abs(dt - other.dt) <= SPAN_TOLERANCE * dt
                && Math.abs(t0 - other.t0) <= SPAN_TOLERANCE * Math.max(1.0, Math.abs(t0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof TimeGrid g && samples == g.samples
                && Double.compare(t0, g.t0) == 0 && Double.compare(dt, g.dt) == 0;
    }

    @Override
    public int hashCode() {
        return (Double.hashCode(t0) * 31 + Double.hashCode(dt)) * 31 + samples;
    }

    @Override
    public String toString() {
        return "TimeGrid[t0=" + t0 + ", dt=" + dt + ", samples=" + samples + "]";
    }
}

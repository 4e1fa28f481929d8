package com.control.cfs.wiring;

import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.engine.OnlineIteratedIntegrals;
import com.control.cfs.table.CoefficientVector;
import com.control.cfs.util.ErrorRateLimiter;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that consumes input samples and streams the
 * truncated series output.
 *
 * Runs on a single dedicated consumer thread. For every {@link SampleEvent}:
 *
 * 1. Validation: the sample must carry exactly m finite channel values. A
 * bad sample is logged (rate limited) and dropped without advancing the
 * stream clock.
 *
 * 2. Integration: every iterated integral is advanced by one grid step.
 *
 * 3. Emission: F_c^N[u](t_j) = Σ_η (c, η) E_η(t_j) is formed and handed to
 * the callback when the event ends a batch, either because the Disruptor
 * says so (endOfBatch) or because the producer asked for it
 * (event.isBatchEnd()). With {@link #setEmitEverySample(boolean)} every
 * sample is emitted.
 *
 * The coefficients are fixed at construction: they depend only on z0, not on
 * the input.
 */
public final class SamplePublisher implements EventHandler<SampleEvent> {
    private static final Logger log = LogManager.getLogger(SamplePublisher.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final double[] coefficients;
    private final OnlineIteratedIntegrals integrals;
    private final double[] sample;

    private OutputCallback callback;
    private boolean emitEverySample;
    private double lastOutput;
    private long dropped;

    public SamplePublisher(CoefficientVector coefficients, OnlineIteratedIntegrals integrals) {
        if (!coefficients.index().equals(integrals.index()))
            throw new ShapeMismatchException("Coefficients (" + coefficients.index().signature()
                    + ") and integrals (" + integrals.index().signature() + ") use different word orderings");
        this.coefficients = coefficients.values();
        this.integrals = integrals;
        this.sample = new double[integrals.index().alphabet().controlledChannels()];
        this.lastOutput = coefficients.initialOutput();
    }

    /**
     * Sets the callback invoked with each emitted output value.
     */
    public void setOutputCallback(OutputCallback cb) {
        this.callback = cb;
    }

    public void setEmitEverySample(boolean emitEverySample) {
        this.emitEverySample = emitEverySample;
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch.
     */
    @Override
    public void onEvent(SampleEvent event, long sequence, boolean endOfBatch) {
        try {
            consume(event, endOfBatch);
        } finally {
            // Slot goes back to the ring buffer empty
            event.clear();
        }
    }

    private void consume(SampleEvent event, boolean endOfBatch) {
        if (event.channelCount() != sample.length) {
            drop(String.format("Sample %d has %d channels, expected %d", event.sequenceId(), event.channelCount(),
                    sample.length));
            return;
        }
        event.copyChannels(sample);
        for (int i = 0; i < sample.length; i++) {
            if (!Double.isFinite(sample[i])) {
                drop(String.format("Sample %d has non-finite u%d = %s", event.sequenceId(), i + 1, sample[i]));
                return;
            }
        }

        integrals.advance(sample);
        lastOutput = output();

        if (emitEverySample || event.isBatchEnd() || endOfBatch) {
            if (callback != null)
                callback.onOutput(integrals.samplesProcessed() - 1, integrals.currentTime(), lastOutput);
        }
    }

    /** Current F_c^N[u] value. */
    public double lastOutput() {
        return lastOutput;
    }

    public long samplesProcessed() {
        return integrals.samplesProcessed();
    }

    public long samplesDropped() {
        return dropped;
    }

    /** Restarts the stream at t0. */
    public void reset() {
        integrals.reset();
        lastOutput = coefficients[0];
        dropped = 0;
    }

    private double output() {
        double y = 0.0;
        for (int r = 0; r < coefficients.length; r++) {
            double c = coefficients[r];
            if (c != 0.0)
                y += c * integrals.valueAt(r);
        }
        return y;
    }

    private void drop(String message) {
        dropped++;
        errLimiter.log(message, null);
    }

    /**
     * Callback for emitted output values.
     */
    @FunctionalInterface
    public interface OutputCallback {
        /**
         * @param sampleIndex Grid index j of the sample.
         * @param time        t_j.
         * @param output      F_c^N[u](t_j).
         */
        void onOutput(long sampleIndex, double time, double output);
    }
}

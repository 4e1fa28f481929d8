package com.control.cfs.wiring;

/**
 * A mutable holder for one input sample, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every sample. The channel buffer is sized on first use and only
 * reallocated if the producer changes the channel count.
 *
 * Fields:
 * - channels: controlled inputs u1..um at the next grid time.
 * - batchEnd: forces the consumer to publish an output value after this
 * sample even if more samples are queued.
 */
public final class SampleEvent {
    private double[] channels = new double[0];
    private int channelCount;
    private boolean batchEnd;
    private long sequenceId;

    /**
     * Configures the event for one sample.
     *
     * @param u        Controlled inputs u1..um. Copied.
     * @param batchEnd If true, forces the consumer to emit after this sample.
     * @param seqId    The sequence ID (for correlation/logging).
     */
    public void set(double[] u, boolean batchEnd, long seqId) {
        if (channels.length < u.length)
            channels = new double[u.length];
        System.arraycopy(u, 0, channels, 0, u.length);
        this.channelCount = u.length;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    /** Single-input convenience. */
    public void set(double u, boolean batchEnd, long seqId) {
        if (channels.length < 1)
            channels = new double[1];
        channels[0] = u;
        this.channelCount = 1;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    public int channelCount() {
        return channelCount;
    }

    public double channel(int i) {
        if (i < 0 || i >= channelCount)
            throw new IndexOutOfBoundsException("Channel " + i + " outside [0, " + channelCount + ")");
        return channels[i];
    }

    /** Copies the channels into {@code out}, which must have {@link #channelCount()} entries. */
    public void copyChannels(double[] out) {
        System.arraycopy(channels, 0, out, 0, channelCount);
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    /** Resets the slot once the consumer is done with it. */
    public void clear() {
        channelCount = 0;
        batchEnd = false;
        sequenceId = 0;
    }
}

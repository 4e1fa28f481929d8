package com.control.cfs.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a {@link SamplePublisher} behind an LMAX Disruptor ring buffer.
 *
 * A single producer thread calls {@link #publish(double[], boolean)}; the
 * publisher runs on the Disruptor's daemon consumer thread. Samples are
 * consumed in publication order, which is grid order.
 */
public final class SampleStream implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(SampleStream.class);

    private final Disruptor<SampleEvent> disruptor;
    private final RingBuffer<SampleEvent> ringBuffer;
    private long published;

    private SampleStream(Disruptor<SampleEvent> disruptor) {
        this.disruptor = disruptor;
        this.ringBuffer = disruptor.start();
    }

    /**
     * Starts a single-producer ring buffer feeding {@code publisher}.
     *
     * @param bufferSize Ring size, a power of two.
     */
    public static SampleStream start(SamplePublisher publisher, int bufferSize) {
        if (Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("Ring buffer size must be a power of two, got " + bufferSize);
        Disruptor<SampleEvent> disruptor = new Disruptor<>(
                SampleEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        log.info("Sample stream started, ring buffer size {}", bufferSize);
        return new SampleStream(disruptor);
    }

    /**
     * Publishes the controlled inputs u1..um of the next grid sample.
     *
     * @param batchEnd If true, the consumer emits after this sample.
     */
    public void publish(double[] u, boolean batchEnd) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(u, batchEnd, published);
        } finally {
            ringBuffer.publish(sequence);
        }
        published++;
    }

    public long published() {
        return published;
    }

    /** Waits for every published sample to be consumed, then stops the consumer. */
    @Override
    public void close() {
        disruptor.shutdown();
        log.info("Sample stream stopped after {} samples", published);
    }
}

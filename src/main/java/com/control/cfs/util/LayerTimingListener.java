package com.control.cfs.util;

import com.control.cfs.api.LayerListener;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A listener that tracks how long each layer of each engine takes.
 *
 * <p>
 * Captures, per engine:
 * <ul>
 * <li><b>Layers:</b> word count and wall time of every depth of the last
 * computation.</li>
 * <li><b>Totals:</b> number of computations, total and last wall time.</li>
 * <li><b>Failures:</b> number of failed computations and the last failing
 * word.</li>
 * </ul>
 *
 * <p>
 * Both engines may report from different threads, so every method
 * synchronizes on the listener.
 */
public final class LayerTimingListener implements LayerListener {
    private static final Logger log = LogManager.getLogger(LayerTimingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Map<String, EngineStats> stats = new LinkedHashMap<>();

    private static final class EngineStats {
        final List<long[]> layers = new ArrayList<>(); // {depth, words, nanos}
        String signature;
        long computations, failures, totalNanos, lastNanos;
        int lastWords;
        Word lastFailedWord;
    }

    @Override
    public synchronized void onComputationStart(String engine, WordIndex index) {
        EngineStats s = stats.computeIfAbsent(engine, k -> new EngineStats());
        s.layers.clear();
        s.signature = index.signature();
    }

    @Override
    public synchronized void onLayerComputed(String engine, int depth, int words, long durationNanos) {
        stats.computeIfAbsent(engine, k -> new EngineStats()).layers.add(new long[] { depth, words, durationNanos });
    }

    @Override
    public synchronized void onLayerError(String engine, int depth, Word word, Throwable error) {
        EngineStats s = stats.computeIfAbsent(engine, k -> new EngineStats());
        s.failures++;
        s.lastFailedWord = word;
        errLimiter.log(String.format("%s failed at depth %d, word %s: %s", engine, depth, word, error.getMessage()),
                null);
    }

    @Override
    public synchronized void onComputationEnd(String engine, int totalWords, long durationNanos) {
        EngineStats s = stats.computeIfAbsent(engine, k -> new EngineStats());
        s.computations++;
        s.totalNanos += durationNanos;
        s.lastNanos = durationNanos;
        s.lastWords = totalWords;
    }

    public synchronized long computations(String engine) {
        EngineStats s = stats.get(engine);
        return s == null ? 0 : s.computations;
    }

    public synchronized long failures(String engine) {
        EngineStats s = stats.get(engine);
        return s == null ? 0 : s.failures;
    }

    /** Word that broke the last failed computation of {@code engine}, or null. */
    public synchronized Word lastFailedWord(String engine) {
        EngineStats s = stats.get(engine);
        return s == null ? null : s.lastFailedWord;
    }

    /** Depths reported by the last computation of {@code engine}, in order. */
    public synchronized int[] layerDepths(String engine) {
        EngineStats s = stats.get(engine);
        if (s == null)
            return new int[0];
        int[] out = new int[s.layers.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = (int) s.layers.get(i)[0];
        return out;
    }

    /** Words per layer of the last computation of {@code engine}. */
    public synchronized int[] layerWords(String engine) {
        EngineStats s = stats.get(engine);
        if (s == null)
            return new int[0];
        int[] out = new int[s.layers.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = (int) s.layers.get(i)[1];
        return out;
    }

    public synchronized double lastDurationMicros(String engine) {
        EngineStats s = stats.get(engine);
        return s == null ? 0 : s.lastNanos / 1000.0;
    }

    public synchronized double avgDurationMicros(String engine) {
        EngineStats s = stats.get(engine);
        return s == null || s.computations == 0 ? 0 : s.totalNanos / 1000.0 / s.computations;
    }

    public synchronized void reset() {
        stats.clear();
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, EngineStats> e : stats.entrySet()) {
            EngineStats s = e.getValue();
            sb.append(String.format("%s [%s] runs=%d failures=%d avg=%.2f us%n", e.getKey(), s.signature,
                    s.computations, s.failures, avgDurationMicros(e.getKey())));
            sb.append(String.format("  %-6s | %10s | %12s%n", "Depth", "Words", "Time (us)"));
            sb.append("  ----------------------------------\n");
            for (long[] layer : s.layers)
                sb.append(String.format("  %-6d | %10d | %12.2f%n", layer[0], layer[1], layer[2] / 1000.0));
        }
        return sb.toString();
    }
}

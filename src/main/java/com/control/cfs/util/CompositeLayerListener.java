package com.control.cfs.util;

import com.control.cfs.api.LayerListener;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

import java.util.Arrays;

/**
 * Aggregates multiple {@link LayerListener} instances. Listeners are called
 * in registration order.
 */
public class CompositeLayerListener implements LayerListener {
    private LayerListener[] listeners = new LayerListener[0];

    public CompositeLayerListener add(LayerListener listener) {
        LayerListener[] old = listeners;
        LayerListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onComputationStart(String engine, WordIndex index) {
        for (LayerListener l : listeners)
            l.onComputationStart(engine, index);
    }

    @Override
    public void onLayerComputed(String engine, int depth, int words, long durationNanos) {
        for (LayerListener l : listeners)
            l.onLayerComputed(engine, depth, words, durationNanos);
    }

    @Override
    public void onLayerError(String engine, int depth, Word word, Throwable error) {
        for (LayerListener l : listeners)
            l.onLayerError(engine, depth, word, error);
    }

    @Override
    public void onComputationEnd(String engine, int totalWords, long durationNanos) {
        for (LayerListener l : listeners)
            l.onComputationEnd(engine, totalWords, durationNanos);
    }
}

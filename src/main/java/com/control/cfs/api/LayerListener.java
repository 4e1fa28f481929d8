package com.control.cfs.api;

import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

/**
 * Observability interface for the layer-by-layer table construction.
 *
 * Both recursion engines report through this interface: one callback when a
 * computation starts, one per finished layer, one on failure and one at the
 * end. This is the hook for:
 *
 * - Profiling: how long each depth takes, which grows (m+1)-fold per layer.
 * - Debugging: which depth and word broke a Lie-derivative recursion.
 * - Sizing: how many words a given truncation depth materialises.
 *
 * Callbacks run on the computing thread, between layers. They must not block.
 */
public interface LayerListener {

    /**
     * Called before layer 0 is materialised.
     *
     * @param engine Name of the reporting engine.
     * @param index  The word layout being filled.
     */
    void onComputationStart(String engine, WordIndex index);

    /**
     * Called after every word of one layer has been computed.
     *
     * @param engine        Name of the reporting engine.
     * @param depth         Word length of the finished layer.
     * @param words         Number of words in the layer.
     * @param durationNanos Wall time spent on the layer.
     */
    void onLayerComputed(String engine, int depth, int words, long durationNanos);

    /**
     * Called when a layer fails. The computation is abandoned afterwards and
     * no table is returned.
     *
     * @param engine Name of the reporting engine.
     * @param depth  Word length of the layer being built.
     * @param word   The word whose entry failed, or null if unknown.
     * @param error  The failure.
     */
    void onLayerError(String engine, int depth, Word word, Throwable error);

    /**
     * Called when the whole table has been built.
     *
     * @param engine        Name of the reporting engine.
     * @param totalWords    Number of rows in the finished table.
     * @param durationNanos Wall time of the computation.
     */
    void onComputationEnd(String engine, int totalWords, long durationNanos);
}

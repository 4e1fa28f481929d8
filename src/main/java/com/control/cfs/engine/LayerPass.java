package com.control.cfs.engine;

import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

/**
 * Runs one layer of a recursion over the rows of the previous layer.
 *
 * Rows of one layer are independent: each task reads only the previous
 * layer and writes only its own block of the next one, so the pass may fan
 * out across the common fork-join pool. The first failure is rethrown once
 * the pass has drained.
 */
final class LayerPass {
    // Below this many parent rows, fan-out costs more than it saves.
    static final int PARALLEL_THRESHOLD = 64;

    private LayerPass() {
    }

    @FunctionalInterface
    interface RowTask {
        void run(int row);
    }

    static void forEachRow(int start, int end, boolean parallel, RowTask task) {
        if (!parallel || end - start < PARALLEL_THRESHOLD) {
            for (int r = start; r < end; r++)
                task.run(r);
            return;
        }
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        IntStream.range(start, end).parallel().forEach(r -> {
            if (failure.get() != null)
                return;
            try {
                task.run(r);
            } catch (RuntimeException e) {
                failure.compareAndSet(null, e);
            }
        });
        RuntimeException e = failure.get();
        if (e != null)
            throw e;
    }
}

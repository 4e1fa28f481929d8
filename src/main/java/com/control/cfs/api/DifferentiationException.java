package com.control.cfs.api;

import com.control.cfs.word.Word;

/**
 * An output or vector-field expression could not be differentiated while
 * building the Lie-derivative table.
 *
 * Carries the depth being built and the word whose entry failed so the caller
 * can shorten the truncation depth or fix the expression.
 */
public class DifferentiationException extends ChenFliessException {
    private final int depth;
    private final Word word;

    public DifferentiationException(int depth, Word word, Throwable cause) {
        super("Differentiation failed at depth " + depth + " for word " + word + ": " + cause.getMessage(), cause);
        this.depth = depth;
        this.word = word;
    }

    public int depth() {
        return depth;
    }

    public Word word() {
        return word;
    }
}

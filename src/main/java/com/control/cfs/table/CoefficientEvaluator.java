package com.control.cfs.table;

import com.control.cfs.api.CompiledExpr;
import com.control.cfs.api.ConfigurationException;
import com.control.cfs.word.WordIndex;

/**
 * Compiled depth-N Lie-derivative evaluator: a pure function from a state
 * vector to the coefficient of every word.
 *
 * Built once from a {@link LieDerivativeTable}; every entry is a closure, so
 * evaluating at a new state performs no differentiation and walks no tree.
 * Safe to share across threads.
 */
public final class CoefficientEvaluator {
    private final WordIndex index;
    private final int stateDimension;
    private final CompiledExpr[] entries;

    CoefficientEvaluator(WordIndex index, int stateDimension, CompiledExpr[] entries) {
        this.index = index;
        this.stateDimension = stateDimension;
        this.entries = entries;
    }

    public WordIndex index() {
        return index;
    }

    public int stateDimension() {
        return stateDimension;
    }

    /** Coefficients L_η h(z) for every word, as a new vector. */
    public CoefficientVector evaluate(double[] z) {
        double[] out = new double[entries.length];
        evaluateInto(z, out);
        return new CoefficientVector(index, z, out);
    }

    /**
     * Writes L_η h(z) for every word into {@code out} in row order. Zero
     * allocation.
     */
    public void evaluateInto(double[] z, double[] out) {
        if (z.length != stateDimension)
            throw new ConfigurationException("State vector has " + z.length + " components, expected "
                    + stateDimension);
        if (out.length != entries.length)
            throw new IllegalArgumentException("Output buffer has " + out.length + " slots, need " + entries.length);
        for (int r = 0; r < entries.length; r++)
            out[r] = entries[r].evaluate(z);
    }

    /** Coefficient of the single word at {@code row}. */
    public double evaluate(int row, double[] z) {
        if (z.length != stateDimension)
            throw new ConfigurationException("State vector has " + z.length + " components, expected "
                    + stateDimension);
        return entries[row].evaluate(z);
    }
}

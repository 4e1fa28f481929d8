package com.control.cfs.table;

import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

/**
 * Numeric series coefficients (c, η) = L_η h(z0) for every word of a
 * {@link WordIndex}, evaluated at one state z0.
 *
 * The ε entry is h(z0), the zeroth-order term of the series.
 */
public final class CoefficientVector {
    private final WordIndex index;
    private final double[] state;
    private final double[] values;

    /** Adopts {@code values}; the array must not be modified afterwards. */
    public CoefficientVector(WordIndex index, double[] state, double[] values) {
        if (values.length != index.size())
            throw new IllegalArgumentException("Coefficient vector has " + values.length + " entries, index "
                    + index.signature() + " needs " + index.size());
        this.index = index;
        this.state = state.clone();
        this.values = values;
    }

    public WordIndex index() {
        return index;
    }

    /** Copy of the state the coefficients were evaluated at. */
    public double[] state() {
        return state.clone();
    }

    public int size() {
        return values.length;
    }

    public double valueAt(int row) {
        return values[row];
    }

    public double valueAt(Word word) {
        return values[index.row(word)];
    }

    /** h(z0). */
    public double initialOutput() {
        return values[0];
    }

    public double[] values() {
        return values.clone();
    }

    /** Number of coefficients that are exactly zero. */
    public int zeroCount() {
        int z = 0;
        for (double v : values)
            if (v == 0.0)
                z++;
        return z;
    }
}

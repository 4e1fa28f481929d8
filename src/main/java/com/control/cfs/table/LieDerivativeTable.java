package com.control.cfs.table;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.expr.Expr;
import com.control.cfs.expr.ExprCompiler;
import com.control.cfs.expr.Variable;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

import java.util.List;

/**
 * Symbolic Lie derivatives L_η h(z) for every word of a {@link WordIndex}.
 *
 * Immutable once built. Two evaluation paths:
 * <ul>
 * <li>{@link #evaluate(double[])} interprets every tree at one state, for
 * one-off use.</li>
 * <li>{@link #compile()} builds a {@link CoefficientEvaluator} once and
 * caches it on the table, for repeated evaluation at many states.</li>
 * </ul>
 */
public final class LieDerivativeTable {
    private final WordIndex index;
    private final List<Variable> state;
    private final Expr[] entries;

    private volatile CoefficientEvaluator evaluator;

    /**
     * Adopts fully built entries. Intended for the Lie-derivative engine; the
     * array is not copied and must not be modified afterwards.
     */
    public LieDerivativeTable(WordIndex index, List<Variable> state, Expr[] entries) {
        if (entries.length != index.size())
            throw new ShapeMismatchException("Lie table has " + entries.length + " entries, index "
                    + index.signature() + " needs " + index.size());
        this.index = index;
        this.state = List.copyOf(state);
        this.entries = entries;
    }

    public WordIndex index() {
        return index;
    }

    public List<Variable> state() {
        return state;
    }

    public int depth() {
        return index.depth();
    }

    public int size() {
        return entries.length;
    }

    public Expr entry(int row) {
        return entries[row];
    }

    public Expr entry(Word word) {
        return entries[index.row(word)];
    }

    /** Interprets every entry at {@code z}. */
    public CoefficientVector evaluate(double[] z) {
        if (z.length != state.size())
            throw new ConfigurationException("State vector has " + z.length + " components, expected "
                    + state.size());
        double[] out = new double[entries.length];
        for (int r = 0; r < entries.length; r++)
            out[r] = entries[r].evaluate(z);
        return new CoefficientVector(index, z, out);
    }

    /** The compiled evaluator for this table, built on first use. */
    public CoefficientEvaluator compile() {
        CoefficientEvaluator e = evaluator;
        if (e == null) {
            synchronized (this) {
                e = evaluator;
                if (e == null) {
                    e = new CoefficientEvaluator(index, state.size(), ExprCompiler.compileAll(entries));
                    evaluator = e;
                }
            }
        }
        return e;
    }
}

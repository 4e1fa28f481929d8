package com.control.cfs.table;

import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.engine.IntegrationRule;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

/**
 * E_η[u](t) for every word η of a {@link WordIndex}, one time series per row.
 *
 * Immutable once built. Rows are stored as one array per word, laid out in
 * index order, so layer k is the contiguous row range
 * [index.layerStart(k), index.layerEnd(k)).
 */
public final class IteratedIntegralTable {
    private final WordIndex index;
    private final TimeGrid grid;
    private final IntegrationRule rule;
    private final double[][] rows;

    /**
     * Adopts fully built rows. Intended for the integral engines; the arrays
     * are not copied and must not be modified afterwards.
     */
    public IteratedIntegralTable(WordIndex index, TimeGrid grid, IntegrationRule rule, double[][] rows) {
        if (rows.length != index.size())
            throw new ShapeMismatchException("Integral table has " + rows.length + " rows, index "
                    + index.signature() + " needs " + index.size());
        for (int r = 0; r < rows.length; r++) {
            if (rows[r] == null || rows[r].length != grid.samples())
                throw new ShapeMismatchException("Row " + r + " (" + index.word(r) + ") does not span "
                        + grid.samples() + " samples");
        }
        this.index = index;
        this.grid = grid;
        this.rule = rule;
        this.rows = rows;
    }

    public WordIndex index() {
        return index;
    }

    public TimeGrid grid() {
        return grid;
    }

    public IntegrationRule rule() {
        return rule;
    }

    public int depth() {
        return index.depth();
    }

    /** Number of words (rows). */
    public int size() {
        return rows.length;
    }

    public int samples() {
        return grid.samples();
    }

    /** E at row {@code row}, sample {@code j}. Zero allocation. */
    public double valueAt(int row, int j) {
        return rows[row][j];
    }

    public double valueAt(Word word, int j) {
        return rows[index.row(word)][j];
    }

    /** Copy of the time series of the word at {@code row}. */
    public double[] series(int row) {
        return rows[row].clone();
    }

    /** Copy of the time series of {@code word}. */
    public double[] series(Word word) {
        return series(index.row(word));
    }

    /** Values of every word at sample {@code j}, in row order. */
    public double[] column(int j) {
        double[] col = new double[rows.length];
        for (int r = 0; r < rows.length; r++)
            col[r] = rows[r][j];
        return col;
    }
}

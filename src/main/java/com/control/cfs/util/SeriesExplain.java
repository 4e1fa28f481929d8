package com.control.cfs.util;

import com.control.cfs.ChenFliessSeries;
import com.control.cfs.table.CoefficientVector;
import com.control.cfs.table.IteratedIntegralTable;
import com.control.cfs.table.LieDerivativeTable;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

/**
 * Diagnostic utility for inspecting a truncated series.
 *
 * <p>
 * Generates human-readable dumps of the word layout, the symbolic Lie
 * derivatives, numeric coefficients and iterated-integral tables.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and logging. Every dump
 * allocates strings and walks whole tables; keep it off the hot path.
 */
public final class SeriesExplain {
    private final ChenFliessSeries series;
    private final WordIndex index;

    public SeriesExplain(ChenFliessSeries series) {
        this.series = series;
        this.index = series.index();
    }

    /**
     * Dumps everything known about a single word.
     */
    public String explainWord(Word word) {
        int row = index.row(word);
        LieDerivativeTable lie = series.lieDerivatives();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Word: ").append(word).append('\n')
                .append("  Row: ").append(row).append('\n')
                .append("  Length: ").append(word.length()).append('\n');
        if (row > 0)
            sb.append("  Parent: ").append(index.word(index.parentRow(row)))
                    .append(" via x").append(index.symbolOf(row)).append('\n');
        sb.append("  L_").append(word).append(" h = ").append(lie.entry(row)).append('\n');
        return sb.toString();
    }

    /**
     * Dumps the word layout, one layer per line.
     */
    public String dumpWordIndex() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("WordIndex ").append(index.signature()).append(" (").append(index.size()).append(" words):\n");
        for (int k = 0; k <= index.depth(); k++) {
            sb.append("  [").append(k).append("] rows ").append(index.layerStart(k)).append("..")
                    .append(index.layerEnd(k) - 1).append(": ");
            int end = index.layerEnd(k);
            for (int r = index.layerStart(k); r < end; r++) {
                sb.append(index.word(r));
                if (r < end - 1)
                    sb.append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps every symbolic Lie derivative in row order.
     */
    public String dumpLieDerivatives() {
        LieDerivativeTable lie = series.lieDerivatives();
        StringBuilder sb = new StringBuilder(2048);
        sb.append("Lie derivatives of h = ").append(series.system().output()).append(":\n");
        for (int r = 0; r < lie.size(); r++)
            sb.append(String.format("  %5d  %-12s %s%n", r, index.word(r), lie.entry(r)));
        return sb.toString();
    }

    /**
     * Dumps the coefficients at one state, skipping vanishing ones.
     */
    public String dumpCoefficients(CoefficientVector coefficients) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Coefficients at z0 = ").append(java.util.Arrays.toString(coefficients.state()))
                .append(" (").append(coefficients.zeroCount()).append(" of ").append(coefficients.size())
                .append(" vanish):\n");
        for (int r = 0; r < coefficients.size(); r++) {
            double c = coefficients.valueAt(r);
            if (c != 0.0)
                sb.append(String.format("  %5d  %-12s % .6e%n", r, index.word(r), c));
        }
        return sb.toString();
    }

    /**
     * Summarises an integral table by the final value of every word.
     */
    public String dumpIntegrals(IteratedIntegralTable integrals) {
        StringBuilder sb = new StringBuilder(1024);
        int last = integrals.samples() - 1;
        sb.append("Iterated integrals over ").append(integrals.grid()).append(", rule=")
                .append(integrals.rule()).append(", at t=").append(integrals.grid().time(last)).append(":\n");
        for (int r = 0; r < integrals.size(); r++)
            sb.append(String.format("  %5d  %-12s % .6e%n", r, index.word(r), integrals.valueAt(r, last)));
        return sb.toString();
    }
}

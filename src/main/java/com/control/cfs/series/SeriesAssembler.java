package com.control.cfs.series;

import com.control.cfs.api.ShapeMismatchException;
import com.control.cfs.table.CoefficientVector;
import com.control.cfs.table.IteratedIntegralTable;
import com.control.cfs.table.LieDerivativeTable;
import com.control.cfs.word.WordIndex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Combines coefficients and iterated integrals into the truncated
 * Chen-Fliess series
 *
 * <pre>
 * F_c^N[u](t) = h(z0) + Σ_{1 ≤ |η| ≤ N} L_η h(z0) E_η[u](t)
 * </pre>
 *
 * The pairing is positional: row r of the coefficients multiplies row r of
 * the integrals. Both inputs must therefore come from equal
 * {@link WordIndex} instances; anything else is rejected before a single
 * product is formed.
 */
public final class SeriesAssembler {
    private static final Logger log = LogManager.getLogger(SeriesAssembler.class);

    private SeriesAssembler() {
    }

    /** Assembles with the ε coefficient, h(z0), as the zeroth-order term. */
    public static TruncatedSeries assemble(CoefficientVector coefficients, IteratedIntegralTable integrals) {
        return assemble(coefficients, integrals, coefficients.initialOutput());
    }

    /**
     * Assembles with an explicitly supplied zeroth-order term.
     *
     * @throws ShapeMismatchException if the two inputs were built under
     *                                different word indexes.
     */
    public static TruncatedSeries assemble(CoefficientVector coefficients, IteratedIntegralTable integrals,
            double initialOutput) {
        WordIndex index = checkAligned(coefficients.index(), integrals.index());

        final int samples = integrals.samples();
        double[][] contributions = new double[index.depth() + 1][samples];
        java.util.Arrays.fill(contributions[0], initialOutput);

        int skipped = 0;
        for (int k = 1; k <= index.depth(); k++) {
            double[] acc = contributions[k];
            for (int r = index.layerStart(k); r < index.layerEnd(k); r++) {
                double c = coefficients.valueAt(r);
                // Vanishing Lie derivatives are common (e.g. zero drift)
                if (c == 0.0) {
                    skipped++;
                    continue;
                }
                for (int j = 0; j < samples; j++)
                    acc[j] += c * integrals.valueAt(r, j);
            }
        }
        log.debug("Assembled series for {}: {} of {} terms vanish", index.signature(), skipped, index.size() - 1);
        return new TruncatedSeries(integrals.grid(), contributions);
    }

    /** Evaluates {@code lie} at {@code z0} and assembles. */
    public static TruncatedSeries assemble(LieDerivativeTable lie, IteratedIntegralTable integrals, double[] z0) {
        checkAligned(lie.index(), integrals.index());
        return assemble(lie.compile().evaluate(z0), integrals);
    }

    private static WordIndex checkAligned(WordIndex coefficients, WordIndex integrals) {
        if (!coefficients.equals(integrals))
            throw new ShapeMismatchException("Coefficient table (" + coefficients.signature()
                    + ") and integral table (" + integrals.signature() + ") use different word orderings");
        return coefficients;
    }
}

package com.control.cfs.engine;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.LayerListener;
import com.control.cfs.input.InputSignal;
import com.control.cfs.table.IteratedIntegralTable;
import com.control.cfs.word.Alphabet;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the iterated integrals E_η[u](t) of an input signal for every word
 * up to the truncation depth.
 *
 * Algorithm (Chen's identity, layer by layer):
 *
 * 1. Layer 0: E_ε(t) = 1 on every sample.
 *
 * 2. Layer k -> k+1: the "channel matrix" (drift channel of ones plus the m
 * sampled inputs, in alphabet order) is combined with the "integral matrix"
 * (every row of layer k). Each channel is multiplied pointwise against every
 * existing row and the product is cumulatively integrated:
 * E_{x_i η}(t) = ∫_{t0}^{t} u_i(τ) E_η(τ) dτ.
 * Each layer k row is read once per channel; shared sub-integrals are never
 * recomputed per word.
 *
 * 3. Placement: the result for x_p η is written at the row the
 * {@link WordIndex} assigns it, so the table lines up with any other table
 * built from an equal index.
 *
 * Layer k+1 only reads layer k, and every new row is a fresh array, so rows
 * inside a layer may be computed in parallel ({@link #setParallel(boolean)}).
 *
 * Fail fast: invalid shapes are rejected before layer 0; a failure inside a
 * layer is reported to the listener and rethrown. No partial table is ever
 * returned.
 */
public final class IteratedIntegralEngine {
    private static final Logger log = LogManager.getLogger(IteratedIntegralEngine.class);
    static final String NAME = "iterated-integrals";

    private final IntegrationRule rule;
    private boolean parallel;
    private LayerListener listener;

    public IteratedIntegralEngine() {
        this(IntegrationRule.TRAPEZOID);
    }

    public IteratedIntegralEngine(IntegrationRule rule) {
        if (rule == null)
            throw new ConfigurationException("Integration rule must not be null");
        this.rule = rule;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public void setListener(LayerListener listener) {
        this.listener = listener;
    }

    public IntegrationRule rule() {
        return rule;
    }

    /**
     * Computes every iterated integral up to {@code depth} over the standard
     * alphabet x0..xm, m being the input's channel count.
     */
    public IteratedIntegralTable compute(InputSignal input, int depth) {
        return compute(input, WordIndex.of(Alphabet.standard(input.channelCount()), depth));
    }

    /**
     * Computes every iterated integral of {@code index}.
     *
     * @throws ConfigurationException if the alphabet size is not the input's
     *                                channel count plus one.
     */
    public IteratedIntegralTable compute(InputSignal input, WordIndex index) {
        checkChannels(input, index.alphabet());

        final int samples = input.samples();
        final double dt = input.grid().dt();
        final int size = index.alphabet().size();
        final LayerListener l = this.listener;
        final long computationStart = System.nanoTime();

        if (l != null)
            l.onComputationStart(NAME, index);
        log.debug("Computing iterated integrals for {} over {} samples (dt={}, rule={})",
                index.signature(), samples, dt, rule);

        // Channel matrix in alphabet order; position p drives the symbol at p.
        final double[][] channels = new double[size][];
        for (int p = 0; p < size; p++)
            channels[p] = input.channel(index.alphabet().symbolAt(p));

        final double[][] rows = new double[index.size()][];
        rows[0] = new double[samples];
        java.util.Arrays.fill(rows[0], 1.0);
        if (l != null)
            l.onLayerComputed(NAME, 0, 1, System.nanoTime() - computationStart);

        for (int k = 0; k < index.depth(); k++) {
            final int start = index.layerStart(k);
            final int next = index.layerStart(k + 1);
            final long layerStart = System.nanoTime();
            try {
                LayerPass.forEachRow(start, index.layerEnd(k), parallel, r -> {
                    final double[] parent = rows[r];
                    final int base = next + (r - start) * size;
                    for (int p = 0; p < size; p++) {
                        double[] out = new double[samples];
                        rule.integrateProduct(channels[p], parent, dt, out);
                        rows[base + p] = out;
                    }
                });
            } catch (RuntimeException e) {
                if (l != null)
                    l.onLayerError(NAME, k + 1, null, e);
                throw e;
            }
            if (l != null)
                l.onLayerComputed(NAME, k + 1, index.layerSize(k + 1), System.nanoTime() - layerStart);
        }

        IteratedIntegralTable table = new IteratedIntegralTable(index, input.grid(), rule, rows);
        if (l != null)
            l.onComputationEnd(NAME, table.size(), System.nanoTime() - computationStart);
        return table;
    }

    /**
     * Iterated integral of a single word, integrating from its rightmost letter
     * outwards. Produces the same values as the word's row in
     * {@link #compute(InputSignal, WordIndex)} without materialising any other
     * word.
     */
    public double[] computeWord(InputSignal input, Word word) {
        if (word.maxSymbol() > input.channelCount())
            throw new ConfigurationException("Word " + word + " uses a channel beyond the input's "
                    + input.channelCount() + " controlled channels");
        final int samples = input.samples();
        final double dt = input.grid().dt();
        double[] e = new double[samples];
        java.util.Arrays.fill(e, 1.0);
        for (int i = word.length() - 1; i >= 0; i--) {
            double[] out = new double[samples];
            rule.integrateProduct(input.channel(word.symbolAt(i)), e, dt, out);
            e = out;
        }
        return e;
    }

    static void checkChannels(InputSignal input, Alphabet alphabet) {
        if (alphabet.controlledChannels() != input.channelCount())
            throw new ConfigurationException("Alphabet " + alphabet + " expects " + alphabet.controlledChannels()
                    + " controlled channels, input has " + input.channelCount());
    }
}

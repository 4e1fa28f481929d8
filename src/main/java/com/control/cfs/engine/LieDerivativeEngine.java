package com.control.cfs.engine;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.DifferentiationException;
import com.control.cfs.api.Differentiator;
import com.control.cfs.api.LayerListener;
import com.control.cfs.expr.Expr;
import com.control.cfs.expr.Exprs;
import com.control.cfs.expr.NonDifferentiableException;
import com.control.cfs.expr.SymbolicDifferentiator;
import com.control.cfs.system.ControlAffineSystem;
import com.control.cfs.table.CoefficientEvaluator;
import com.control.cfs.table.LieDerivativeTable;
import com.control.cfs.word.Alphabet;
import com.control.cfs.word.Word;
import com.control.cfs.word.WordIndex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the Lie-derivative coefficients (c, η) of a system's output for every
 * word up to the truncation depth.
 *
 * Word convention: E_{x_i η} = ∫ u_i E_η, so the leftmost letter of a word is
 * its outermost integral. The matching coefficient applies the leftmost
 * letter's field first:
 * (c, x_i1 x_i2 ... x_ik) = L_{g_ik} ... L_{g_i2} L_{g_i1} h.
 *
 * Algorithm (directional-derivative recursion, layer by layer):
 *
 * 1. Layer 0: (c, ε) = h.
 *
 * 2. Layer k -> k+1: for every row η of layer k, the gradient ∂(c, η)/∂z is
 * requested from the {@link Differentiator} exactly once, then dotted with
 * every vector field in alphabet order:
 * (c, η x_i) = (∂(c, η)/∂z) · g_i(z).
 * The m+1 results land on the rows {@link WordIndex#appendRow(int, int)}
 * assigns to the right extensions of η, so the table is keyed exactly like
 * the iterated-integral table and the two combine row by row.
 *
 * 3. The table keeps the expressions. Numeric coefficients come either from
 * interpreting them once ({@link LieDerivativeTable#evaluate(double[])}) or
 * from a compiled evaluator built once and reused at any number of states
 * ({@link #compileEvaluator(ControlAffineSystem, WordIndex)}).
 *
 * Fail fast: a gradient that cannot be formed aborts the computation with a
 * {@link DifferentiationException} naming the depth being built and the word
 * whose entry failed to differentiate.
 */
public final class LieDerivativeEngine {
    private static final Logger log = LogManager.getLogger(LieDerivativeEngine.class);
    static final String NAME = "lie-derivatives";

    private final Differentiator differentiator;
    private boolean parallel;
    private LayerListener listener;

    public LieDerivativeEngine() {
        this(SymbolicDifferentiator.INSTANCE);
    }

    public LieDerivativeEngine(Differentiator differentiator) {
        if (differentiator == null)
            throw new ConfigurationException("Differentiator must not be null");
        this.differentiator = differentiator;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public void setListener(LayerListener listener) {
        this.listener = listener;
    }

    /**
     * Computes every Lie derivative up to {@code depth} over the standard
     * alphabet x0..xm of the system.
     */
    public LieDerivativeTable compute(ControlAffineSystem system, int depth) {
        return compute(system, WordIndex.of(Alphabet.standard(system.controlledChannels()), depth));
    }

    /**
     * Computes every Lie derivative of {@code index}.
     *
     * @throws ConfigurationException   if the alphabet size differs from the
     *                                  system's field count.
     * @throws DifferentiationException if an entry cannot be differentiated.
     */
    public LieDerivativeTable compute(ControlAffineSystem system, WordIndex index) {
        checkFields(system, index.alphabet());

        final Alphabet alphabet = index.alphabet();
        final int size = alphabet.size();
        final LayerListener l = this.listener;
        final long computationStart = System.nanoTime();

        if (l != null)
            l.onComputationStart(NAME, index);
        log.debug("Computing Lie derivatives for {} over {} states", index.signature(), system.stateDimension());

        // Field vectors in alphabet order; position p holds g_{symbolAt(p)}.
        final Expr[][] fields = new Expr[size][];
        for (int p = 0; p < size; p++)
            fields[p] = system.field(alphabet.symbolAt(p));

        final Expr[] entries = new Expr[index.size()];
        entries[0] = system.output();
        if (l != null)
            l.onLayerComputed(NAME, 0, 1, System.nanoTime() - computationStart);

        for (int k = 0; k < index.depth(); k++) {
            final int start = index.layerStart(k);
            final int next = index.layerStart(k + 1);
            final int stride = index.layerSize(k);
            final int depth = k + 1;
            final long layerStart = System.nanoTime();
            try {
                LayerPass.forEachRow(start, index.layerEnd(k), parallel, r -> {
                    Expr[] grad = gradient(entries[r], system, depth, index.word(r));
                    // η x_p sits at next + local(η) + p * |layer k|
                    final int base = next + (r - start);
                    for (int p = 0; p < size; p++)
                        entries[base + p * stride] = Exprs.dot(grad, fields[p]);
                });
            } catch (DifferentiationException e) {
                if (l != null)
                    l.onLayerError(NAME, e.depth(), e.word(), e);
                throw e;
            } catch (RuntimeException e) {
                if (l != null)
                    l.onLayerError(NAME, depth, null, e);
                throw e;
            }
            if (l != null)
                l.onLayerComputed(NAME, depth, index.layerSize(depth), System.nanoTime() - layerStart);
        }

        LieDerivativeTable table = new LieDerivativeTable(index, system.state(), entries);
        if (l != null)
            l.onComputationEnd(NAME, table.size(), System.nanoTime() - computationStart);
        return table;
    }

    /**
     * Builds the depth-N table and compiles it into a reusable numeric
     * evaluator. All symbolic work happens here, once.
     */
    public CoefficientEvaluator compileEvaluator(ControlAffineSystem system, WordIndex index) {
        return compute(system, index).compile();
    }

    /**
     * Coefficient of a single word, applying fields from its leftmost letter
     * inwards: (c, x_i1 ... x_ik) = L_{g_ik}( ... L_{g_i1} h). Produces the
     * same expression as the word's row in
     * {@link #compute(ControlAffineSystem, WordIndex)} without building any
     * other word.
     */
    public Expr computeWord(ControlAffineSystem system, Word word) {
        if (word.maxSymbol() > system.controlledChannels())
            throw new ConfigurationException("Word " + word + " uses a field beyond the system's "
                    + system.controlledChannels() + " controlled fields");
        Expr acc = system.output();
        int[] prefix = new int[0];
        for (int i = 0; i < word.length(); i++) {
            int symbol = word.symbolAt(i);
            Expr[] grad = gradient(acc, system, i + 1, Word.of(prefix));
            acc = Exprs.dot(grad, system.field(symbol));
            prefix = java.util.Arrays.copyOf(prefix, i + 1);
            prefix[i] = symbol;
        }
        return acc;
    }

    private Expr[] gradient(Expr f, ControlAffineSystem system, int depth, Word word) {
        try {
            return differentiator.gradient(f, system.state());
        } catch (NonDifferentiableException | ArithmeticException e) {
            throw new DifferentiationException(depth, word, e);
        }
    }

    static void checkFields(ControlAffineSystem system, Alphabet alphabet) {
        if (alphabet.size() != system.alphabetSize())
            throw new ConfigurationException("Alphabet " + alphabet + " has " + alphabet.size()
                    + " symbols, system has " + system.alphabetSize() + " vector fields");
    }
}

package com.control.cfs.dsl;

import com.control.cfs.ChenFliessSeries;
import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.Differentiator;
import com.control.cfs.api.LayerListener;
import com.control.cfs.engine.IntegrationRule;
import com.control.cfs.engine.IteratedIntegralEngine;
import com.control.cfs.engine.LieDerivativeEngine;
import com.control.cfs.expr.Expr;
import com.control.cfs.expr.SymbolicDifferentiator;
import com.control.cfs.expr.Variable;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.system.ControlAffineSystem;
import com.control.cfs.word.Alphabet;
import com.control.cfs.word.WordIndex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Series Builder -- primary user-facing API.
 *
 * Fluent definition of a control-affine system together with the truncation
 * and integration settings of its Chen-Fliess series.
 *
 * Usage Pattern:
 * 1. Create a builder: SeriesBuilder b = ChenFliess.builder("pendulum");
 * 2. Declare the state: b.states("z1", "z2");
 * 3. Define fields and output: b.drift("z2", "-sin(z1)").field("0", "1").output("z1");
 * 4. Choose the truncation: b.depth(4);
 * 5. Build: ChenFliessSeries series = b.build();
 */
public final class SeriesBuilder {
    private static final Logger log = LogManager.getLogger(SeriesBuilder.class);

    private final String name;
    private ControlAffineSystem.Builder system;
    private int depth = -1;
    private int[] alphabetOrder;
    private IntegrationRule rule = IntegrationRule.TRAPEZOID;
    private Differentiator differentiator = SymbolicDifferentiator.INSTANCE;
    private boolean parallel;
    private LayerListener listener;
    private double[] initialState;
    private TimeGrid grid;

    // Flag to prevent modification after building
    private boolean built;

    private SeriesBuilder(String name) {
        this.name = name;
    }

    public static SeriesBuilder create(String name) {
        return new SeriesBuilder(name);
    }

    // ── System ──────────────────────────────────────────────────

    /**
     * Declares the state variables. Must precede every field and the output.
     */
    public SeriesBuilder states(String... names) {
        checkNotBuilt();
        if (system != null)
            throw new ConfigurationException(name + ": state variables already declared");
        system = ControlAffineSystem.builder(names);
        return this;
    }

    /** Variable handle for building {@link Expr} trees by hand. */
    public Variable var(String stateName) {
        return system().var(stateName);
    }

    public SeriesBuilder drift(String... components) {
        checkNotBuilt();
        system().drift(components);
        return this;
    }

    public SeriesBuilder drift(Expr... components) {
        checkNotBuilt();
        system().drift(components);
        return this;
    }

    /** Adds the next controlled field g_{m+1}. */
    public SeriesBuilder field(String... components) {
        checkNotBuilt();
        system().field(components);
        return this;
    }

    public SeriesBuilder field(Expr... components) {
        checkNotBuilt();
        system().field(components);
        return this;
    }

    public SeriesBuilder output(String expression) {
        checkNotBuilt();
        system().output(expression);
        return this;
    }

    public SeriesBuilder output(Expr expression) {
        checkNotBuilt();
        system().output(expression);
        return this;
    }

    // ── Truncation and integration ──────────────────────────────

    /** Truncation depth N: words of length 0..N are kept. */
    public SeriesBuilder depth(int depth) {
        checkNotBuilt();
        if (depth < 0)
            throw new ConfigurationException("Truncation depth must be >= 0, got " + depth);
        this.depth = depth;
        return this;
    }

    /**
     * Alphabet order used to lay out the words, as a permutation of the
     * symbol ids 0..m. Defaults to x0, x1, ..., xm.
     */
    public SeriesBuilder alphabetOrder(int... order) {
        checkNotBuilt();
        this.alphabetOrder = order.clone();
        return this;
    }

    public SeriesBuilder rule(IntegrationRule rule) {
        checkNotBuilt();
        if (rule == null)
            throw new ConfigurationException("Integration rule must not be null");
        this.rule = rule;
        return this;
    }

    public SeriesBuilder differentiator(Differentiator differentiator) {
        checkNotBuilt();
        if (differentiator == null)
            throw new ConfigurationException("Differentiator must not be null");
        this.differentiator = differentiator;
        return this;
    }

    /** Computes rows of one layer in parallel in both engines. */
    public SeriesBuilder parallel(boolean parallel) {
        checkNotBuilt();
        this.parallel = parallel;
        return this;
    }

    /** Listener attached to both engines. */
    public SeriesBuilder listener(LayerListener listener) {
        checkNotBuilt();
        this.listener = listener;
        return this;
    }

    /** Default initial state for {@link ChenFliessSeries#simulate}. */
    public SeriesBuilder initialState(double... z0) {
        checkNotBuilt();
        this.initialState = z0.clone();
        return this;
    }

    /** Default sample grid, used by configuration-driven runs. */
    public SeriesBuilder grid(TimeGrid grid) {
        checkNotBuilt();
        this.grid = grid;
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    public ChenFliessSeries build() {
        checkNotBuilt();
        if (depth < 0)
            throw new ConfigurationException(name + ": truncation depth is not set");
        ControlAffineSystem sys = system().build();

        Alphabet alphabet = alphabetOrder == null
                ? Alphabet.standard(sys.controlledChannels())
                : Alphabet.ofOrder(alphabetOrder);
        WordIndex index = WordIndex.of(alphabet, depth);

        IteratedIntegralEngine integrals = new IteratedIntegralEngine(rule);
        LieDerivativeEngine lie = new LieDerivativeEngine(differentiator);
        integrals.setParallel(parallel);
        lie.setParallel(parallel);
        if (listener != null) {
            integrals.setListener(listener);
            lie.setListener(listener);
        }

        ChenFliessSeries series = new ChenFliessSeries(name, sys, index, integrals, lie, initialState, grid);
        built = true;
        log.info("Built {}: n={}, m={}, {} words, rule={}", name, sys.stateDimension(), sys.controlledChannels(),
                index.size(), rule);
        return series;
    }

    private ControlAffineSystem.Builder system() {
        if (system == null)
            throw new ConfigurationException(name + ": declare state variables first");
        return system;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Series '" + name + "' already built");
    }
}

package com.control.cfs;

import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.OdeSolver;
import com.control.cfs.engine.IteratedIntegralEngine;
import com.control.cfs.engine.LieDerivativeEngine;
import com.control.cfs.engine.OnlineIteratedIntegrals;
import com.control.cfs.input.InputSignal;
import com.control.cfs.input.TimeGrid;
import com.control.cfs.ode.Trajectory;
import com.control.cfs.series.ErrorReport;
import com.control.cfs.series.SeriesAssembler;
import com.control.cfs.series.TruncatedSeries;
import com.control.cfs.system.ControlAffineSystem;
import com.control.cfs.table.CoefficientEvaluator;
import com.control.cfs.table.CoefficientVector;
import com.control.cfs.table.IteratedIntegralTable;
import com.control.cfs.table.LieDerivativeTable;
import com.control.cfs.wiring.SamplePublisher;
import com.control.cfs.word.WordIndex;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A configured truncated Chen-Fliess model: one system, one word index, one
 * pair of engines.
 *
 * <p>
 * Both engines are driven from the same {@link WordIndex}, so every table this
 * object hands out can be combined with every other. The Lie-derivative table
 * and its compiled evaluator depend only on the system and the depth; they are
 * built on first use and reused for every state and every input afterwards.
 * Iterated integrals depend on the input and are computed per call.
 */
public final class ChenFliessSeries {
    private static final Logger log = LogManager.getLogger(ChenFliessSeries.class);

    private final String name;
    private final ControlAffineSystem system;
    private final WordIndex index;
    private final IteratedIntegralEngine integralEngine;
    private final LieDerivativeEngine lieEngine;
    private final double[] initialState;
    private final TimeGrid grid;

    private volatile LieDerivativeTable lieTable;

    public ChenFliessSeries(String name, ControlAffineSystem system, WordIndex index,
            IteratedIntegralEngine integralEngine, LieDerivativeEngine lieEngine,
            double[] initialState, TimeGrid grid) {
        if (index.alphabet().size() != system.alphabetSize())
            throw new ConfigurationException("Word index " + index.signature() + " does not fit a system with "
                    + system.alphabetSize() + " vector fields");
        if (initialState != null)
            system.checkState(initialState);
        this.name = name;
        this.system = system;
        this.index = index;
        this.integralEngine = integralEngine;
        this.lieEngine = lieEngine;
        this.initialState = initialState == null ? null : initialState.clone();
        this.grid = grid;
    }

    public String name() {
        return name;
    }

    public ControlAffineSystem system() {
        return system;
    }

    public WordIndex index() {
        return index;
    }

    public int depth() {
        return index.depth();
    }

    /** Configured initial state, or null. */
    public double[] initialState() {
        return initialState == null ? null : initialState.clone();
    }

    /** Configured time grid, or null. */
    public TimeGrid grid() {
        return grid;
    }

    /** The symbolic Lie-derivative table, built on first use. */
    public LieDerivativeTable lieDerivatives() {
        LieDerivativeTable t = lieTable;
        if (t == null) {
            synchronized (this) {
                t = lieTable;
                if (t == null) {
                    long start = System.nanoTime();
                    t = lieEngine.compute(system, index);
                    lieTable = t;
                    log.info("{}: built {} Lie derivatives up to depth {} in {} ms", name, t.size(), depth(),
                            (System.nanoTime() - start) / 1_000_000);
                }
            }
        }
        return t;
    }

    /** The compiled coefficient evaluator, built on first use. */
    public CoefficientEvaluator evaluator() {
        return lieDerivatives().compile();
    }

    /** (c, η) = L_η h(z0) for every word. */
    public CoefficientVector coefficients(double[] z0) {
        return evaluator().evaluate(z0);
    }

    public IteratedIntegralTable iteratedIntegrals(InputSignal input) {
        return integralEngine.compute(input, index);
    }

    /** F_c^N[u](t) from the given initial state. */
    public TruncatedSeries simulate(InputSignal input, double[] z0) {
        return SeriesAssembler.assemble(coefficients(z0), iteratedIntegrals(input));
    }

    /** F_c^N[u](t) from the configured initial state. */
    public TruncatedSeries simulate(InputSignal input) {
        return simulate(input, requireInitialState());
    }

    /** y(t) = h(z(t)) from integrating the system's ODE with {@code solver}. */
    public double[] referenceOutput(InputSignal input, double[] z0, OdeSolver solver) {
        system.checkState(z0);
        Trajectory trajectory = solver.solve(system.dynamics(input), z0, input.grid());
        return trajectory.map(system.compiledOutput());
    }

    /**
     * Compares the truncated series against the output of the integrated
     * system over the same input.
     */
    public ErrorReport validate(InputSignal input, double[] z0, OdeSolver solver) {
        ErrorReport report = simulate(input, z0).compareWith(referenceOutput(input, z0, solver));
        log.info("{}: depth {} vs reference: {}", name, depth(), report);
        return report;
    }

    /**
     * Streaming evaluator over a sample grid starting at {@code t0} with step
     * {@code dt}, driven one input sample at a time.
     */
    public SamplePublisher streaming(double[] z0, double t0, double dt) {
        return new SamplePublisher(coefficients(z0),
                new OnlineIteratedIntegrals(index, t0, dt, integralEngine.rule()));
    }

    private double[] requireInitialState() {
        if (initialState == null)
            throw new ConfigurationException(name + ": no initial state configured");
        return initialState;
    }

    @Override
    public String toString() {
        return "ChenFliessSeries[" + name + ", " + index.signature() + ", rule=" + integralEngine.rule() + "]";
    }
}

package com.control.cfs.io;

import com.control.cfs.ChenFliess;
import com.control.cfs.ChenFliessSeries;
import com.control.cfs.api.ConfigurationException;
import com.control.cfs.api.LayerListener;
import com.control.cfs.dsl.SeriesBuilder;
import com.control.cfs.engine.IntegrationRule;
import com.control.cfs.input.TimeGrid;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Compiles a {@link SystemDefinition} into a {@link ChenFliessSeries}.
 *
 * Required: {@code system.states}, {@code system.output} and
 * {@code series.depth}. Everything else has a default: zero drift, no
 * controlled fields, the standard alphabet order, the trapezoidal rule and no
 * initial state or grid.
 */
public final class SystemCompiler {
    private static final Logger log = LogManager.getLogger(SystemCompiler.class);

    private LayerListener listener;

    /** Listener attached to both engines of every compiled series. */
    public SystemCompiler withListener(LayerListener listener) {
        this.listener = listener;
        return this;
    }

    public ChenFliessSeries compile(SystemDefinition definition) {
        SystemDefinition.SystemInfo info = definition.getSystem();
        if (info == null)
            throw new ConfigurationException("Definition has no 'system' section");
        String name = info.getName() == null ? "system" : info.getName();
        if (info.getStates() == null || info.getStates().isEmpty())
            throw new ConfigurationException(name + ": 'states' is missing");
        if (info.getOutput() == null)
            throw new ConfigurationException(name + ": 'output' is missing");
        SystemDefinition.SeriesDef series = definition.getSeries();
        if (series == null || series.getDepth() == null)
            throw new ConfigurationException(name + ": 'series.depth' is missing");

        SeriesBuilder b = ChenFliess.builder(name).states(info.getStates().toArray(new String[0]));
        if (info.getDrift() != null)
            b.drift(info.getDrift().toArray(new String[0]));
        if (info.getFields() != null)
            for (List<String> field : info.getFields())
                b.field(field.toArray(new String[0]));
        b.output(info.getOutput());

        b.depth(series.getDepth()).parallel(series.isParallel());
        if (series.getAlphabetOrder() != null)
            b.alphabetOrder(series.getAlphabetOrder());
        if (series.getRule() != null)
            b.rule(parseRule(name, series.getRule()));
        if (info.getInitialState() != null)
            b.initialState(info.getInitialState());
        if (definition.getGrid() != null)
            b.grid(parseGrid(name, definition.getGrid()));
        if (listener != null)
            b.listener(listener);

        log.debug("Compiling {} from definition", name);
        return b.build();
    }

    static IntegrationRule parseRule(String name, String rule) {
        try {
            return IntegrationRule.valueOf(rule.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + ": unknown integration rule '" + rule + "', expected one of "
                    + Arrays.toString(IntegrationRule.values()), e);
        }
    }

    private static TimeGrid parseGrid(String name, SystemDefinition.GridDef grid) {
        if (grid.getTf() == null || grid.getDt() == null)
            throw new ConfigurationException(name + ": 'grid' needs both 'tf' and 'dt'");
        return TimeGrid.span(grid.getT0(), grid.getTf(), grid.getDt());
    }
}

package com.control.cfs.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a system and the settings of its truncated series.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SystemDefinition {
    private SystemInfo system;
    private SeriesDef series;
    private GridDef grid;

    /** The control-affine system: state, fields, output and start state. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SystemInfo {
        private String name, description;
        private List<String> states;
        private List<String> drift;
        private List<List<String>> fields;
        private String output;
        private double[] initialState;
    }

    /** Truncation and integration settings. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SeriesDef {
        private Integer depth;
        private int[] alphabetOrder;
        private String rule;
        private boolean parallel;
    }

    /** Uniform sample grid [t0, tf] with step dt. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class GridDef {
        private double t0;
        private Double tf;
        private Double dt;
    }
}

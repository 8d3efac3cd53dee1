package com.spectral.nsp.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a network definition file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NetworkDefinition {
    private NetworkInfo network;

    /** The network itself. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NetworkInfo {
        private String name, description;
        private List<String> nodes;
        private List<EdgeDef> edges;
        private List<FunctionDef> functions;
        // Labels or indices, never both; checked by BaseSelector.of
        private List<Object> base;
        private StabilityDef stability;
    }

    /** A weighted edge {@code from -> to}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String from, to;
        private double weight = 1.0;
    }

    /** One cell of the functional matrix: how {@code source} drives {@code target}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class FunctionDef {
        private String target, source, type;
        private Map<String, Object> properties;
    }

    /** Overrides for the stability analysis; unset fields keep their defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class StabilityDef {
        private Double lower, upper, threshold;
        private Integer samples;
    }
}

package com.strata.core.convert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Graph extracted from code by static analysis, input of {@link StaticStructureConverter}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaticStructure(List<StructureNode> nodes, List<StructureEdge> edges) {

    public StaticStructure {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}

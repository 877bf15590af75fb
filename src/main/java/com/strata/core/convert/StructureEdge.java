package com.strata.core.convert;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Edge of a statically analysed code structure.
 *
 * @param from    source node id
 * @param to      target node id
 * @param type    edge kind
 * @param outcome decision outcome selecting this branch, for conditional edges
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructureEdge(String from, String to, Type type, String outcome) {

    public enum Type {
        @JsonProperty("sequence") SEQUENCE,
        @JsonProperty("provides") PROVIDES,
        @JsonProperty("conditional") CONDITIONAL,
        @JsonProperty("contains") CONTAINS,
        @JsonEnumDefaultValue UNKNOWN
    }

    public static StructureEdge sequence(String from, String to) {
        return new StructureEdge(from, to, Type.SEQUENCE, null);
    }

    public static StructureEdge provides(String from, String to) {
        return new StructureEdge(from, to, Type.PROVIDES, null);
    }

    public static StructureEdge conditional(String from, String to, String outcome) {
        return new StructureEdge(from, to, Type.CONDITIONAL, outcome);
    }

    public static StructureEdge contains(String from, String to) {
        return new StructureEdge(from, to, Type.CONTAINS, null);
    }
}

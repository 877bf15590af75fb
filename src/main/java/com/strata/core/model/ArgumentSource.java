package com.strata.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * How a single tool argument is obtained at run time.
 *
 * @param type          resolution strategy
 * @param value         the literal value ({@link Type#LITERAL})
 * @param expression    path into a previous task's output, e.g. {@code n1.items[0].name} ({@link Type#REFERENCE})
 * @param parameterName run parameter to read ({@link Type#PARAMETER})
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArgumentSource(Type type, Object value, String expression, String parameterName) implements Serializable {

    public enum Type {
        @JsonProperty("literal") LITERAL,
        @JsonProperty("reference") REFERENCE,
        @JsonProperty("parameter") PARAMETER
    }

    public static ArgumentSource literal(Object value) {
        return new ArgumentSource(Type.LITERAL, value, null, null);
    }

    public static ArgumentSource reference(String expression) {
        return new ArgumentSource(Type.REFERENCE, null, expression, null);
    }

    public static ArgumentSource parameter(String parameterName) {
        return new ArgumentSource(Type.PARAMETER, null, null, parameterName);
    }
}

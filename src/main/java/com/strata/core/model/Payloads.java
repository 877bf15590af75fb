package com.strata.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copy helpers shared by the payload records.
 */
final class Payloads {

    private Payloads() {}

    static <V> Map<String, V> copyOf(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        // LinkedHashMap keeps argument order and tolerates null values from JSON
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidDagException(message);
        }
        return value;
    }
}

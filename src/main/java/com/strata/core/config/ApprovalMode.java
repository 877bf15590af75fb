package com.strata.core.config;

import java.util.Locale;

/**
 * When the scheduler pauses after a layer to ask a human for approval.
 */
public enum ApprovalMode {
    NEVER,
    ALWAYS,
    /** Only after layers that contain a task with side effects. */
    CRITICAL_ONLY;

    /**
     * Parses {@code never}, {@code always} or {@code critical_only} in any case; blank gives {@code null}.
     */
    public static ApprovalMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}

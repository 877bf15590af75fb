package com.strata.core.convert;

/**
 * @param includeDecisionTasks turn decision nodes into {@code internal:decision} tasks
 * @param taskIdPrefix         prefix added to node ids to form task ids
 */
public record ConversionOptions(boolean includeDecisionTasks, String taskIdPrefix) {

    public static final String DEFAULT_PREFIX = "task_";

    public ConversionOptions {
        if (taskIdPrefix == null) {
            taskIdPrefix = DEFAULT_PREFIX;
        }
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(false, DEFAULT_PREFIX);
    }
}

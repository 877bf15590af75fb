package com.strata.core.command;

/**
 * Snapshot of {@link CommandQueue} counters.
 *
 * @param total     commands admitted
 * @param processed commands handed to a consumer
 * @param rejected  commands refused by validation
 */
public record CommandQueueStats(long total, long processed, long rejected) {
}

package com.strata.core.state;

/**
 * Who made a recorded decision.
 */
public enum DecisionType {
    /** Agent-in-the-loop: made automatically during execution. */
    AIL,
    /** Human-in-the-loop: an approval answer. */
    HIL
}

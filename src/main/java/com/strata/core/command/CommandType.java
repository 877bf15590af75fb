package com.strata.core.command;

/**
 * Discriminator values of the command wire format.
 */
public enum CommandType {
    CONTINUE("continue"),
    ABORT("abort"),
    INJECT_TASKS("inject_tasks"),
    REPLAN_DAG("replan_dag"),
    SKIP_LAYER("skip_layer"),
    MODIFY_ARGS("modify_args"),
    CHECKPOINT_RESPONSE("checkpoint_response"),
    APPROVAL_RESPONSE("approval_response");

    private final String wireName;

    CommandType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

package com.strata.core.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Control message injected into a running workflow. The JSON form carries the variant
 * in the {@code type} property, e.g. {@code {"type":"abort","reason":"user cancelled"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContinueCommand.class, name = "continue"),
        @JsonSubTypes.Type(value = AbortCommand.class, name = "abort"),
        @JsonSubTypes.Type(value = InjectTasksCommand.class, name = "inject_tasks"),
        @JsonSubTypes.Type(value = ReplanDagCommand.class, name = "replan_dag"),
        @JsonSubTypes.Type(value = SkipLayerCommand.class, name = "skip_layer"),
        @JsonSubTypes.Type(value = ModifyArgsCommand.class, name = "modify_args"),
        @JsonSubTypes.Type(value = CheckpointResponseCommand.class, name = "checkpoint_response"),
        @JsonSubTypes.Type(value = ApprovalResponseCommand.class, name = "approval_response")
})
public interface Command {

    CommandType type();

    /**
     * Structural problems with this command, one message per violated rule.
     * An empty list means the command may be enqueued.
     */
    List<String> violations();
}

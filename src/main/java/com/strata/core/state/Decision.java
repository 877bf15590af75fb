package com.strata.core.state;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Map;

/**
 * A decision taken while the workflow ran.
 *
 * @param type           agent or human decision
 * @param timestamp      epoch millis
 * @param description    what was decided
 * @param outcome        observed outcome, e.g. "true", "approved", "rejected"
 * @param confidence     confidence in [0, 1] for agent decisions, nullable
 * @param decisionNodeId decision node of the source structure this outcome belongs to, nullable
 * @param metadata       free-form extra data
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
    DecisionType type,
    long timestamp,
    String description,
    String outcome,
    Double confidence,
    String decisionNodeId,
    Map<String, Object> metadata
) implements Serializable {

    public Decision {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Decision human(String description, String outcome, Map<String, Object> metadata) {
        return new Decision(DecisionType.HIL, System.currentTimeMillis(), description, outcome, null, null, metadata);
    }

    public static Decision branch(String decisionNodeId, String outcome) {
        return new Decision(DecisionType.AIL, System.currentTimeMillis(),
                "Decision node " + decisionNodeId + " evaluated", outcome, 1.0, decisionNodeId, Map.of());
    }
}

package com.strata.core.model;

import java.io.Serializable;

/**
 * Gates a task on the observed outcome of an upstream decision.
 *
 * @param decisionNodeId  id of the decision node in the source structure
 * @param requiredOutcome outcome the decision must produce, e.g. "true", "false", "case:x"
 */
public record TaskCondition(String decisionNodeId, String requiredOutcome) implements Serializable {

    public TaskCondition {
        Payloads.requireText(decisionNodeId, "Condition requires a decisionNodeId");
        Payloads.requireText(requiredOutcome, "Condition requires a requiredOutcome");
    }

    public boolean matches(String outcome) {
        return requiredOutcome.equals(outcome);
    }
}

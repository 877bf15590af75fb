package com.strata.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Kind-specific part of a {@link Task}. Each implementation carries the fields its
 * executor needs and validates them on construction.
 *
 * @see ToolInvocation
 * @see CodeBlock
 * @see CapabilityInvocation
 */
public interface TaskPayload extends Serializable {

    TaskKind kind();

    /** Explicit call arguments; never null. */
    Map<String, Object> arguments();

    /** Identifier shown in logs and approval summaries, e.g. {@code fs:read}. */
    String displayTool();

    TaskPayload withArguments(Map<String, Object> arguments);
}

package com.strata.core.model;

import java.util.Map;

/**
 * Payload of a {@link TaskKind#CAPABILITY} task. When {@code code} is absent the
 * source is looked up in the capability store by id at execution time.
 *
 * @param capabilityId id of the stored capability
 * @param code         inline source, nullable
 * @param intent       natural-language intent passed to the code, nullable
 * @param arguments    call arguments
 */
public record CapabilityInvocation(
    String capabilityId,
    String code,
    String intent,
    Map<String, Object> arguments
) implements TaskPayload {

    public CapabilityInvocation {
        Payloads.requireText(capabilityId, "Capability task requires a capabilityId");
        arguments = Payloads.copyOf(arguments);
    }

    public boolean hasInlineCode() {
        return code != null && !code.isBlank();
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CAPABILITY;
    }

    @Override
    public String displayTool() {
        return "capability:" + capabilityId;
    }

    @Override
    public CapabilityInvocation withArguments(Map<String, Object> arguments) {
        return new CapabilityInvocation(capabilityId, code, intent, arguments);
    }
}

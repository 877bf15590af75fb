package com.strata.core.capability;

import com.strata.sandbox.PermissionSet;

/**
 * A reusable code pattern as held by the {@link CapabilityStore}.
 *
 * @param id            capability id
 * @param codeSnippet   source run in the sandbox
 * @param permissionSet permissions the capability currently runs with
 */
public record StoredCapability(String id, String codeSnippet, PermissionSet permissionSet) {
}

package com.strata.core.capability;

import java.util.Optional;

/**
 * Lookup of learned capabilities. Provided by the learning subsystem; the engine only reads from it.
 */
public interface CapabilityStore {

    Optional<StoredCapability> findById(String capabilityId);
}

package com.modelguard.modelguard.ledger;

import com.modelguard.modelguard.common.ModelGuardException;

public class StaleEntityVersionException extends ModelGuardException {

    public StaleEntityVersionException(long entityId, int expectedVersion) {
        super("STALE_ENTITY_VERSION", "Entity %d is no longer at version %d".formatted(entityId, expectedVersion));
    }
}

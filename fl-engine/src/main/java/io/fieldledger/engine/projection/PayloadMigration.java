package io.fieldledger.engine.projection;

import io.fieldledger.core.payload.Payload;

/** Upgrades a payload by exactly one schema version. */
@FunctionalInterface
public interface PayloadMigration {
    Payload upgrade(Payload older);
}

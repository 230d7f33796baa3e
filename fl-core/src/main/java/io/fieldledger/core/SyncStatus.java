package io.fieldledger.core;

/** Per-event replication state, written only by the sync manager. */
public enum SyncStatus {
    LOCAL,
    PENDING,
    SYNCED,
    FAILED
}

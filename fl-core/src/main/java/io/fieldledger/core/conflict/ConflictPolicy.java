package io.fieldledger.core.conflict;

/** How concurrent events of one kind on one target are reconciled. */
public enum ConflictPolicy {
    /** Greatest (timestamp, actorId) wins. */
    LWW,
    /** Smallest (timestamp, sequence, deviceId) wins. */
    FWW,
    /** Associative, commutative, idempotent combine of every candidate. */
    CRDT,
    /** Named merge function enforcing an aggregate invariant. */
    DOMAIN,
    /** Queued for a human decision. */
    MANUAL
}

package io.fieldledger.engine.sync;

public enum PushOutcome {
    ACCEPTED,
    DUPLICATE,
    /** The authority will never take this event as it is. */
    REJECTED_VALIDATION,
    /** Broken link or hash; worth another try once the chain is repaired. */
    REJECTED_CHAIN,
    CONFLICT_PENDING
}

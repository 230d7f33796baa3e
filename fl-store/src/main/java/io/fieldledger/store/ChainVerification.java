package io.fieldledger.store;

import io.fieldledger.core.ChainIntegrityException;

/**
 * Result of walking a stream.
 *
 * @param brokenAt 0-based position of the first bad event, {@code -1} when the chain is intact
 */
public record ChainVerification(String operationId, boolean valid, long length, long brokenAt, String reason) {

    public static ChainVerification intact(String operationId, long length) {
        return new ChainVerification(operationId, true, length, -1, null);
    }

    public static ChainVerification broken(String operationId, long length, long position, String reason) {
        return new ChainVerification(operationId, false, length, position, reason);
    }

    public ChainVerification orThrow() {
        if (!valid) throw new ChainIntegrityException(operationId, brokenAt, reason);
        return this;
    }
}

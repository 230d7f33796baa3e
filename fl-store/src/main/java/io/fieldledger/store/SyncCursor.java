package io.fieldledger.store;

import java.time.Instant;

/**
 * Last remote stream position a device has merged, with the remote chain digest at that
 * position. The next pull asks for everything after {@code lastSequence} and expects the
 * first event to link to {@code tailDigest}.
 */
public record SyncCursor(String deviceId, String operationId, long lastSequence, String tailDigest, Instant updatedAt) {

    public SyncCursor advancedTo(long sequence, String digest, Instant at) {
        return new SyncCursor(deviceId, operationId, sequence, digest, at);
    }
}

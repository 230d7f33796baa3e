package io.fieldledger.core;

import io.fieldledger.core.payload.Payload;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, hash-linked record of one state change.
 * <p>
 * {@code hash} covers {@code (id, kind, actorId, timestamp, payload)} only, so a replica may
 * link a foreign event into its own chain ({@link #linkedTo}) and the sync manager may
 * move it through its sync states ({@link #withSync}) without changing its identity.
 */
public record Event(
        UUID id,
        EventKind kind,
        int schemaVersion,
        String actorId,
        String deviceId,
        String sessionId,
        String operationId,
        long timestamp,
        long sequence,
        Payload payload,
        UUID causationId,
        UUID correlationId,
        String hash,
        String previousHash,
        SyncStatus syncStatus,
        int syncAttempts,
        String syncError
) {
    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(hash, "hash");
        if (!kind.accepts(payload)) {
            throw new ValidationException("payload", kind.wireName() + " cannot carry " + payload.getClass().getSimpleName());
        }
        if (correlationId == null) correlationId = id;
        if (syncStatus == null) syncStatus = SyncStatus.LOCAL;
    }

    /** Logical entity this event touches. */
    public String target() {
        return payload.target();
    }

    public boolean isRoot() {
        return causationId == null;
    }

    /** Same fact, chained after {@code predecessorHash} in some replica's stream. */
    public Event linkedTo(String predecessorHash) {
        return new Event(id, kind, schemaVersion, actorId, deviceId, sessionId, operationId, timestamp, sequence,
                payload, causationId, correlationId, hash, predecessorHash, syncStatus, syncAttempts, syncError);
    }

    public Event withCausality(UUID causation, UUID correlation) {
        return new Event(id, kind, schemaVersion, actorId, deviceId, sessionId, operationId, timestamp, sequence,
                payload, causation, correlation, hash, previousHash, syncStatus, syncAttempts, syncError);
    }

    public Event withSync(SyncStatus status, int attempts, String error) {
        return new Event(id, kind, schemaVersion, actorId, deviceId, sessionId, operationId, timestamp, sequence,
                payload, causationId, correlationId, hash, previousHash, status, attempts, error);
    }

    /**
     * Upgraded view of an older event, used only for projection. The original stays in
     * the store untouched so its hash still verifies.
     */
    public Event migratedTo(int version, Payload upgraded) {
        return new Event(id, kind, version, actorId, deviceId, sessionId, operationId, timestamp, sequence,
                upgraded, causationId, correlationId, hash, previousHash, syncStatus, syncAttempts, syncError);
    }
}

package io.fieldledger.store;

import io.fieldledger.core.Event;
import io.fieldledger.core.SyncStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Flow.Publisher;

/** Append-only, hash-linked event streams, one per operation. */
public interface EventStore {

    enum AppendResult { APPENDED, DUPLICATE }

    /**
     * @throws io.fieldledger.core.ChainIntegrityException when the event does not extend the
     *         stream tail or its hash does not match its content; the stream is halted
     */
    AppendResult append(Event event);

    List<Event> readRange(String operationId, long fromPosition);

    ChainVerification verifyChain(String operationId);

    /** Hash of the last event, or {@link io.fieldledger.core.EventHasher#GENESIS} for an empty stream. */
    String tailHash(String operationId);

    long size(String operationId);

    boolean contains(UUID eventId);

    Optional<Event> find(UUID eventId);

    List<String> operationIds();

    /** Reserved to the sync manager: the only mutation an event ever sees. */
    void updateSyncState(UUID eventId, SyncStatus status, int attempts, String error);

    List<Event> findBySyncStatus(String operationId, Set<SyncStatus> statuses);

    Publisher<Event> subscribe();

    boolean isHalted(String operationId);

    /**
     * Re-verify a halted stream and resume appends when it passes.
     *
     * @throws io.fieldledger.core.ChainIntegrityException when the stream is still broken
     */
    ChainVerification reconcile(String operationId);
}

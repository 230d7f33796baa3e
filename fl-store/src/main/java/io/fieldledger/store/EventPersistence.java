package io.fieldledger.store;

import io.fieldledger.core.Event;
import io.fieldledger.core.SyncStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Storage medium behind the chained store. Implementations keep each operation's events
 * in append order and never rewrite them, except for the three sync-state columns.
 * Chain rules are enforced above this boundary.
 */
public interface EventPersistence {

    /** Store at position {@link #size(String)} of the event's operation stream. */
    void appendRaw(Event event);

    /** Events at positions {@code [from, to)}, in order. */
    List<Event> readRange(String operationId, long from, long to);

    Optional<Event> readTail(String operationId);

    Optional<Event> findById(UUID eventId);

    long size(String operationId);

    List<String> operationIds();

    void updateSyncState(UUID eventId, SyncStatus status, int attempts, String error);

    List<Event> findBySyncStatus(String operationId, Set<SyncStatus> statuses);
}

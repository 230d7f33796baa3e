package io.fieldledger.engine.sync;

import io.fieldledger.core.Event;

import java.util.List;

/**
 * Events pushed in local stream order.
 *
 * @param tailDigest hash of the last event, so the receiver can tell a truncated batch
 */
public record SyncBatch(String operationId, List<Event> events, String tailDigest) {
    public SyncBatch {
        events = List.copyOf(events);
    }

    public static SyncBatch of(String operationId, List<Event> events) {
        return new SyncBatch(operationId, events, events.isEmpty() ? null : events.get(events.size() - 1).hash());
    }
}

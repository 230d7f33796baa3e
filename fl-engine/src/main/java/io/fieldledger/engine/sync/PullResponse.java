package io.fieldledger.engine.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fieldledger.core.Event;

import java.util.List;

/**
 * A page of the remote stream.
 *
 * @param lastSequence remote position after the last returned event
 * @param tailDigest   remote hash of the last returned event
 */
public record PullResponse(String operationId, List<Event> events, long lastSequence, String tailDigest) {
    public PullResponse {
        events = List.copyOf(events);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return events.isEmpty();
    }
}

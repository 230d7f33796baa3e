package io.fieldledger.core.conflict;

import io.fieldledger.core.Determinism;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Concurrent candidates waiting for a human decision. The id is derived from the sorted
 * candidate ids, so every replica that detects the same conflict names it the same way.
 */
public record ManualConflict(String conflictId, String operationId, EventKind kind, String target,
                             List<Event> candidates, long detectedAt) {

    public ManualConflict {
        candidates = List.copyOf(candidates);
    }

    public static ManualConflict of(List<Event> candidates) {
        if (candidates.isEmpty()) throw new IllegalArgumentException("no candidates");
        var sorted = candidates.stream().sorted(Comparator.comparing(Event::id)).toList();
        var first = sorted.get(0);
        var parts = Stream.<Object>concat(Stream.of("conflict"), sorted.stream().map(Event::id)).toArray();
        var id = Determinism.derivedUUID(parts).toString();
        long detectedAt = sorted.stream().mapToLong(Event::timestamp).max().orElse(first.timestamp());
        return new ManualConflict(id, first.operationId(), first.kind(), first.target(), sorted, detectedAt);
    }

    public Optional<Event> candidate(UUID eventId) {
        return candidates.stream().filter(e -> e.id().equals(eventId)).findFirst();
    }

    public List<Event> rejectedBy(UUID chosenEventId) {
        return candidates.stream().filter(e -> !e.id().equals(chosenEventId)).toList();
    }
}

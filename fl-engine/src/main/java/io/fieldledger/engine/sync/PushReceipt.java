package io.fieldledger.engine.sync;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** One outcome per pushed event. */
public record PushReceipt(List<PushResult> results) {
    public PushReceipt {
        results = List.copyOf(results);
    }

    public record PushResult(UUID eventId, PushOutcome outcome, String detail) {
        public static PushResult of(UUID eventId, PushOutcome outcome) {
            return new PushResult(eventId, outcome, null);
        }
    }

    public Optional<PushResult> resultFor(UUID eventId) {
        return results.stream().filter(r -> r.eventId().equals(eventId)).findFirst();
    }

    public long count(PushOutcome outcome) {
        return results.stream().filter(r -> r.outcome() == outcome).count();
    }
}

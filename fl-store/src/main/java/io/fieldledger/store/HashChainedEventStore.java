package io.fieldledger.store;

import io.fieldledger.core.ChainIntegrityException;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventHasher;
import io.fieldledger.core.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;

/**
 * Enforces the chain over any {@link EventPersistence}: each appended event must carry a
 * matching hash and link to the current tail. A violation halts the operation's stream
 * until {@link #reconcile} finds it intact again.
 * <p>
 * Also remembers the last digest it appended per stream, so a truncated tail is caught by
 * {@link #verifyChain} even though the remaining links are consistent.
 */
public final class HashChainedEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(HashChainedEventStore.class);
    private static final int PAGE = 512;

    private final EventPersistence persistence;
    private final SubmissionPublisher<Event> bus = new SubmissionPublisher<>();
    private final Set<String> halted = new HashSet<>();
    private final Map<String, String> anchors = new HashMap<>();

    public HashChainedEventStore(EventPersistence persistence) {
        this.persistence = Objects.requireNonNull(persistence);
    }

    @Override
    public synchronized AppendResult append(Event event) {
        if (persistence.findById(event.id()).isPresent()) {
            log.debug("Event {} already stored, ignoring", event.id());
            return AppendResult.DUPLICATE;
        }
        var op = event.operationId();
        long position = persistence.size(op);
        if (halted.contains(op)) {
            throw new ChainIntegrityException(op, position, "stream halted, reconcile before appending");
        }
        if (!EventHasher.matches(event)) {
            throw halt(op, position, "hash mismatch for event " + event.id());
        }
        var tail = tailHash(op);
        if (!tail.equals(event.previousHash())) {
            throw halt(op, position, "event " + event.id() + " links to " + event.previousHash() + ", tail is " + tail);
        }
        persistence.appendRaw(event);
        anchors.put(op, event.hash());
        bus.submit(event);
        return AppendResult.APPENDED;
    }

    @Override
    public List<Event> readRange(String operationId, long fromPosition) {
        return persistence.readRange(operationId, fromPosition, persistence.size(operationId));
    }

    @Override
    public ChainVerification verifyChain(String operationId) {
        long size = persistence.size(operationId);
        var verifier = new ChainVerifier(operationId, 0, EventHasher.GENESIS);
        for (long from = 0; from < size; from += PAGE) {
            for (var e : persistence.readRange(operationId, from, Math.min(size, from + PAGE))) {
                if (!verifier.accept(e)) {
                    var result = verifier.result();
                    log.error("Chain of {} broken at position {}: {}", operationId, result.brokenAt(), result.reason());
                    return result;
                }
            }
        }
        String anchor;
        synchronized (this) {
            anchor = anchors.get(operationId);
        }
        if (anchor != null && !anchor.equals(verifier.tail())) {
            log.error("Chain of {} ends at {} but {} was appended last", operationId, verifier.tail(), anchor);
            return ChainVerification.broken(operationId, size, size, "tail truncated: last appended " + anchor + " is missing");
        }
        return verifier.result();
    }

    @Override
    public String tailHash(String operationId) {
        return persistence.readTail(operationId).map(Event::hash).orElse(EventHasher.GENESIS);
    }

    @Override
    public long size(String operationId) {
        return persistence.size(operationId);
    }

    @Override
    public boolean contains(UUID eventId) {
        return persistence.findById(eventId).isPresent();
    }

    @Override
    public Optional<Event> find(UUID eventId) {
        return persistence.findById(eventId);
    }

    @Override
    public List<String> operationIds() {
        return persistence.operationIds();
    }

    @Override
    public void updateSyncState(UUID eventId, SyncStatus status, int attempts, String error) {
        persistence.updateSyncState(eventId, status, attempts, error);
    }

    @Override
    public List<Event> findBySyncStatus(String operationId, Set<SyncStatus> statuses) {
        return persistence.findBySyncStatus(operationId, statuses);
    }

    @Override
    public Flow.Publisher<Event> subscribe() {
        return bus;
    }

    @Override
    public synchronized boolean isHalted(String operationId) {
        return halted.contains(operationId);
    }

    @Override
    public synchronized ChainVerification reconcile(String operationId) {
        var result = verifyChain(operationId).orThrow();
        if (halted.remove(operationId)) log.info("Stream {} verified ({} events), appends resumed", operationId, result.length());
        return result;
    }

    private ChainIntegrityException halt(String operationId, long position, String reason) {
        halted.add(operationId);
        log.error("Halting stream {} at position {}: {}", operationId, position, reason);
        return new ChainIntegrityException(operationId, position, reason);
    }
}

package io.fieldledger.engine.sync;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventHasher;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.core.ValidationException;
import io.fieldledger.store.EventStore;
import io.fieldledger.store.HashChainedEventStore;
import io.fieldledger.store.InMemoryEventPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference authority: checks every pushed event, relinks accepted ones into its own
 * canonical chain and serves that chain page by page.
 */
public final class InMemoryRemoteAuthority implements RemoteAuthority {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteAuthority.class);

    private final EventStore canonical;
    private final int pageSize;

    public InMemoryRemoteAuthority() {
        this(new HashChainedEventStore(new InMemoryEventPersistence()), 100);
    }

    public InMemoryRemoteAuthority(EventStore canonical, int pageSize) {
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be positive");
        this.canonical = Objects.requireNonNull(canonical);
        this.pageSize = pageSize;
    }

    @Override
    public synchronized PushReceipt push(SyncBatch batch) {
        var events = batch.events();
        var results = new ArrayList<PushReceipt.PushResult>(events.size());
        if (!events.isEmpty() && !Objects.equals(events.get(events.size() - 1).hash(), batch.tailDigest())) {
            log.warn("Batch for {} does not end at its declared digest, rejecting {} events",
                    batch.operationId(), events.size());
            for (var e : events) {
                results.add(new PushReceipt.PushResult(e.id(), PushOutcome.REJECTED_CHAIN, "batch truncated"));
            }
            return new PushReceipt(results);
        }
        for (var e : events) {
            results.add(accept(batch.operationId(), e));
        }
        return new PushReceipt(results);
    }

    private PushReceipt.PushResult accept(String operationId, Event e) {
        if (canonical.contains(e.id())) return PushReceipt.PushResult.of(e.id(), PushOutcome.DUPLICATE);
        if (!operationId.equals(e.operationId())) {
            return new PushReceipt.PushResult(e.id(), PushOutcome.REJECTED_VALIDATION, "event belongs to " + e.operationId());
        }
        if (!EventHasher.matches(e)) {
            return new PushReceipt.PushResult(e.id(), PushOutcome.REJECTED_CHAIN, "hash mismatch");
        }
        if (e.schemaVersion() > e.kind().currentVersion()) {
            return new PushReceipt.PushResult(e.id(), PushOutcome.REJECTED_VALIDATION,
                    "schema v" + e.schemaVersion() + " is newer than v" + e.kind().currentVersion());
        }
        try {
            e.payload().validate(e.schemaVersion());
        } catch (ValidationException ex) {
            return new PushReceipt.PushResult(e.id(), PushOutcome.REJECTED_VALIDATION, ex.getMessage());
        }
        if (!e.isRoot() && !canonical.contains(e.causationId())) {
            return new PushReceipt.PushResult(e.id(), PushOutcome.REJECTED_CHAIN, "unknown cause " + e.causationId());
        }
        canonical.append(e.linkedTo(canonical.tailHash(operationId)).withSync(SyncStatus.SYNCED, 0, null));
        return PushReceipt.PushResult.of(e.id(), PushOutcome.ACCEPTED);
    }

    @Override
    public synchronized PullResponse pull(PullRequest request) {
        var all = canonical.readRange(request.operationId(), request.sinceSequence());
        List<Event> page = all.size() > pageSize ? all.subList(0, pageSize) : all;
        long last = request.sinceSequence() + page.size();
        String digest = page.isEmpty() ? digestAt(request.operationId(), request.sinceSequence()) : page.get(page.size() - 1).hash();
        return new PullResponse(request.operationId(), page, last, digest);
    }

    private String digestAt(String operationId, long position) {
        if (position == 0) return EventHasher.GENESIS;
        var from = canonical.readRange(operationId, position - 1);
        return from.isEmpty() ? canonical.tailHash(operationId) : from.get(0).hash();
    }

    /** The canonical stream, for inspection. */
    public EventStore canonical() {
        return canonical;
    }
}

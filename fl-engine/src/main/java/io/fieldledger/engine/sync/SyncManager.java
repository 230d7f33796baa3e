package io.fieldledger.engine.sync;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventHasher;
import io.fieldledger.core.MissingParentException;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.core.SyncTransportException;
import io.fieldledger.core.conflict.ConflictQueueFullException;
import io.fieldledger.core.conflict.Resolution;
import io.fieldledger.core.payload.MembershipChange;
import io.fieldledger.engine.Ledger;
import io.fieldledger.store.ChainVerifier;
import io.fieldledger.store.EventStore;
import io.fieldledger.store.SyncCursor;
import io.fieldledger.store.SyncCursorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moves events between the local ledger and the remote authority.
 * <p>
 * Per event: {@code LOCAL -> PENDING -> SYNCED | FAILED}, {@code FAILED -> PENDING} again
 * after an exponential backoff, terminal after {@link SyncSettings#maxAttempts()} attempts or
 * a validation rejection. Terminal events stay in the store and are reported by
 * {@link #stuckEvents}.
 * <p>
 * A cycle pushes first, then pulls page by page until the authority has nothing newer. The
 * cursor only advances once a whole page merged and the operation scope did not change in
 * the meantime. A page merges as one unit under the ledger lock, and a scope switch takes the
 * same lock, so a scope switch never splits a page.
 */
public final class SyncManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncManager.class);

    static final String VALIDATION_PREFIX = "validation: ";
    private static final Set<SyncStatus> UNSYNCED = EnumSet.of(SyncStatus.LOCAL, SyncStatus.PENDING, SyncStatus.FAILED);

    private final Ledger ledger;
    private final EventStore store;
    private final RemoteAuthority authority;
    private final SyncCursorStore cursors;
    private final SyncSettings settings;
    private final Clock clock;
    private final String deviceId;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<Scope> scope = new AtomicReference<>(new Scope(null, 0));
    private final Map<UUID, Instant> failedAt = new ConcurrentHashMap<>();
    private final Set<String> fullSync = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pendingPromotion;

    public SyncManager(Ledger ledger, RemoteAuthority authority, SyncCursorStore cursors, SyncSettings settings,
                       Clock clock, String deviceId) {
        this.ledger = Objects.requireNonNull(ledger);
        this.store = ledger.store();
        this.authority = Objects.requireNonNull(authority);
        this.cursors = Objects.requireNonNull(cursors);
        this.settings = Objects.requireNonNull(settings);
        this.clock = Objects.requireNonNull(clock);
        this.deviceId = Objects.requireNonNull(deviceId);
    }

    /** Start the periodic cycle and the debounce on local appends. */
    public synchronized void start() {
        if (executor != null) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "fl-sync");
            t.setDaemon(true);
            return t;
        });
        ledger.addListener(this::onAppend);
        long every = settings.interval().toMillis();
        executor.scheduleWithFixedDelay(this::scheduledCycle, every, every, TimeUnit.MILLISECONDS);
        log.info("Sync started for device {} with {}", deviceId, settings);
    }

    /** Operation being synced and the generation that names this choice of it. */
    private record Scope(String operationId, long generation) {}

    /** Change the operation being synced. A cycle still running for the previous one is discarded. */
    public void switchOperation(String operationId) {
        var next = ledger.exclusive(() -> scope.updateAndGet(s -> new Scope(operationId, s.generation() + 1)));
        log.info("Sync scope switched to {} (generation {})", operationId, next.generation());
    }

    public String activeOperation() {
        return scope.get().operationId();
    }

    /**
     * Promote every LOCAL event to PENDING without waiting for the debounce window.
     *
     * @return number of events promoted
     */
    public int flush() {
        int promoted = 0;
        for (var operationId : store.operationIds()) {
            for (var e : store.findBySyncStatus(operationId, EnumSet.of(SyncStatus.LOCAL))) {
                store.updateSyncState(e.id(), SyncStatus.PENDING, e.syncAttempts(), null);
                promoted++;
            }
        }
        if (promoted > 0) log.debug("Promoted {} local events to pending", promoted);
        return promoted;
    }

    /** Run one push/pull cycle for the active operation on the calling thread. */
    public SyncReport syncNow() {
        var current = scope.get();
        if (current.operationId() == null) return SyncReport.skipped(null);
        cycleLock.lock();
        try {
            return cycle(current.operationId(), current.generation());
        } finally {
            cycleLock.unlock();
        }
    }

    /** Terminally failed events of an operation; they are never retried automatically. */
    public List<Event> stuckEvents(String operationId) {
        return store.findBySyncStatus(operationId, EnumSet.of(SyncStatus.FAILED)).stream()
                .filter(this::terminal)
                .toList();
    }

    /** True once the replica lost track of the remote stream and re-pulls it from the start. */
    public boolean fullSyncRequested(String operationId) {
        return fullSync.contains(operationId);
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private SyncReport cycle(String operationId, long gen) {
        var push = push(operationId);
        var pull = pull(operationId, gen);
        var report = new SyncReport(operationId, push.pushed, push.synced, push.failed, stuckEvents(operationId).size(),
                pull.pulled, pull.merged, pull.resolutions, pull.unresolved, fullSyncRequested(operationId), pull.cancelled);
        log.debug("Sync cycle {}", report);
        return report;
    }

    private static final class PushTally {
        int pushed;
        int synced;
        int failed;
    }

    private PushTally push(String operationId) {
        var tally = new PushTally();
        var now = clock.instant();
        var due = store.findBySyncStatus(operationId, EnumSet.of(SyncStatus.PENDING, SyncStatus.FAILED)).stream()
                .filter(e -> e.syncStatus() == SyncStatus.PENDING || (!terminal(e) && backoffElapsed(e, now)))
                .toList();
        for (int from = 0; from < due.size(); from += settings.batchSize()) {
            var batch = due.subList(from, Math.min(due.size(), from + settings.batchSize()));
            tally.pushed += batch.size();
            PushReceipt receipt;
            try {
                receipt = authority.push(SyncBatch.of(operationId, batch));
            } catch (SyncTransportException e) {
                log.warn("Push of {} events for {} failed: {}", batch.size(), operationId, e.getMessage());
                batch.forEach(ev -> fail(ev, "transport: " + e.getMessage(), now));
                tally.failed += batch.size();
                return tally;
            }
            for (var ev : batch) {
                var result = receipt.resultFor(ev.id())
                        .orElse(new PushReceipt.PushResult(ev.id(), PushOutcome.REJECTED_CHAIN, "missing from receipt"));
                switch (result.outcome()) {
                    case ACCEPTED, DUPLICATE -> {
                        store.updateSyncState(ev.id(), SyncStatus.SYNCED, ev.syncAttempts(), null);
                        failedAt.remove(ev.id());
                        tally.synced++;
                    }
                    case REJECTED_VALIDATION -> {
                        store.updateSyncState(ev.id(), SyncStatus.FAILED, ev.syncAttempts() + 1, VALIDATION_PREFIX + result.detail());
                        log.error("Event {} ({}) rejected by the authority and will not be retried: {}",
                                ev.id(), ev.kind().wireName(), result.detail());
                        tally.failed++;
                    }
                    case REJECTED_CHAIN -> {
                        fail(ev, "chain: " + result.detail(), now);
                        tally.failed++;
                    }
                    case CONFLICT_PENDING -> store.updateSyncState(ev.id(), SyncStatus.PENDING, ev.syncAttempts(), "conflict pending");
                }
            }
        }
        return tally;
    }

    private void fail(Event e, String error, Instant now) {
        int attempts = e.syncAttempts() + 1;
        store.updateSyncState(e.id(), SyncStatus.FAILED, attempts, error);
        failedAt.put(e.id(), now);
        if (attempts >= settings.maxAttempts()) {
            log.error("Event {} ({}) gave up after {} attempts: {}", e.id(), e.kind().wireName(), attempts, error);
        }
    }

    private boolean terminal(Event e) {
        if (e.syncStatus() != SyncStatus.FAILED) return false;
        return e.syncAttempts() >= settings.maxAttempts()
                || (e.syncError() != null && e.syncError().startsWith(VALIDATION_PREFIX));
    }

    private boolean backoffElapsed(Event e, Instant now) {
        var since = failedAt.get(e.id());
        return since == null || !now.isBefore(since.plus(settings.backoff(e.syncAttempts())));
    }

    private static final class PullTally {
        int pulled;
        int merged;
        int resolutions;
        int unresolved;
        boolean cancelled;
    }

    private PullTally pull(String operationId, long gen) {
        var tally = new PullTally();
        var cursor = cursors.find(deviceId, operationId)
                .orElseGet(() -> new SyncCursor(deviceId, operationId, 0, EventHasher.GENESIS, Instant.EPOCH));
        boolean fromStart = cursor.lastSequence() == 0;
        while (true) {
            PullResponse page;
            try {
                page = authority.pull(new PullRequest(operationId, cursor.lastSequence()));
            } catch (SyncTransportException e) {
                log.warn("Pull for {} failed: {}", operationId, e.getMessage());
                return tally;
            }
            if (page.isEmpty()) {
                if (fromStart) fullSync.remove(operationId);
                return tally;
            }
            var verification = ChainVerifier.verifyBatch(operationId, page.events(), cursor.tailDigest(), page.tailDigest());
            if (!verification.valid()) {
                log.error("Pulled batch for {} does not verify: {}", operationId, verification.reason());
                requestFullSync(operationId);
                return tally;
            }
            var batch = page.events();
            Optional<Integer> merged;
            try {
                merged = ledger.mergeUnit(() -> current(gen), () -> {
                    for (var remote : batch) merge(remote, tally);
                    return batch.size();
                });
            } catch (MissingParentException e) {
                log.warn("{}; requesting full sync of {}", e.getMessage(), operationId);
                requestFullSync(operationId);
                return tally;
            }
            if (merged.isEmpty()) {
                log.info("Sync scope changed, discarding {} pulled events for {}", batch.size(), operationId);
                tally.cancelled = true;
                return tally;
            }
            tally.pulled += batch.size();
            if (!ledger.tracker().expire().isEmpty()) {
                requestFullSync(operationId);
                return tally;
            }
            if (!current(gen)) {
                log.info("Sync scope changed after merging {} events for {}", merged.get(), operationId);
                tally.cancelled = true;
                return tally;
            }
            cursor = cursor.advancedTo(page.lastSequence(), page.tailDigest(), clock.instant());
            cursors.save(cursor);
        }
    }

    private boolean current(long gen) {
        return scope.get().generation() == gen;
    }

    private void merge(Event remote, PullTally tally) {
        var existing = store.find(remote.id());
        if (existing.isPresent()) {
            // our own event echoed back by the authority
            if (existing.get().syncStatus() != SyncStatus.SYNCED) {
                store.updateSyncState(remote.id(), SyncStatus.SYNCED, existing.get().syncAttempts(), null);
            }
            return;
        }
        for (var ready : ledger.tracker().admit(remote)) {
            var rivals = concurrentLocal(ready);
            if (!ledger.mergeRemote(ready)) continue;
            tally.merged++;
            if (rivals.isEmpty()) continue;
            var candidates = new ArrayList<>(rivals);
            candidates.add(ready);
            try {
                var resolution = ledger.resolver().resolve(candidates);
                tally.resolutions++;
                if (resolution instanceof Resolution.Compensated c) {
                    c.compensations().forEach(ledger::appendDerived);
                } else if (resolution instanceof Resolution.Queued) {
                    tally.unresolved++;
                }
            } catch (ConflictQueueFullException e) {
                log.error("Cannot queue conflict on {}: {}", ready.target(), e.getMessage());
                tally.unresolved++;
            }
        }
    }

    private List<Event> concurrentLocal(Event remote) {
        var tracker = ledger.tracker();
        return store.findBySyncStatus(remote.operationId(), UNSYNCED).stream()
                .filter(l -> l.target().equals(remote.target()))
                .filter(l -> l.kind() == remote.kind()
                        || (l.payload() instanceof MembershipChange && remote.payload() instanceof MembershipChange))
                .filter(l -> tracker.concurrent(l, remote))
                .toList();
    }

    private void requestFullSync(String operationId) {
        fullSync.add(operationId);
        cursors.reset(deviceId, operationId);
    }

    private void onAppend(Event event) {
        if (event.syncStatus() != SyncStatus.LOCAL) return;
        synchronized (this) {
            if (executor == null) return;
            if (pendingPromotion != null) pendingPromotion.cancel(false);
            pendingPromotion = executor.schedule(this::flush, settings.debounce().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void scheduledCycle() {
        try {
            syncNow();
        } catch (RuntimeException e) {
            log.error("Sync cycle failed", e);
        }
    }
}

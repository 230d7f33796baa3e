package io.fieldledger.store;

import io.fieldledger.core.Event;
import io.fieldledger.core.SyncStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public final class InMemoryEventPersistence implements EventPersistence {
    private record Slot(String operationId, int position) {}

    private final Map<String, List<Event>> byOperation = new HashMap<>();
    private final Map<UUID, Slot> byId = new HashMap<>();

    @Override
    public synchronized void appendRaw(Event event) {
        if (byId.containsKey(event.id())) throw new IllegalStateException("event " + event.id() + " already stored");
        var stream = byOperation.computeIfAbsent(event.operationId(), k -> new ArrayList<>());
        byId.put(event.id(), new Slot(event.operationId(), stream.size()));
        stream.add(event);
    }

    @Override
    public synchronized List<Event> readRange(String operationId, long from, long to) {
        var stream = byOperation.getOrDefault(operationId, List.of());
        int lo = (int) Math.max(0, Math.min(from, stream.size()));
        int hi = (int) Math.max(lo, Math.min(to, stream.size()));
        return List.copyOf(stream.subList(lo, hi));
    }

    @Override
    public synchronized Optional<Event> readTail(String operationId) {
        var stream = byOperation.get(operationId);
        return stream == null || stream.isEmpty() ? Optional.empty() : Optional.of(stream.get(stream.size() - 1));
    }

    @Override
    public synchronized Optional<Event> findById(UUID eventId) {
        var slot = byId.get(eventId);
        return slot == null ? Optional.empty() : Optional.of(byOperation.get(slot.operationId()).get(slot.position()));
    }

    @Override
    public synchronized long size(String operationId) {
        return byOperation.getOrDefault(operationId, List.of()).size();
    }

    @Override
    public synchronized List<String> operationIds() {
        return byOperation.keySet().stream().sorted().toList();
    }

    @Override
    public synchronized void updateSyncState(UUID eventId, SyncStatus status, int attempts, String error) {
        var slot = byId.get(eventId);
        if (slot == null) throw new IllegalArgumentException("unknown event " + eventId);
        var stream = byOperation.get(slot.operationId());
        stream.set(slot.position(), stream.get(slot.position()).withSync(status, attempts, error));
    }

    @Override
    public synchronized List<Event> findBySyncStatus(String operationId, Set<SyncStatus> statuses) {
        return byOperation.getOrDefault(operationId, List.of()).stream()
                .filter(e -> statuses.contains(e.syncStatus()))
                .toList();
    }

    /** Storage corruption, for tests: replace the event at {@code position} in place. */
    synchronized void overwrite(String operationId, int position, Event replacement) {
        var stream = byOperation.get(operationId);
        byId.remove(stream.get(position).id());
        stream.set(position, replacement);
        byId.put(replacement.id(), new Slot(operationId, position));
    }

    /** Storage corruption, for tests: drop the event at {@code position}. */
    synchronized void delete(String operationId, int position) {
        var stream = byOperation.get(operationId);
        byId.remove(stream.remove(position).id());
        for (int i = position; i < stream.size(); i++) byId.put(stream.get(i).id(), new Slot(operationId, i));
    }
}

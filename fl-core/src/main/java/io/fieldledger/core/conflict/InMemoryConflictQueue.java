package io.fieldledger.core.conflict;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryConflictQueue implements ConflictQueue {
    public static final int DEFAULT_CAPACITY = 256;

    private final int capacity;
    private final Map<String, ManualConflict> open = new LinkedHashMap<>();

    public InMemoryConflictQueue() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryConflictQueue(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
    }

    @Override
    public synchronized ManualConflict offer(ManualConflict conflict) {
        var existing = open.get(conflict.conflictId());
        if (existing != null) return existing;
        if (open.size() >= capacity) throw new ConflictQueueFullException(capacity);
        open.put(conflict.conflictId(), conflict);
        return conflict;
    }

    @Override
    public synchronized Optional<ManualConflict> find(String conflictId) {
        return Optional.ofNullable(open.get(conflictId));
    }

    @Override
    public synchronized List<ManualConflict> pending(String operationId) {
        return open.values().stream()
                .filter(c -> c.operationId().equals(operationId))
                .sorted(Comparator.comparingLong(ManualConflict::detectedAt).thenComparing(ManualConflict::conflictId))
                .toList();
    }

    @Override
    public synchronized Optional<ManualConflict> remove(String conflictId) {
        return Optional.ofNullable(open.remove(conflictId));
    }

    @Override
    public synchronized int size() {
        return open.size();
    }
}

package io.fieldledger.core;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Device → highest sequence observed. Immutable; every operation returns a new clock.
 * The causality tracker derives one per event from its cause and its device predecessor.
 */
public final class VectorClock {
    private static final VectorClock EMPTY = new VectorClock(Map.of());

    private final Map<String, Long> v;

    /** Partial order classification for two clocks. */
    public enum Order { LESS, GREATER, EQUAL, CONCURRENT }

    private VectorClock(Map<String, Long> entries) {
        this.v = Map.copyOf(entries);
    }

    public static VectorClock empty() { return EMPTY; }

    public long get(String device) { return v.getOrDefault(device, 0L); }

    /** Clock with {@code device} raised to at least {@code sequence}. */
    public VectorClock advance(String device, long sequence) {
        Objects.requireNonNull(device);
        if (get(device) >= sequence) return this;
        var next = new TreeMap<>(v);
        next.put(device, sequence);
        return new VectorClock(next);
    }

    /** Element-wise max join. */
    public VectorClock join(VectorClock other) {
        Objects.requireNonNull(other);
        var next = new TreeMap<>(v);
        other.v.forEach((k, c) -> next.merge(k, c, Math::max));
        return new VectorClock(next);
    }

    /** Happens-before check (strict). */
    public boolean happensBefore(VectorClock other) { return order(other) == Order.LESS; }
    /** Concurrent check. */
    public boolean concurrentWith(VectorClock other) { return order(other) == Order.CONCURRENT; }

    /** Classify the partial order. */
    public Order order(VectorClock other) {
        boolean less = false, more = false;
        var keys = new HashSet<>(v.keySet());
        keys.addAll(other.v.keySet());
        for (var k : keys) {
            long a = get(k), b = other.get(k);
            less |= a < b;
            more |= a > b;
            if (less && more) return Order.CONCURRENT;
        }
        if (more) return Order.GREATER;
        if (less) return Order.LESS;
        return Order.EQUAL;
    }

    public Map<String, Long> snapshot() { return new TreeMap<>(v); }

    @Override public boolean equals(Object o) { return o instanceof VectorClock other && v.equals(other.v); }
    @Override public int hashCode() { return v.hashCode(); }
    @Override public String toString() { return snapshot().toString(); }
}

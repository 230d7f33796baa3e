package io.fieldledger.core;

/** Partial order among events, independent of wall-clock time. */
public interface CausalOrdering {

    /** Order of {@code a} relative to {@code b}; {@code LESS} means a happened before b. */
    VectorClock.Order order(Event a, Event b);

    default boolean concurrent(Event a, Event b) {
        return order(a, b) == VectorClock.Order.CONCURRENT;
    }

    default boolean happenedBefore(Event a, Event b) {
        return order(a, b) == VectorClock.Order.LESS;
    }
}

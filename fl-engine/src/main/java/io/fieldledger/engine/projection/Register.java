package io.fieldledger.engine.projection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import io.fieldledger.core.Event;

import java.util.List;

/**
 * One projected attribute together with its causally maximal writes.
 * <p>
 * A write superseded by a later one can never win again, so only the frontier is kept: its
 * size is bounded by the number of concurrent writers. The value is a function of that
 * frontier rather than of the order writes were applied in, see {@link OperationReducer}.
 *
 * @param writer    event whose value won; for a manual decision, the chosen candidate
 * @param contested concurrent candidates still waiting for a manual decision, empty otherwise
 */
public record Register<T>(@JsonValue T value,
                          @JsonIgnore Event writer,
                          @JsonIgnore List<Write<T>> writes,
                          @JsonIgnore List<Event> contested) {

    public Register {
        writes = List.copyOf(writes);
        contested = List.copyOf(contested);
    }

    /**
     * One event's contribution to the attribute.
     *
     * @param basis event whose kind and author rank the write: the event itself, or the
     *              chosen candidate when {@code event} is a manual decision
     */
    public record Write<T>(Event event, T value, Event basis) {}

    public boolean isContested() {
        return !contested.isEmpty();
    }

    public static <T> T valueOf(Register<T> register) {
        return register == null ? null : register.value();
    }
}

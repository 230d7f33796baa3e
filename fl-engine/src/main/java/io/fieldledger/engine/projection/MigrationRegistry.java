package io.fieldledger.engine.projection;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.SchemaVersionMismatchException;
import io.fieldledger.core.payload.FacilityCreated;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Step-wise payload upgrades applied before projection. Stored events keep their original
 * version and hash; only the projected copy is upgraded.
 */
public final class MigrationRegistry {
    private final Map<EventKind, Map<Integer, PayloadMigration>> steps = new EnumMap<>(EventKind.class);

    /** Upgrades shipped with this build. */
    public static MigrationRegistry defaults() {
        return new MigrationRegistry()
                .register(EventKind.FACILITY_CREATED, 1, p -> {
                    var f = (FacilityCreated) p;
                    return f.capacity() == null ? f.withCapacity(0) : f;
                });
    }

    /** Register the step {@code fromVersion -> fromVersion + 1}. */
    public MigrationRegistry register(EventKind kind, int fromVersion, PayloadMigration migration) {
        steps.computeIfAbsent(kind, k -> new HashMap<>()).put(fromVersion, migration);
        return this;
    }

    /**
     * The event as the current build understands it.
     *
     * @throws SchemaVersionMismatchException when the event is newer than this build or a
     *         step on the way is missing
     */
    public Event upgrade(Event event) {
        int current = event.kind().currentVersion();
        if (event.schemaVersion() == current) return event;
        if (event.schemaVersion() > current) {
            throw new SchemaVersionMismatchException(event.id(), event.kind(), event.schemaVersion(), current);
        }
        var payload = event.payload();
        for (int v = event.schemaVersion(); v < current; v++) {
            var step = steps.getOrDefault(event.kind(), Map.of()).get(v);
            if (step == null) throw new SchemaVersionMismatchException(event.id(), event.kind(), event.schemaVersion(), current);
            payload = step.upgrade(payload);
        }
        payload.validate(current);
        return event.migratedTo(current, payload);
    }
}

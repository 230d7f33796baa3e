package io.fieldledger.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySyncCursorStore implements SyncCursorStore {
    private record Key(String deviceId, String operationId) {}

    private final Map<Key, SyncCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncCursor> find(String deviceId, String operationId) {
        return Optional.ofNullable(cursors.get(new Key(deviceId, operationId)));
    }

    @Override
    public void save(SyncCursor cursor) {
        cursors.put(new Key(cursor.deviceId(), cursor.operationId()), cursor);
    }

    @Override
    public void reset(String deviceId, String operationId) {
        cursors.remove(new Key(deviceId, operationId));
    }
}

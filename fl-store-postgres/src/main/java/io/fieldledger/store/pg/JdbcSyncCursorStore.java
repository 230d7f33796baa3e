package io.fieldledger.store.pg;

import io.fieldledger.store.SyncCursor;
import io.fieldledger.store.SyncCursorStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;

public final class JdbcSyncCursorStore implements SyncCursorStore {
    private final JdbcTemplate jdbc;

    public JdbcSyncCursorStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public Optional<SyncCursor> find(String deviceId, String operationId) {
        var sql = """
          SELECT device_id, operation_id, last_sequence, tail_digest, updated_at
          FROM fl_sync_cursor WHERE device_id = ? AND operation_id = ?
          """;
        return jdbc.query(sql, mapper(), deviceId, operationId).stream().findFirst();
    }

    @Override
    public void save(SyncCursor cursor) {
        var sql = """
          INSERT INTO fl_sync_cursor (device_id, operation_id, last_sequence, tail_digest, updated_at)
          VALUES (?, ?, ?, ?, ?)
          ON CONFLICT (device_id, operation_id)
          DO UPDATE SET last_sequence = EXCLUDED.last_sequence, tail_digest = EXCLUDED.tail_digest,
                        updated_at = EXCLUDED.updated_at
          """;
        jdbc.update(sql, cursor.deviceId(), cursor.operationId(), cursor.lastSequence(), cursor.tailDigest(),
                Timestamp.from(cursor.updatedAt()));
    }

    @Override
    public void reset(String deviceId, String operationId) {
        jdbc.update("DELETE FROM fl_sync_cursor WHERE device_id = ? AND operation_id = ?", deviceId, operationId);
    }

    private RowMapper<SyncCursor> mapper() {
        return (rs, rn) -> new SyncCursor(
                rs.getString("device_id"),
                rs.getString("operation_id"),
                rs.getLong("last_sequence"),
                rs.getString("tail_digest"),
                rs.getTimestamp("updated_at").toInstant()
        );
    }
}

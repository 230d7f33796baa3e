package io.fieldledger.store.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.PayloadCodec;
import io.fieldledger.core.SyncStatus;
import io.fieldledger.store.EventPersistence;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/** Event streams in the {@code fl_event} table; payloads as JSONB. */
public final class JdbcEventPersistence implements EventPersistence {
    private static final String COLUMNS = """
            event_id, operation_id, position, kind, schema_version, actor_id, device_id, session_id, ts, sequence,
            payload, causation_id, correlation_id, hash, previous_hash, sync_status, sync_attempts, sync_error""";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper json;
    private final PayloadCodec codec;

    public JdbcEventPersistence(JdbcTemplate jdbc, ObjectMapper json) {
        this(jdbc, json, new PayloadCodec());
    }

    public JdbcEventPersistence(JdbcTemplate jdbc, ObjectMapper json, PayloadCodec codec) {
        this.jdbcTemplate = Objects.requireNonNull(jdbc);
        this.json = Objects.requireNonNull(json);
        this.codec = Objects.requireNonNull(codec);
    }

    @Override
    public void appendRaw(Event e) {
        final String sql = """
      INSERT INTO fl_event (%s)
      VALUES (?, ?, (SELECT COALESCE(MAX(position) + 1, 0) FROM fl_event WHERE operation_id = ?),
              ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?)
      """.formatted(COLUMNS);
        jdbcTemplate.update(sql,
                e.id(),
                e.operationId(),
                e.operationId(),
                e.kind().wireName(),
                e.schemaVersion(),
                e.actorId(),
                e.deviceId(),
                e.sessionId(),
                e.timestamp(),
                e.sequence(),
                toJson(e),
                e.causationId(),
                e.correlationId(),
                e.hash(),
                e.previousHash(),
                e.syncStatus().name(),
                e.syncAttempts(),
                e.syncError()
        );
    }

    @Override
    public List<Event> readRange(String operationId, long from, long to) {
        final String sql = """
      SELECT %s FROM fl_event
      WHERE operation_id = ? AND position >= ? AND position < ?
      ORDER BY position ASC
      """.formatted(COLUMNS);
        return jdbcTemplate.query(sql, mapper(), operationId, from, to);
    }

    @Override
    public Optional<Event> readTail(String operationId) {
        final String sql = """
      SELECT %s FROM fl_event WHERE operation_id = ? ORDER BY position DESC LIMIT 1
      """.formatted(COLUMNS);
        return jdbcTemplate.query(sql, mapper(), operationId).stream().findFirst();
    }

    @Override
    public Optional<Event> findById(UUID eventId) {
        final String sql = "SELECT %s FROM fl_event WHERE event_id = ?".formatted(COLUMNS);
        return jdbcTemplate.query(sql, mapper(), eventId).stream().findFirst();
    }

    @Override
    public long size(String operationId) {
        Long n = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM fl_event WHERE operation_id = ?", Long.class, operationId);
        return n == null ? 0 : n;
    }

    @Override
    public List<String> operationIds() {
        return jdbcTemplate.queryForList("SELECT DISTINCT operation_id FROM fl_event ORDER BY operation_id", String.class);
    }

    @Override
    public void updateSyncState(UUID eventId, SyncStatus status, int attempts, String error) {
        int rows = jdbcTemplate.update(
                "UPDATE fl_event SET sync_status = ?, sync_attempts = ?, sync_error = ? WHERE event_id = ?",
                status.name(), attempts, error, eventId);
        if (rows == 0) throw new IllegalArgumentException("unknown event " + eventId);
    }

    @Override
    public List<Event> findBySyncStatus(String operationId, Set<SyncStatus> statuses) {
        if (statuses.isEmpty()) return List.of();
        var placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        var sql = "SELECT %s FROM fl_event WHERE operation_id = ? AND sync_status IN (%s) ORDER BY position ASC"
                .formatted(COLUMNS, placeholders);
        var params = new ArrayList<Object>();
        params.add(operationId);
        statuses.stream().map(SyncStatus::name).sorted().forEach(params::add);
        return jdbcTemplate.query(sql, mapper(), params.toArray());
    }

    RowMapper<Event> mapper() {
        return (ResultSet rs, int rowNum) -> {
            var kind = EventKind.fromWire(rs.getString("kind"));
            int version = rs.getInt("schema_version");
            return new Event(
                    UUID.fromString(rs.getString("event_id")),
                    kind,
                    version,
                    rs.getString("actor_id"),
                    rs.getString("device_id"),
                    rs.getString("session_id"),
                    rs.getString("operation_id"),
                    rs.getLong("ts"),
                    rs.getLong("sequence"),
                    codec.decode(kind, readTree(rs.getString("payload")), version),
                    uuidOrNull(rs.getString("causation_id")),
                    uuidOrNull(rs.getString("correlation_id")),
                    rs.getString("hash"),
                    rs.getString("previous_hash"),
                    SyncStatus.valueOf(rs.getString("sync_status")),
                    rs.getInt("sync_attempts"),
                    rs.getString("sync_error"));
        };
    }

    String toJson(Event e) {
        try { return json.writeValueAsString(codec.encode(e.payload())); }
        catch (JsonProcessingException ex) { throw new IllegalStateException("cannot write payload of " + e.id(), ex); }
    }

    private JsonNode readTree(String s) {
        try { return json.readTree(s); }
        catch (JsonProcessingException ex) { throw new IllegalStateException("corrupt payload column", ex); }
    }

    private static UUID uuidOrNull(String s) {
        return s == null ? null : UUID.fromString(s);
    }
}

package io.fieldledger.store.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.conflict.ConflictQueue;
import io.fieldledger.core.conflict.ConflictQueueFullException;
import io.fieldledger.core.conflict.ManualConflict;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable manual-conflict queue: open conflicts survive a restart. The candidate events are
 * stored as wire JSON, so {@code json} must have the event module registered.
 */
public final class JdbcConflictQueue implements ConflictQueue {
    private static final TypeReference<List<Event>> EVENTS = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper json;
    private final int capacity;

    public JdbcConflictQueue(JdbcTemplate jdbc, ObjectMapper json, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.jdbc = Objects.requireNonNull(jdbc);
        this.json = Objects.requireNonNull(json);
        this.capacity = capacity;
    }

    @Override
    public synchronized ManualConflict offer(ManualConflict conflict) {
        var existing = find(conflict.conflictId());
        if (existing.isPresent()) return existing.get();
        if (size() >= capacity) throw new ConflictQueueFullException(capacity);
        var sql = """
          INSERT INTO fl_conflict (conflict_id, operation_id, kind, target, candidates, detected_at)
          VALUES (?, ?, ?, ?, ?::jsonb, ?)
          ON CONFLICT (conflict_id) DO NOTHING
          """;
        jdbc.update(sql, conflict.conflictId(), conflict.operationId(), conflict.kind().wireName(),
                conflict.target(), toJson(conflict.candidates()), conflict.detectedAt());
        return conflict;
    }

    @Override
    public Optional<ManualConflict> find(String conflictId) {
        var sql = "SELECT conflict_id, operation_id, kind, target, candidates, detected_at FROM fl_conflict WHERE conflict_id = ?";
        return jdbc.query(sql, mapper(), conflictId).stream().findFirst();
    }

    @Override
    public List<ManualConflict> pending(String operationId) {
        var sql = """
          SELECT conflict_id, operation_id, kind, target, candidates, detected_at FROM fl_conflict
          WHERE operation_id = ? ORDER BY detected_at, conflict_id
          """;
        return jdbc.query(sql, mapper(), operationId);
    }

    @Override
    public synchronized Optional<ManualConflict> remove(String conflictId) {
        var found = find(conflictId);
        found.ifPresent(c -> jdbc.update("DELETE FROM fl_conflict WHERE conflict_id = ?", conflictId));
        return found;
    }

    @Override
    public int size() {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM fl_conflict", Integer.class);
        return n == null ? 0 : n;
    }

    private RowMapper<ManualConflict> mapper() {
        return (rs, rn) -> new ManualConflict(
                rs.getString("conflict_id"),
                rs.getString("operation_id"),
                EventKind.fromWire(rs.getString("kind")),
                rs.getString("target"),
                readEvents(rs.getString("candidates")),
                rs.getLong("detected_at"));
    }

    private String toJson(List<Event> events) {
        try { return json.writerFor(EVENTS).writeValueAsString(events); }
        catch (JsonProcessingException e) { throw new IllegalStateException("cannot write conflict candidates", e); }
    }

    private List<Event> readEvents(String s) {
        try { return json.readValue(s, EVENTS); }
        catch (JsonProcessingException e) { throw new IllegalStateException("corrupt conflict candidates", e); }
    }
}

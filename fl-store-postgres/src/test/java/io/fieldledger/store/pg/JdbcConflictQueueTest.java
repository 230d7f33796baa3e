package io.fieldledger.store.pg;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.fieldledger.core.ActorContext;
import io.fieldledger.core.Determinism;
import io.fieldledger.core.EventFactory;
import io.fieldledger.core.EventJsonModule;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.conflict.ConflictQueueFullException;
import io.fieldledger.core.conflict.ManualConflict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JdbcConflictQueueTest {

    private JdbcTemplate jdbc;
    private JdbcConflictQueue queue;
    private ManualConflict conflict;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        queue = new JdbcConflictQueue(jdbc, JsonMapper.builder().addModule(new EventJsonModule()).build(), 1);
        var factory = new EventFactory(Determinism.seeded(9));
        var a = factory.create(EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "open"),
                new ActorContext("alice", "tablet-1", "s-1", "op-7"));
        var b = factory.create(EventKind.FACILITY_STATUS_CHANGED, Map.of("facilityId", "f-1", "status", "closed"),
                new ActorContext("bob", "phone-2", "s-2", "op-7"));
        conflict = ManualConflict.of(List.of(a, b));
    }

    @Test
    void offer_insertsCandidatesAsWireJson() {
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of());
        when(jdbc.queryForObject(anyString(), eq(Integer.class))).thenReturn(0);

        assertThat(queue.offer(conflict)).isSameAs(conflict);

        ArgumentCaptor<Object[]> argsCap = ArgumentCaptor.forClass(Object[].class);
        verify(jdbc).update(contains("INSERT INTO fl_conflict"), argsCap.capture());
        var args = argsCap.getValue();
        assertThat(args[0]).isEqualTo(conflict.conflictId());
        assertThat(args[2]).isEqualTo("facility.status_changed");
        assertThat(args[4]).asString().contains("\"status\":\"open\"", "\"status\":\"closed\"");
    }

    @Test
    void offer_returnsExistingWithoutInsert() {
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of(conflict));

        assertThat(queue.offer(conflict)).isSameAs(conflict);

        verify(jdbc, never()).update(anyString(), (Object[]) any());
    }

    @Test
    void offer_failsWhenFull() {
        when(jdbc.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of());
        when(jdbc.queryForObject(anyString(), eq(Integer.class))).thenReturn(1);

        assertThatThrownBy(() -> queue.offer(conflict)).isInstanceOf(ConflictQueueFullException.class);
    }
}

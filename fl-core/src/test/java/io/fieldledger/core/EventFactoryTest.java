package io.fieldledger.core;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.fieldledger.core.payload.FacilityCreated;
import io.fieldledger.core.payload.MealsServedIncrement;
import io.fieldledger.core.payload.PersonUnassigned;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventFactoryTest {

    private final ActorContext ctx = new ActorContext("alice", "tablet-1", "s-1", "op-7");
    private EventFactory factory;

    @BeforeEach
    void setUp() {
        factory = new EventFactory(Determinism.seeded(42));
    }

    @Test
    void create_buildsUnlinkedLocalEventWithDecodedPayload() {
        var event = factory.create(EventKind.FACILITY_CREATED, Map.of(
                "facilityId", "f-1", "facilityType", "shelter", "name", "High School Gym", "capacity", 150), ctx);

        assertThat(event.payload()).isEqualTo(new FacilityCreated("f-1", "shelter", "High School Gym", null, null, 150));
        assertThat(event.schemaVersion()).isEqualTo(2);
        assertThat(event.operationId()).isEqualTo("op-7");
        assertThat(event.previousHash()).isNull();
        assertThat(event.syncStatus()).isEqualTo(SyncStatus.LOCAL);
        assertThat(event.correlationId()).isEqualTo(event.id());
        assertThat(event.sequence()).isEqualTo(1);
        assertThat(EventHasher.matches(event)).isTrue();
    }

    @Test
    void create_assignsIncreasingSequencePerDevice() {
        var a = meals(10);
        var b = meals(20);
        var other = factory.create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 5),
                new ActorContext("bob", "phone-2", "s-9", "op-7"));

        assertThat(b.sequence()).isGreaterThan(a.sequence());
        assertThat(other.sequence()).isEqualTo(1);
    }

    @Test
    void create_rejectsMissingFieldByName() {
        assertThatThrownBy(() -> factory.create(EventKind.FACILITY_CREATED,
                Map.of("facilityId", "f-1", "facilityType", "shelter", "name", "Gym"), ctx))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("capacity");
    }

    @Test
    void create_rejectsUnknownMember() {
        assertThatThrownBy(() -> factory.create(EventKind.MEALS_SERVED_INCREMENT,
                Map.of("count", 3, "servedBy", "bob"), ctx))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("servedBy");
    }

    @Test
    void create_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> meals(0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("count");
        assertThatThrownBy(() -> factory.create(EventKind.FACILITY_STATUS_CHANGED,
                Map.of("facilityId", "f-1", "status", "flooded"), ctx))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("status");
    }

    @Test
    void create_rejectsMissingPayloadAndWrongVariant() {
        var empty = new HashMap<String, Object>();
        empty.put("count", null);
        assertThatThrownBy(() -> factory.create(EventKind.MEALS_SERVED_INCREMENT, empty, ctx))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> factory.create(EventKind.OPERATION_CLOSED,
                new MealsServedIncrement(3L, null, null), ctx))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("payload");
    }

    @Test
    void hash_isIdenticalForIdenticalContentOnTwoReplicas() {
        var left = new EventFactory(Determinism.seeded(7)).create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 80), ctx);
        var right = new EventFactory(Determinism.seeded(7)).create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", 80), ctx);

        assertThat(left.hash()).isEqualTo(right.hash()).hasSize(64);
        assertThat(left.linkedTo(EventHasher.GENESIS).hash()).isEqualTo(left.hash());
    }

    @Test
    void hash_changesWhenPayloadIsTamperedWith() {
        var event = meals(80);
        var tampered = new Event(event.id(), event.kind(), event.schemaVersion(), event.actorId(), event.deviceId(),
                event.sessionId(), event.operationId(), event.timestamp(), event.sequence(),
                new MealsServedIncrement(800L, null, null), event.causationId(), event.correlationId(),
                event.hash(), event.previousHash(), event.syncStatus(), event.syncAttempts(), event.syncError());

        assertThat(EventHasher.matches(tampered)).isFalse();
    }

    @Test
    void derive_isDeterministicAndCausedByItsSource() {
        var cause = meals(3);
        var payload = new PersonUnassigned("p-1", cause.id().toString(), "superseded");

        var first = factory.derive(cause, EventKind.PERSON_UNASSIGNED, payload);
        var second = new EventFactory(Determinism.system()).derive(cause, EventKind.PERSON_UNASSIGNED, payload);

        assertThat(first).isEqualTo(second);
        assertThat(first.causationId()).isEqualTo(cause.id());
        assertThat(first.correlationId()).isEqualTo(cause.correlationId());
        assertThat(first.actorId()).isEqualTo(EventFactory.SYSTEM_ACTOR);
        assertThat(first.deviceId()).isEqualTo("derived:tablet-1");
    }

    @Test
    void wireJson_carriesEveryEnvelopeField() throws Exception {
        var mapper = JsonMapper.builder().addModule(new EventJsonModule()).build();
        var event = meals(12).linkedTo(EventHasher.GENESIS).withSync(SyncStatus.FAILED, 2, "timeout");

        var json = mapper.writeValueAsString(event);
        var back = mapper.readValue(json, Event.class);

        assertThat(json).contains("\"kind\":\"metrics.meals_served.increment\"", "\"syncStatus\":\"failed\"");
        assertThat(back).isEqualTo(event);
    }

    @Test
    void wireJson_rejectsUnknownKind() {
        var mapper = JsonMapper.builder().addModule(new EventJsonModule()).build();

        assertThatThrownBy(() -> mapper.readValue("{\"kind\":\"facility.demolished\"}", Event.class))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("kind");
    }

    private Event meals(long count) {
        return factory.create(EventKind.MEALS_SERVED_INCREMENT, Map.of("count", count), ctx);
    }
}

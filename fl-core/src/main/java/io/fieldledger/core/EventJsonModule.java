package io.fieldledger.core;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.UUID;

/**
 * Wire envelope for {@link Event}: every field verbatim, payload as a nested object whose
 * shape is chosen by {@code kind}. Register on any {@code ObjectMapper} that carries events.
 */
public final class EventJsonModule extends SimpleModule {

    public EventJsonModule() {
        super("fieldledger-events");
        var codec = new PayloadCodec();
        addSerializer(Event.class, new EventSerializer(codec));
        addDeserializer(Event.class, new EventDeserializer(codec));
    }

    static final class EventSerializer extends StdSerializer<Event> {
        private final PayloadCodec codec;

        EventSerializer(PayloadCodec codec) {
            super(Event.class);
            this.codec = codec;
        }

        @Override
        public void serialize(Event e, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("id", e.id().toString());
            gen.writeStringField("kind", e.kind().wireName());
            gen.writeNumberField("schemaVersion", e.schemaVersion());
            gen.writeStringField("actorId", e.actorId());
            gen.writeStringField("deviceId", e.deviceId());
            gen.writeStringField("sessionId", e.sessionId());
            gen.writeStringField("operationId", e.operationId());
            gen.writeNumberField("timestamp", e.timestamp());
            gen.writeNumberField("sequence", e.sequence());
            gen.writeFieldName("payload");
            gen.writeTree(codec.encode(e.payload()));
            writeNullable(gen, "causationId", e.causationId());
            writeNullable(gen, "correlationId", e.correlationId());
            gen.writeStringField("hash", e.hash());
            gen.writeStringField("previousHash", e.previousHash());
            gen.writeStringField("syncStatus", e.syncStatus().name().toLowerCase());
            gen.writeNumberField("syncAttempts", e.syncAttempts());
            gen.writeStringField("syncError", e.syncError());
            gen.writeEndObject();
        }

        private static void writeNullable(JsonGenerator gen, String name, UUID value) throws IOException {
            if (value == null) gen.writeNullField(name);
            else gen.writeStringField(name, value.toString());
        }
    }

    static final class EventDeserializer extends StdDeserializer<Event> {
        private final PayloadCodec codec;

        EventDeserializer(PayloadCodec codec) {
            super(Event.class);
            this.codec = codec;
        }

        @Override
        public Event deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode n = p.readValueAsTree();
            var kind = EventKind.fromWire(text(n, "kind"));
            int version = n.path("schemaVersion").asInt(kind.currentVersion());
            var status = text(n, "syncStatus");
            return new Event(
                    requiredUuid(n, "id"),
                    kind,
                    version,
                    required(n, "actorId"),
                    required(n, "deviceId"),
                    required(n, "sessionId"),
                    required(n, "operationId"),
                    n.path("timestamp").asLong(),
                    n.path("sequence").asLong(),
                    codec.decode(kind, n.get("payload"), version),
                    uuid(n, "causationId"),
                    uuid(n, "correlationId"),
                    required(n, "hash"),
                    text(n, "previousHash"),
                    status == null ? SyncStatus.LOCAL : SyncStatus.valueOf(status.toUpperCase()),
                    n.path("syncAttempts").asInt(0),
                    text(n, "syncError"));
        }

        private static String text(JsonNode n, String field) {
            var v = n.get(field);
            return v == null || v.isNull() ? null : v.asText();
        }

        private static String required(JsonNode n, String field) {
            var v = text(n, field);
            if (v == null || v.isBlank()) throw new ValidationException(field, "is required");
            return v;
        }

        private static UUID requiredUuid(JsonNode n, String field) {
            required(n, field);
            return uuid(n, field);
        }

        private static UUID uuid(JsonNode n, String field) {
            var v = text(n, field);
            if (v == null) return null;
            try {
                return UUID.fromString(v);
            } catch (IllegalArgumentException ex) {
                throw new ValidationException(field, "not a UUID: " + v, ex);
            }
        }
    }
}

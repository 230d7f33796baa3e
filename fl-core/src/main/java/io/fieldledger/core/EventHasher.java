package io.fieldledger.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fieldledger.core.payload.Payload;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.UUID;

/**
 * SHA-256 over the canonical JSON of {@code (actorId, id, kind, payload, timestamp)}:
 * object keys sorted at every level, null members omitted, UTF-8, hex encoded.
 * Independently built events with identical content hash identically.
 */
public final class EventHasher {

    /** Declared predecessor of the first event in every stream. */
    public static final String GENESIS = "0".repeat(64);

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private EventHasher() {}

    public static String hash(Event e) {
        return hash(e.id(), e.kind(), e.actorId(), e.timestamp(), e.payload());
    }

    public static String hash(UUID id, EventKind kind, String actorId, long timestamp, Payload payload) {
        ObjectNode root = CANONICAL.createObjectNode();
        root.put("actorId", actorId);
        root.put("id", id.toString());
        root.put("kind", kind.wireName());
        root.set("payload", sorted(CANONICAL.valueToTree(payload)));
        root.put("timestamp", timestamp);
        try {
            byte[] bytes = CANONICAL.writeValueAsBytes(root);
            return HexFormat.of().formatHex(Determinism.sha256().digest(bytes));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("cannot canonicalize payload of " + id, ex);
        }
    }

    /** True when {@code e.hash()} matches its content. */
    public static boolean matches(Event e) {
        return hash(e).equals(e.hash());
    }

    private static JsonNode sorted(JsonNode node) {
        if (node instanceof ObjectNode obj) {
            var names = new ArrayList<String>();
            obj.fieldNames().forEachRemaining(names::add);
            names.sort(null);
            ObjectNode out = CANONICAL.createObjectNode();
            for (var name : names) {
                JsonNode child = obj.get(name);
                if (!child.isNull()) out.set(name, sorted(child));
            }
            return out;
        }
        if (node instanceof ArrayNode arr) {
            ArrayNode out = CANONICAL.createArrayNode();
            arr.forEach(child -> out.add(sorted(child)));
            return out;
        }
        return node;
    }
}

package io.fieldledger.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.fieldledger.core.payload.Payload;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns loosely typed input (form maps, wire JSON) into the kind's payload record and
 * validates it. Unknown members are rejected: a kind's shape never widens silently.
 */
public final class PayloadCodec {

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    public Payload decode(EventKind kind, Map<String, ?> raw, int schemaVersion) {
        if (raw == null) throw new ValidationException("payload", "is required");
        JsonNode node = mapper.valueToTree(raw);
        return decode(kind, node, schemaVersion);
    }

    public Payload decode(EventKind kind, JsonNode node, int schemaVersion) {
        if (node == null || node.isNull()) throw new ValidationException("payload", "is required");
        if (!node.isObject()) throw new ValidationException("payload", "must be an object");
        Payload payload;
        try {
            payload = mapper.treeToValue(node, kind.payloadType());
        } catch (JsonMappingException ex) {
            throw new ValidationException(fieldOf(ex), ex.getOriginalMessage(), ex);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("payload", ex.getOriginalMessage(), ex);
        }
        payload.validate(schemaVersion);
        return payload;
    }

    public JsonNode encode(Payload payload) {
        return mapper.valueToTree(payload);
    }

    public Map<String, Object> toMap(Payload payload) {
        return mapper.convertValue(payload, new TypeReference<>() {});
    }

    private static String fieldOf(JsonMappingException ex) {
        var path = ex.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
        return path.isEmpty() ? "payload" : path;
    }
}

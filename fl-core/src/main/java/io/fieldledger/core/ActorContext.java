package io.fieldledger.core;

import java.util.Objects;

/**
 * Who is acting, from which device and session, inside which operation.
 * Passed explicitly into every call that builds an event.
 */
public record ActorContext(String actorId, String deviceId, String sessionId, String operationId) {
    public ActorContext {
        require(actorId, "actorId");
        require(deviceId, "deviceId");
        require(sessionId, "sessionId");
        require(operationId, "operationId");
    }

    public ActorContext inOperation(String otherOperationId) {
        return new ActorContext(actorId, deviceId, sessionId, otherOperationId);
    }

    private static void require(String value, String field) {
        if (Objects.requireNonNullElse(value, "").isBlank()) {
            throw new ValidationException(field, "must not be blank");
        }
    }
}

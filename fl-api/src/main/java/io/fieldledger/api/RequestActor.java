package io.fieldledger.api;

import io.fieldledger.core.ActorContext;

/** Caller identity taken from request headers; becomes an {@link ActorContext} once the operation is known. */
public record RequestActor(String actorId, String deviceId, String sessionId) {

    public ActorContext in(String operationId) {
        return new ActorContext(actorId, deviceId, sessionId, operationId);
    }
}

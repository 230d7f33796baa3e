package io.fieldledger.engine.projection;

/** A view section changed; {@code section} is its new value. */
public record ViewChange(String operationId, ViewKey key, long version, Object section) {}

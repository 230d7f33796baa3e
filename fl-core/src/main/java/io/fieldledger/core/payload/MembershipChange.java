package io.fieldledger.core.payload;

/** Payloads that add or remove an element of an observed-remove set. */
public interface MembershipChange {
    String element();

    boolean adds();
}

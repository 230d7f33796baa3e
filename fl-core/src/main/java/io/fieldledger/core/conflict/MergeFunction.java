package io.fieldledger.core.conflict;

import io.fieldledger.core.Event;

import java.util.List;

/**
 * Domain rule for a kind the generic strategies cannot express.
 * Both methods must be deterministic functions of their arguments.
 */
public interface MergeFunction {

    /** Name referenced from the policy table ({@code kind=DOMAIN:name}). */
    String name();

    Event selectWinner(List<Event> candidates);

    /** Events that undo the losers' effects. */
    List<Event> compensate(Event winner, List<Event> losers, Compensator compensator);
}

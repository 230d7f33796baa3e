package io.fieldledger.core.conflict;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.payload.PersonAssigned;
import io.fieldledger.core.payload.PersonUnassigned;

import java.util.List;

/**
 * A person holds at most one active position assignment. Among concurrent assignments
 * the earliest (first-write key) stands; each loser is released by a compensating
 * {@code roster.person_unassigned} naming the losing assignment.
 */
public final class SingleActiveAssignment implements MergeFunction {
    public static final String NAME = "single-active-assignment";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Event selectWinner(List<Event> candidates) {
        return candidates.stream().min(ConflictResolver.FIRST_WRITE).orElseThrow();
    }

    @Override
    public List<Event> compensate(Event winner, List<Event> losers, Compensator compensator) {
        return losers.stream()
                .filter(loser -> loser.payload() instanceof PersonAssigned)
                .map(loser -> {
                    var assigned = (PersonAssigned) loser.payload();
                    var release = new PersonUnassigned(assigned.personId(), loser.id().toString(),
                            "superseded by concurrent assignment " + winner.id());
                    return compensator.derive(loser, EventKind.PERSON_UNASSIGNED, release);
                })
                .toList();
    }
}

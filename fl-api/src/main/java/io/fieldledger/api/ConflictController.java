package io.fieldledger.api;

import io.fieldledger.core.Event;
import io.fieldledger.core.conflict.ManualConflict;
import io.fieldledger.engine.Ledger;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/operations/{op}/conflicts")
public class ConflictController {
    private final Ledger ledger;

    public ConflictController(Ledger ledger) {
        this.ledger = ledger;
    }

    public record ResolveRequest(UUID chosenEventId) {}

    @GetMapping
    public List<ManualConflict> open(@PathVariable("op") String op) {
        return ledger.openConflicts(op);
    }

    @PostMapping("/{conflictId}/resolve")
    public Event resolve(@PathVariable("op") String op,
                         @PathVariable("conflictId") String conflictId,
                         @RequestBody ResolveRequest req,
                         @RequestAttribute(ActorContextFilter.ATTRIBUTE) RequestActor actor) {
        return ledger.resolveConflict(conflictId, req.chosenEventId(), actor.in(op));
    }
}

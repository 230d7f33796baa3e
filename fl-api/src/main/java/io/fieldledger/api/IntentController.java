package io.fieldledger.api;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.engine.Ledger;
import io.fieldledger.store.ChainVerification;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/operations/{op}")
public class IntentController {
    private final Ledger ledger;

    public IntentController(Ledger ledger) {
        this.ledger = ledger;
    }

    /** A collaborator's intent: kind wire name, raw payload, optional cause. */
    public record IntentRequest(String kind, Map<String, Object> payload, UUID causationId, UUID correlationId) {}

    @PostMapping("/events")
    public ResponseEntity<Event> submit(@PathVariable("op") String op,
                                        @RequestBody IntentRequest req,
                                        @RequestAttribute(ActorContextFilter.ATTRIBUTE) RequestActor actor) {
        var kind = EventKind.fromWire(req.kind());
        var event = ledger.submit(kind, req.payload() == null ? Map.of() : req.payload(), actor.in(op),
                req.causationId(), req.correlationId());
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping("/events")
    public List<Event> read(@PathVariable("op") String op,
                            @RequestParam(name = "from", defaultValue = "0") long from) {
        return ledger.store().readRange(op, from);
    }

    @GetMapping("/chain")
    public ChainVerification verify(@PathVariable("op") String op) {
        return ledger.store().verifyChain(op);
    }

    /** Resume a halted stream once its chain verifies again. */
    @PostMapping("/chain/reconcile")
    public ChainVerification reconcile(@PathVariable("op") String op) {
        return ledger.store().reconcile(op);
    }
}

package io.fieldledger.api;

import io.fieldledger.core.Event;
import io.fieldledger.engine.sync.SyncManager;
import io.fieldledger.engine.sync.SyncReport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/** Device-side sync controls; answers 503 while sync is disabled on this node. */
@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private final ObjectProvider<SyncManager> sync;

    public SyncController(ObjectProvider<SyncManager> sync) {
        this.sync = sync;
    }

    @PutMapping("/scope/{op}")
    public Map<String, String> scope(@PathVariable("op") String op) {
        manager().switchOperation(op);
        return Map.of("operationId", op);
    }

    @PostMapping("/flush")
    public Map<String, Integer> flush() {
        return Map.of("promoted", manager().flush());
    }

    @PostMapping("/run")
    public SyncReport run() {
        return manager().syncNow();
    }

    @GetMapping("/{op}/stuck")
    public List<Event> stuck(@PathVariable("op") String op) {
        return manager().stuckEvents(op);
    }

    private SyncManager manager() {
        var manager = sync.getIfAvailable();
        if (manager == null) throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "sync is disabled on this node");
        return manager;
    }
}

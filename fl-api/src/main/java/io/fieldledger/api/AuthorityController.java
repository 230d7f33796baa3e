package io.fieldledger.api;

import io.fieldledger.engine.sync.InMemoryRemoteAuthority;
import io.fieldledger.engine.sync.PullRequest;
import io.fieldledger.engine.sync.PullResponse;
import io.fieldledger.engine.sync.PushReceipt;
import io.fieldledger.engine.sync.SyncBatch;
import io.fieldledger.core.ValidationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

/** The remote-authority side of sync, for devices pointing their {@code remoteUrl} at this node. */
@RestController
@RequestMapping("/api/sync/{op}")
@ConditionalOnProperty(name = "fieldledger.authority.enabled", havingValue = "true", matchIfMissing = true)
public class AuthorityController {
    private final InMemoryRemoteAuthority authority;

    public AuthorityController(InMemoryRemoteAuthority authority) {
        this.authority = authority;
    }

    @PostMapping("/push")
    public PushReceipt push(@PathVariable("op") String op, @RequestBody SyncBatch batch) {
        if (!op.equals(batch.operationId())) {
            throw new ValidationException("operationId", "batch for " + batch.operationId() + " pushed to " + op);
        }
        return authority.push(batch);
    }

    @GetMapping("/pull")
    public PullResponse pull(@PathVariable("op") String op,
                             @RequestParam(name = "since", defaultValue = "0") long since) {
        return authority.pull(new PullRequest(op, since));
    }
}

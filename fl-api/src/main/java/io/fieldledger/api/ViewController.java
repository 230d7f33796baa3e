package io.fieldledger.api;

import io.fieldledger.core.Event;
import io.fieldledger.engine.Ledger;
import io.fieldledger.engine.projection.OperationView;
import io.fieldledger.engine.projection.Projector;
import io.fieldledger.engine.projection.ViewChange;
import io.fieldledger.engine.projection.ViewKey;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

@RestController
@RequestMapping("/api/operations/{op}")
public class ViewController {
    private final Projector projector;

    public ViewController(Ledger ledger) {
        this.projector = ledger.projector();
    }

    @GetMapping("/views")
    public OperationView view(@PathVariable("op") String op) {
        return projector.view(op);
    }

    @GetMapping("/views/{key}")
    public Object section(@PathVariable("op") String op, @PathVariable("key") String key) {
        return projector.view(op, key(key));
    }

    /** Pushes the section again every time an applied event changes it. */
    @GetMapping(path = "/views/{key}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("op") String op, @PathVariable("key") String key) {
        var viewKey = key(key);
        final SseEmitter emitter = new SseEmitter(Duration.ofMinutes(30).toMillis());

        Flow.Subscriber<ViewChange> sub = new Flow.Subscriber<>() {
            Flow.Subscription s;

            @Override public void onSubscribe(Flow.Subscription s) { (this.s = s).request(Long.MAX_VALUE); }

            @Override public void onNext(ViewChange change) {
                try {
                    emitter.send(SseEmitter.event().name(viewKey.path()).id(Long.toString(change.version())).data(change));
                } catch (IOException ex) {
                    emitter.completeWithError(ex);
                    if (s != null) s.cancel();
                }
            }

            @Override public void onError(Throwable t) { emitter.completeWithError(t); }
            @Override public void onComplete() { emitter.complete(); }
        };

        projector.subscribe(op, viewKey, sub);
        return emitter;
    }

    /** Compare the live view with a fresh replay; a divergent live view is replaced. */
    @PostMapping("/views/self-test")
    public Map<String, Object> selfTest(@PathVariable("op") String op) {
        return Map.of("operationId", op, "consistent", projector.selfTest(op));
    }

    /** Events kept out of the view because no migration to the current schema exists. */
    @GetMapping("/deferred")
    public List<Event> deferred(@PathVariable("op") String op) {
        return projector.deferredEvents(op);
    }

    private static ViewKey key(String path) {
        try {
            return ViewKey.fromPath(path);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        }
    }
}

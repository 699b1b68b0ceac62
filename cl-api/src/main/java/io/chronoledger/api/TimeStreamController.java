package io.chronoledger.api;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.EntityId;
import io.chronoledger.store.TemporalStore;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Flow;

/** Server-sent stream of versions as their transactions commit. */
@RestController
@RequestMapping("/api/ticks")
public class TimeStreamController {

    private final TemporalStore store;

    public TimeStreamController(TemporalStore store) {
        this.store = store;
    }

    /** All committed versions (entityId optional via query). */
    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(name = "entityId", required = false) String entityId) {
        return subscribeFiltering(entityId);
    }

    @GetMapping(path = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamById(@PathVariable("id") String id) {
        return subscribeFiltering(id);
    }

    private SseEmitter subscribeFiltering(String entityIdOrNull) {
        final EntityId entityFilter = (entityIdOrNull == null || entityIdOrNull.isBlank()) ? null : EntityId.of(entityIdOrNull);
        final SseEmitter emitter = new SseEmitter(Duration.ofMinutes(30).toMillis());

        Flow.Subscriber<ClockRecord> sub = new Flow.Subscriber<>() {
            Flow.Subscription s;

            @Override public void onSubscribe(Flow.Subscription s) { (this.s = s).request(Long.MAX_VALUE); }

            @Override public void onNext(ClockRecord tick) {
                try {
                    if (entityFilter == null || tick.entityId().equals(entityFilter)) {
                        emitter.send(SseEmitter.event().name("tick").data(tick));
                    }
                } catch (IOException ex) {
                    emitter.completeWithError(ex);
                    if (s != null) s.cancel();
                }
            }

            @Override public void onError(Throwable t) { emitter.completeWithError(t); }
            @Override public void onComplete() { emitter.complete(); }
        };

        store.subscribe().subscribe(sub);
        return emitter;
    }
}

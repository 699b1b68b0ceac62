package io.chronoledger.api;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.EntityNotFoundException;
import io.chronoledger.core.HistoryRow;
import io.chronoledger.core.TemporalEntity;
import io.chronoledger.store.SessionFactory;
import io.chronoledger.store.TemporalSession;
import io.chronoledger.store.TemporalStore;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/entities")
public class TemporalController {
    private final SessionFactory sessions;
    private final TemporalStore store;

    public TemporalController(SessionFactory sessions, TemporalStore store) {
        this.sessions = sessions;
        this.store = store;
    }

    record CreateReq(String id, Map<String, Object> values, String activity) {}
    record UpdateReq(Map<String, Object> values, String activity) {}

    @PostMapping("/{type}")
    public ResponseEntity<EntityView> create(@PathVariable("type") String type, @RequestBody CreateReq req) {
        var id = (req.id() == null || req.id().isBlank()) ? EntityId.random() : EntityId.of(req.id());
        var values = req.values() == null ? Map.<String, Object>of() : req.values();
        var entity = sessions.inSession(s -> s.create(type, id, values, req.activity()));
        return ResponseEntity.status(HttpStatus.CREATED).body(EntityView.of(entity));
    }

    /** Applies all given values as one version. */
    @PatchMapping("/{type}/{id}")
    public ResponseEntity<EntityView> update(@PathVariable("type") String type, @PathVariable("id") String id,
                                             @RequestBody UpdateReq req) {
        var entity = sessions.inSession(s -> {
            var e = load(s, type, EntityId.of(id));
            try (var tick = s.tick(req.activity())) {
                if (req.values() != null) req.values().forEach(e::set);
            }
            return e;
        });
        return ResponseEntity.ok(EntityView.of(entity));
    }

    @GetMapping("/{type}/{id}")
    public ResponseEntity<EntityView> get(@PathVariable("type") String type, @PathVariable("id") String id) {
        var entity = sessions.inSession(s -> load(s, type, EntityId.of(id)));
        return ResponseEntity.ok(EntityView.of(entity));
    }

    @DeleteMapping("/{type}/{id}")
    public ResponseEntity<Void> delete(@PathVariable("type") String type, @PathVariable("id") String id) {
        sessions.run(s -> s.delete(load(s, type, EntityId.of(id))));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{type}/{id}/clock")
    public ResponseEntity<List<ClockRecord>> clock(@PathVariable("type") String type, @PathVariable("id") String id) {
        var entityId = EntityId.of(id);
        var clocks = store.clocks(type, entityId);
        if (clocks.isEmpty()) throw new EntityNotFoundException(entityId);
        return ResponseEntity.ok(clocks);
    }

    /** Full history of an attribute, or only the row effective at {@code asOf}. */
    @GetMapping("/{type}/{id}/history/{attribute}")
    public ResponseEntity<List<HistoryRow>> history(@PathVariable("type") String type,
                                                    @PathVariable("id") String id,
                                                    @PathVariable("attribute") String attribute,
                                                    @RequestParam(name = "asOf", required = false)
                                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        var entityId = EntityId.of(id);
        if (asOf == null) {
            return ResponseEntity.ok(store.history(type, entityId, attribute));
        }
        return ResponseEntity.ok(store.valueAt(type, entityId, attribute, asOf).stream().toList());
    }

    private static TemporalEntity load(TemporalSession s, String type, EntityId id) {
        var e = s.load(id);
        if (!e.entityType().equals(type)) throw new EntityNotFoundException(id);
        return e;
    }
}

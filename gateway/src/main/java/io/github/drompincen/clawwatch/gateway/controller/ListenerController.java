package io.github.drompincen.clawwatch.gateway.controller;

import io.github.drompincen.clawwatch.protocol.api.ActionLogEntry;
import io.github.drompincen.clawwatch.protocol.api.ListenerStatsDto;
import io.github.drompincen.clawwatch.runtime.listener.EventListener;
import io.github.drompincen.clawwatch.runtime.router.EventRouter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/listener")
@ConditionalOnProperty(prefix = "clawwatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ListenerController {

    private final EventListener listener;
    private final EventRouter router;

    public ListenerController(EventListener listener, EventRouter router) {
        this.listener = listener;
        this.router = router;
    }

    @GetMapping("/stats")
    public ListenerStatsDto stats() {
        return listener.getStats();
    }

    @GetMapping("/actions")
    public List<ActionLogEntry> actions(@RequestParam(defaultValue = "50") int limit) {
        List<ActionLogEntry> log = router.getActionLog();
        int from = Math.max(0, log.size() - Math.max(0, limit));
        return log.subList(from, log.size());
    }

    @DeleteMapping("/actions")
    public ResponseEntity<Void> clearActions() {
        router.clearActionLog();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/poll")
    public ResponseEntity<Map<String, Object>> poll() {
        int routed = listener.poll();
        if (routed < 0) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A poll cycle is already running"));
        }
        return ResponseEntity.ok(Map.of("routed", routed));
    }

    @PostMapping("/state/reset")
    public ResponseEntity<Map<String, Object>> resetState() {
        if (!listener.resetWatermarks()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A poll cycle is running, try again"));
        }
        return ResponseEntity.ok(Map.of("reset", true));
    }
}

package io.github.drompincen.clawwatch.protocol.api;

import java.time.Instant;
import java.util.Map;

/**
 * A future-dated follow-up created by the router for the task store.
 */
public record ScheduledTaskDto(
        String id,
        String name,
        String command,
        String type,
        Instant nextRunAt,
        TaskStatus status,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public static final String TYPE_ONCE = "once";
}

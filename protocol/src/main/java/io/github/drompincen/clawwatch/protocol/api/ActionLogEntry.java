package io.github.drompincen.clawwatch.protocol.api;

import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;

import java.time.Instant;

public record ActionLogEntry(
        ListenerEvent event,
        String action,
        String result,
        Instant recordedAt
) {}

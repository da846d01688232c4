package io.github.drompincen.clawwatch.protocol.api;

import java.util.List;

public record ListenerStatsDto(
        int watchers,
        List<String> watcherNames,
        long pollCount,
        long totalEvents
) {}

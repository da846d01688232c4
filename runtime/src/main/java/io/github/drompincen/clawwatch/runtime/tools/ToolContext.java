package io.github.drompincen.clawwatch.runtime.tools;

import java.time.ZoneId;

/**
 * Identifies the event a tool runs on behalf of.
 *
 * @param source wire name of the event source
 * @param eventId source-native id of the event
 * @param zone zone used to interpret dates in the tool input
 */
public record ToolContext(
        String source,
        String eventId,
        ZoneId zone
) {}

package io.github.drompincen.clawwatch.protocol.event;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source-agnostic record of something a watcher observed.
 * Instances are fully formed by the watcher and never change afterwards.
 */
public record ListenerEvent(
        EventSource source,
        ListenerEventType type,
        String subject,
        String sender,
        String body,
        Instant timestamp,
        String rawId,
        Map<String, Object> metadata
) {
    public static final int MAX_BODY_CHARS = 2000;
    public static final int SUMMARY_BODY_CHARS = 500;

    private static final DateTimeFormatter SUMMARY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public ListenerEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(rawId, "rawId");
        subject = subject != null ? subject : "";
        sender = sender != null ? sender : "";
        body = truncate(body != null ? body : "", MAX_BODY_CHARS);
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Concise multi-line description used in classifier and agent prompts.
     */
    public String toSummary(ZoneId zone) {
        StringBuilder sb = new StringBuilder();
        sb.append("Source: ").append(source.wireName()).append('\n');
        sb.append("Type: ").append(type.wireName()).append('\n');
        sb.append("From: ").append(sender).append('\n');
        sb.append("Subject: ").append(subject).append('\n');
        if (!body.isEmpty()) {
            String preview = body.length() > SUMMARY_BODY_CHARS
                    ? body.substring(0, SUMMARY_BODY_CHARS) + "..."
                    : body;
            sb.append("Body: ").append(preview).append('\n');
        }
        sb.append("Date: ").append(SUMMARY_DATE.format(timestamp.atZone(zone)));
        return sb.toString();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source", source.wireName());
        map.put("type", type.wireName());
        map.put("subject", subject);
        map.put("sender", sender);
        map.put("body", body);
        map.put("timestamp", timestamp.toString());
        map.put("raw_id", rawId);
        map.put("metadata", metadata);
        return map;
    }

    private static String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen);
    }
}

package io.github.drompincen.clawwatch.runtime.listener.watcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawwatch.protocol.event.EventSource;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.protocol.event.ListenerEventType;
import io.github.drompincen.clawwatch.runtime.exec.Platform;
import io.github.drompincen.clawwatch.runtime.exec.ProcessResult;
import io.github.drompincen.clawwatch.runtime.exec.ProcessRunner;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads user-notification deliveries from the unified log with {@code log show}. The
 * checkpoint is a time, so it advances before the output is inspected; a failed read costs
 * that window rather than repeating it. {@code --start} carries an explicit offset, and log
 * lines without one are read in the host's zone.
 */
public class NotificationWatcher implements Watcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationWatcher.class);

    public static final String NAME = "notifications";
    static final Duration FIRST_RUN_LOOKBACK = Duration.ofSeconds(60);
    static final int SUBJECT_CHARS = 200;
    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final String PREDICATE =
            "subsystem == \"com.apple.UNUserNotificationCenter\" AND category == \"Delivery\"";

    private static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssZ");
    private static final DateTimeFormatter LOG_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();
    private static final Pattern LINE = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2}\\S*)\\s+\\S+\\s+([^\\s\\[]+)(?:\\[\\d+])?:?\\s+(.+)$");
    private static final List<String> HEADER_PREFIXES = List.of("Timestamp", "---", "Filtering");

    private final ProcessRunner processRunner;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ZoneId hostZone;

    public NotificationWatcher(ProcessRunner processRunner, ObjectMapper mapper, Clock clock, ZoneId hostZone) {
        this.processRunner = processRunner;
        this.mapper = mapper;
        this.clock = clock;
        this.hostZone = hostZone;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return Platform.isMacOS() && Platform.isOnPath("log");
    }

    @Override
    public List<ListenerEvent> poll(WatermarkStore store) {
        Instant now = clock.instant();
        Instant since = parseCheckpoint(store.getString(NAME, "last_check", null), now);

        List<String> command = List.of("log", "show",
                "--predicate", PREDICATE,
                "--start", SINCE_FORMAT.format(since.atZone(hostZone)),
                "--style", "json",
                "--no-pager");

        store.set(NAME, "last_check", now.toString());
        store.save();

        ProcessResult result = processRunner.run(command, TIMEOUT);
        if (!result.isSuccess() || result.stdout().isBlank()) {
            if (!result.isSuccess()) {
                log.warn("log show failed (exit {}): {}", result.exitCode(), result.stderr());
            }
            return List.of();
        }

        List<ListenerEvent> events = parseJson(result.stdout(), now);
        if (events == null) {
            events = parseLines(result.stdout(), now);
        }
        if (!events.isEmpty()) {
            log.info("Notifications: {} new notification(s)", events.size());
        }
        return events;
    }

    /** Returns null when the output is not a JSON array. */
    List<ListenerEvent> parseJson(String output, Instant now) {
        JsonNode root;
        try {
            root = mapper.readTree(output);
        } catch (JsonProcessingException e) {
            log.debug("log show output is not JSON, using line parser");
            return null;
        }
        if (root == null || !root.isArray()) {
            return null;
        }

        List<ListenerEvent> events = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode entry : root) {
            String process = text(entry, "processImagePath");
            if (process.isEmpty()) process = text(entry, "process");
            if (process.isEmpty()) process = "Unknown";
            String message = text(entry, "eventMessage");
            if (message.isEmpty()) continue;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("process", process);
            metadata.put("subsystem", text(entry, "subsystem"));
            metadata.put("category", text(entry, "category"));
            addEvent(events, seen, process, message, parseTimestamp(text(entry, "timestamp"), now), metadata);
        }
        return events;
    }

    List<ListenerEvent> parseLines(String output, Instant now) {
        List<ListenerEvent> events = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : output.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || HEADER_PREFIXES.stream().anyMatch(line::startsWith)) continue;
            Matcher m = LINE.matcher(line);
            if (!m.matches()) continue;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("process", m.group(2));
            addEvent(events, seen, m.group(2), m.group(3), parseTimestamp(m.group(1), now), metadata);
        }
        return events;
    }

    private void addEvent(List<ListenerEvent> events, Set<String> seen, String process, String message,
                          Instant timestamp, Map<String, Object> metadata) {
        String hash = DigestUtils.md5DigestAsHex((process + '\0' + message).getBytes(StandardCharsets.UTF_8));
        if (!seen.add(hash)) return;
        String app = appName(process);
        metadata.put("app_name", app);
        events.add(new ListenerEvent(
                EventSource.NOTIFICATIONS,
                ListenerEventType.NOTIFICATION,
                message.length() > SUBJECT_CHARS ? message.substring(0, SUBJECT_CHARS) : message,
                app,
                message,
                timestamp,
                hash,
                metadata));
    }

    /** {@code /Applications/Slack.app/Contents/MacOS/Slack} becomes {@code Slack}. */
    static String appName(String process) {
        int bundle = process.indexOf(".app/");
        if (bundle < 0 && process.endsWith(".app")) bundle = process.length() - 4;
        if (bundle >= 0) {
            String bundlePath = process.substring(0, bundle);
            return bundlePath.substring(bundlePath.lastIndexOf('/') + 1);
        }
        Path fileName = Path.of(process).getFileName();
        return fileName != null ? fileName.toString() : process;
    }

    private Instant parseCheckpoint(String checkpoint, Instant now) {
        if (checkpoint != null) {
            try {
                return Instant.parse(checkpoint);
            } catch (DateTimeParseException e) {
                log.warn("Unparsable notification checkpoint '{}', looking back {}s", checkpoint,
                        FIRST_RUN_LOOKBACK.toSeconds());
            }
        }
        return now.minus(FIRST_RUN_LOOKBACK);
    }

    private Instant parseTimestamp(String value, Instant fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            var parsed = LOG_TIMESTAMP.parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
            return ((LocalDateTime) parsed).atZone(hostZone).toInstant();
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }
}

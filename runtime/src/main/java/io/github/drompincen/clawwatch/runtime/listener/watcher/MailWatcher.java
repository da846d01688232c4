package io.github.drompincen.clawwatch.runtime.listener.watcher;

import io.github.drompincen.clawwatch.protocol.event.EventSource;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.protocol.event.ListenerEventType;
import io.github.drompincen.clawwatch.runtime.exec.AppleScriptDates;
import io.github.drompincen.clawwatch.runtime.exec.AppleScriptRunner;
import io.github.drompincen.clawwatch.runtime.exec.Platform;
import io.github.drompincen.clawwatch.runtime.exec.ProcessResult;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Watches a Mail.app mailbox for messages with an id above the {@code last_message_id}
 * watermark.
 */
public class MailWatcher implements Watcher {

    private static final Logger log = LoggerFactory.getLogger(MailWatcher.class);

    public static final String NAME = "mail";
    static final List<String> FIELDS = List.of("id", "subject", "sender", "date", "read");
    static final int MAX_BODIES = 10;
    private static final int LIST_TIMEOUT_SECONDS = 30;
    private static final int BODY_TIMEOUT_SECONDS = 15;

    private final AppleScriptRunner runner;
    private final Clock clock;
    private final ZoneId hostZone;
    private final String mailbox;
    private final int limit;

    public MailWatcher(AppleScriptRunner runner, Clock clock, ZoneId hostZone, String mailbox, int limit) {
        this.runner = runner;
        this.clock = clock;
        this.hostZone = hostZone;
        this.mailbox = mailbox;
        this.limit = limit;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return Platform.isMacOS();
    }

    @Override
    public List<ListenerEvent> poll(WatermarkStore store) {
        long lastId = store.getLong(NAME, "last_message_id", 0L);

        Optional<ProcessResult> result = runner.runScript(buildListScript(), LIST_TIMEOUT_SECONDS);
        if (result.isEmpty() || !result.get().isSuccess() || result.get().stdout().isBlank()) {
            result.filter(r -> !r.isSuccess())
                    .ifPresent(r -> log.warn("Mail query failed (exit {}): {}", r.exitCode(), r.stderr()));
            return List.of();
        }

        List<MailRow> fresh = new ArrayList<>();
        for (Map<String, String> row : runner.parseTsv(result.get().stdout(), FIELDS)) {
            long id;
            try {
                id = Long.parseLong(row.get("id"));
            } catch (NumberFormatException e) {
                log.debug("Skipping mail row with non-numeric id '{}'", row.get("id"));
                continue;
            }
            if (id > lastId) {
                fresh.add(new MailRow(id, row.get("subject"), row.get("sender"), row.get("date"),
                        "true".equalsIgnoreCase(row.get("read"))));
            }
        }
        if (fresh.isEmpty()) {
            return List.of();
        }

        fresh.sort(Comparator.comparingLong(MailRow::id));
        long newLastId = fresh.get(fresh.size() - 1).id();
        // at most MAX_BODIES bodies per cycle; the watermark still moves past the rest
        List<MailRow> batch = fresh.subList(0, Math.min(MAX_BODIES, fresh.size()));

        List<ListenerEvent> events = new ArrayList<>();
        for (MailRow mail : batch) {
            Instant sent = AppleScriptDates.parse(mail.date(), hostZone)
                    .map(ZonedDateTime::toInstant)
                    .orElse(clock.instant());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("read", mail.read());
            metadata.put("mailbox", mailbox);
            events.add(new ListenerEvent(
                    EventSource.MAIL,
                    ListenerEventType.NEW_EMAIL,
                    mail.subject(),
                    mail.sender(),
                    fetchBody(mail.id()),
                    sent,
                    String.valueOf(mail.id()),
                    metadata));
        }

        store.set(NAME, "last_message_id", newLastId);
        store.set(NAME, "last_check", clock.instant().toString());
        store.save();

        log.info("Mail: {} new message(s), watermark now {}", events.size(), newLastId);
        return events;
    }

    String buildListScript() {
        return """
                set output to ""
                tell application "Mail"
                    set msgs to messages of mailbox "%s" of first account
                    set msgCount to count of msgs
                    if msgCount > %d then set msgCount to %d
                    repeat with i from 1 to msgCount
                        set msg to item i of msgs
                        set output to output & (id of msg) & tab & (subject of msg) & tab & (sender of msg) & tab & ((date received of msg) as string) & tab & (read status of msg) & linefeed
                    end repeat
                end tell
                return output
                """.formatted(runner.escape(mailbox), limit, limit);
    }

    String buildBodyScript(long id) {
        return """
                tell application "Mail"
                    set msg to first message of mailbox "%s" of first account whose id is %d
                    return content of msg
                end tell
                """.formatted(runner.escape(mailbox), id);
    }

    private String fetchBody(long id) {
        Optional<ProcessResult> result = runner.runScript(buildBodyScript(id), BODY_TIMEOUT_SECONDS);
        if (result.isEmpty() || !result.get().isSuccess()) {
            log.debug("Could not fetch body of mail {}", id);
            return "";
        }
        String body = result.get().stdout();
        return body.length() > ListenerEvent.MAX_BODY_CHARS ? body.substring(0, ListenerEvent.MAX_BODY_CHARS) : body;
    }

    private record MailRow(long id, String subject, String sender, String date, boolean read) {}
}

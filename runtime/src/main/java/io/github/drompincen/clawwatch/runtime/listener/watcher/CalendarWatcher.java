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
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Watches Calendar.app for events starting between the start of today and the end of tomorrow.
 * Emits {@code new_event} the first time a UID is seen and a single {@code upcoming_event} once
 * the start falls inside the look-ahead window.
 * <p>
 * Calendar.app reads and prints dates in the host's local time, so every date crossing the
 * script boundary is formatted and parsed in {@code hostZone}, whatever zone the clock carries.
 */
public class CalendarWatcher implements Watcher {

    private static final Logger log = LoggerFactory.getLogger(CalendarWatcher.class);

    public static final String NAME = "calendar";
    static final List<String> FIELDS = List.of("summary", "start_date", "end_date", "uid", "calendar");
    private static final int SCRIPT_TIMEOUT_SECONDS = 30;

    private final AppleScriptRunner runner;
    private final Clock clock;
    private final ZoneId hostZone;
    private final int upcomingMinutes;

    public CalendarWatcher(AppleScriptRunner runner, Clock clock, ZoneId hostZone, int upcomingMinutes) {
        this.runner = runner;
        this.clock = clock;
        this.hostZone = hostZone;
        this.upcomingMinutes = upcomingMinutes;
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
        ZonedDateTime now = clock.instant().atZone(hostZone);
        Optional<ProcessResult> result = runner.runScript(buildScript(now), SCRIPT_TIMEOUT_SECONDS);
        if (result.isEmpty()) {
            return List.of();
        }
        if (!result.get().isSuccess()) {
            log.warn("Calendar query failed (exit {}): {}", result.get().exitCode(), result.get().stderr());
            return List.of();
        }

        List<Entry> entries = new ArrayList<>();
        for (Map<String, String> row : runner.parseTsv(result.get().stdout(), FIELDS)) {
            String uid = row.get("uid");
            if (uid == null || uid.isBlank()) continue;
            ZonedDateTime start = AppleScriptDates.parse(row.get("start_date"), hostZone).orElse(now);
            ZonedDateTime end = AppleScriptDates.parse(row.get("end_date"), hostZone).orElse(start.plusHours(1));
            entries.add(new Entry(row.get("summary"), start, end, uid, row.get("calendar"),
                    row.get("start_date"), row.get("end_date")));
        }
        entries.sort(Comparator.comparing(Entry::start));

        Set<String> seen = new LinkedHashSet<>(store.getStringList(NAME, "seen_uids"));
        Set<String> alerted = new LinkedHashSet<>(store.getStringList(NAME, "alerted_uids"));
        Set<String> current = new LinkedHashSet<>();
        List<ListenerEvent> events = new ArrayList<>();

        for (Entry entry : entries) {
            current.add(entry.uid());

            if (seen.add(entry.uid())) {
                events.add(new ListenerEvent(
                        EventSource.CALENDAR,
                        ListenerEventType.NEW_EVENT,
                        entry.summary(),
                        entry.calendar(),
                        "Calendar: " + entry.calendar() + "\nStart: " + entry.rawStart() + "\nEnd: " + entry.rawEnd(),
                        now.toInstant(),
                        entry.uid(),
                        metadata(entry, null)));
            }

            long secondsUntil = Duration.between(now, entry.start()).toSeconds();
            if (secondsUntil > 0 && secondsUntil <= upcomingMinutes * 60L && !alerted.contains(entry.uid())) {
                long minutesUntil = Math.max(1, Math.round(secondsUntil / 60.0));
                events.add(new ListenerEvent(
                        EventSource.CALENDAR,
                        ListenerEventType.UPCOMING_EVENT,
                        "Starting in " + minutesUntil + " min: " + entry.summary(),
                        entry.calendar(),
                        "Calendar: " + entry.calendar() + "\nStart: " + entry.rawStart(),
                        entry.start().toInstant(),
                        entry.uid() + "_upcoming",
                        metadata(entry, minutesUntil)));
                alerted.add(entry.uid());
            }
        }

        // only events still inside the window are worth remembering
        seen.retainAll(current);
        alerted.retainAll(current);

        store.set(NAME, "seen_uids", new ArrayList<>(seen));
        store.set(NAME, "alerted_uids", new ArrayList<>(alerted));
        store.set(NAME, "last_check", now.toInstant().toString());
        store.save();

        if (!events.isEmpty()) {
            log.info("Calendar: {} new event(s)", events.size());
        }
        return events;
    }

    String buildScript(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(hostZone);
        String from = AppleScriptDates.format(local.toLocalDate().atStartOfDay(hostZone));
        String to = AppleScriptDates.format(local.toLocalDate().plusDays(1).atTime(23, 59, 59).atZone(hostZone));
        return """
                set output to ""
                set startRange to date "%s"
                set endRange to date "%s"
                tell application "Calendar"
                    repeat with cal in calendars
                        set calName to name of cal
                        set evts to (every event of cal whose start date >= startRange and start date <= endRange)
                        repeat with evt in evts
                            set output to output & (summary of evt) & tab & ((start date of evt) as string) & tab & ((end date of evt) as string) & tab & (uid of evt) & tab & calName & linefeed
                        end repeat
                    end repeat
                end tell
                return output
                """.formatted(from, to);
    }

    private static Map<String, Object> metadata(Entry entry, Long minutesUntil) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("start_date", entry.rawStart());
        metadata.put("end_date", entry.rawEnd());
        metadata.put("calendar", entry.calendar());
        if (minutesUntil != null) {
            metadata.put("minutes_until", minutesUntil);
        }
        return metadata;
    }

    private record Entry(String summary, ZonedDateTime start, ZonedDateTime end, String uid,
                         String calendar, String rawStart, String rawEnd) {}
}

package io.github.drompincen.clawwatch.runtime.exec;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Formats and parses the date strings AppleScript produces and accepts,
 * e.g. {@code Saturday, March 1, 2025 at 9:00:00 AM}.
 */
public final class AppleScriptDates {

    private static final DateTimeFormatter SCRIPT_FORMAT =
            DateTimeFormatter.ofPattern("MMMM d, yyyy 'at' h:mm:ss a", Locale.US);

    private static final List<DateTimeFormatter> LOCAL_PATTERNS = List.of(
            caseInsensitive("EEEE, MMMM d, yyyy 'at' h:mm:ss a"),
            caseInsensitive("MMMM d, yyyy 'at' h:mm:ss a"),
            caseInsensitive("EEEE, d MMMM yyyy 'at' HH:mm:ss"),
            caseInsensitive("d MMMM yyyy 'at' HH:mm:ss"),
            caseInsensitive("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private AppleScriptDates() {}

    public static String format(ZonedDateTime dateTime) {
        return SCRIPT_FORMAT.format(dateTime);
    }

    public static Optional<ZonedDateTime> parse(String text, ZoneId zone) {
        if (text == null || text.isBlank()) return Optional.empty();
        // newer macOS releases put a narrow no-break space before AM/PM
        String normalized = text.replace('\u202F', ' ').replace('\u00A0', ' ').trim();

        try {
            return Optional.of(OffsetDateTime.parse(normalized).atZoneSameInstant(zone));
        } catch (DateTimeParseException ignored) {
            // not an offset timestamp, try the local forms
        }
        for (DateTimeFormatter formatter : LOCAL_PATTERNS) {
            try {
                return Optional.of(LocalDateTime.parse(normalized, formatter).atZone(zone));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US);
    }
}

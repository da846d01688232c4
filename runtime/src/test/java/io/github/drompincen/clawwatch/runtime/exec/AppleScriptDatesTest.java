package io.github.drompincen.clawwatch.runtime.exec;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class AppleScriptDatesTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void parsesLongFormWithWeekday() {
        assertThat(AppleScriptDates.parse("Saturday, March 1, 2025 at 9:00:00 AM", NEW_YORK))
                .contains(ZonedDateTime.of(2025, 3, 1, 9, 0, 0, 0, NEW_YORK));
    }

    @Test
    void parsesNarrowNoBreakSpaceBeforeMeridiem() {
        assertThat(AppleScriptDates.parse("Saturday, March 1, 2025 at 9:00:00\u202FPM", NEW_YORK))
                .contains(ZonedDateTime.of(2025, 3, 1, 21, 0, 0, 0, NEW_YORK));
    }

    @Test
    void parsesIsoForms() {
        assertThat(AppleScriptDates.parse("2025-03-01T09:00:00", NEW_YORK))
                .contains(ZonedDateTime.of(2025, 3, 1, 9, 0, 0, 0, NEW_YORK));
        assertThat(AppleScriptDates.parse("2025-03-01T14:00:00Z", NEW_YORK))
                .contains(ZonedDateTime.of(2025, 3, 1, 9, 0, 0, 0, NEW_YORK));
    }

    @Test
    void rejectsGarbage() {
        assertThat(AppleScriptDates.parse("tomorrow-ish", NEW_YORK)).isEmpty();
        assertThat(AppleScriptDates.parse(null, NEW_YORK)).isEmpty();
    }

    @Test
    void formatsForDateLiteral() {
        assertThat(AppleScriptDates.format(ZonedDateTime.of(2025, 3, 1, 0, 0, 0, 0, NEW_YORK)))
                .isEqualTo("March 1, 2025 at 12:00:00 AM");
    }
}

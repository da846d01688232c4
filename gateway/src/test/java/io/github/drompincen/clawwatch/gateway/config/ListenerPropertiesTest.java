package io.github.drompincen.clawwatch.gateway.config;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenerPropertiesTest {

    @Test
    void defaultsMatchDocumentedValues() {
        ListenerProperties properties = new ListenerProperties();

        assertThat(properties.getPollInterval()).isEqualTo(30);
        assertThat(properties.getTimezone()).isEmpty();
        assertThat(properties.getWatchers()).containsExactly("mail", "calendar", "messages", "notifications");
        assertThat(properties.getCalendar().getUpcomingMinutes()).isEqualTo(15);
        assertThat(properties.getMail().getLimit()).isEqualTo(50);
        assertThat(properties.getCodeReview().getLabel()).isEqualTo("clawwatch-review");
        assertThat(properties.getReminders().getListName()).isEqualTo("ClawWatch Actions");
        assertThat(properties.getMessages().getDbPath()).endsWith("chat.db");
        assertThat(properties.getClassifier().getApiKey()).isNull();
    }

    @Test
    void blankTimezoneResolvesToHostZone() {
        ListenerProperties properties = new ListenerProperties();

        assertThat(properties.resolveZone()).isEqualTo(ZoneId.systemDefault());
        properties.setTimezone("Europe/Berlin");
        assertThat(properties.resolveZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
    }

    @Test
    void pollIntervalBelowFloorIsRejected() {
        ListenerProperties properties = new ListenerProperties();

        assertThatThrownBy(() -> properties.setPollInterval(5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 10");
        properties.setPollInterval(10);
        assertThat(properties.getPollInterval()).isEqualTo(10);
    }
}

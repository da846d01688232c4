package io.github.drompincen.clawwatch.protocol.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void wireNamesMatchWatcherNames() {
        assertThat(EventSource.CALENDAR.wireName()).isEqualTo("calendar");
        assertThat(EventSource.MAIL.wireName()).isEqualTo("mail");
        assertThat(EventSource.MESSAGES.wireName()).isEqualTo("messages");
        assertThat(EventSource.NOTIFICATIONS.wireName()).isEqualTo("notifications");
        assertThat(EventSource.CODE_REVIEW.wireName()).isEqualTo("code_review");
    }

    @Test
    void serializesAsWireName() throws Exception {
        assertThat(mapper.writeValueAsString(EventSource.CODE_REVIEW)).isEqualTo("\"code_review\"");
        assertThat(mapper.writeValueAsString(ListenerEventType.UPCOMING_EVENT)).isEqualTo("\"upcoming_event\"");
    }

    @Test
    void deserializesFromWireName() throws Exception {
        assertThat(mapper.readValue("\"notifications\"", EventSource.class)).isEqualTo(EventSource.NOTIFICATIONS);
        assertThat(mapper.readValue("\"new_email\"", ListenerEventType.class)).isEqualTo(ListenerEventType.NEW_EMAIL);
    }

    @Test
    void unknownWireNameIsRejected() {
        assertThatThrownBy(() -> EventSource.fromWire("fax"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fax");
    }
}

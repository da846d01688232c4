package io.github.drompincen.clawwatch.protocol.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenerEventTest {

    private static final Instant TS = Instant.parse("2025-03-01T14:30:00Z");

    @Test
    void bodyIsCappedAtMaxChars() {
        ListenerEvent event = new ListenerEvent(EventSource.MAIL, ListenerEventType.NEW_EMAIL,
                "Subject", "a@b.c", "x".repeat(5000), TS, "1", Map.of());

        assertThat(event.body()).hasSize(ListenerEvent.MAX_BODY_CHARS);
    }

    @Test
    void nullTextFieldsBecomeEmpty() {
        ListenerEvent event = new ListenerEvent(EventSource.MAIL, ListenerEventType.NEW_EMAIL,
                null, null, null, TS, "1", null);

        assertThat(event.subject()).isEmpty();
        assertThat(event.sender()).isEmpty();
        assertThat(event.body()).isEmpty();
        assertThat(event.metadata()).isEmpty();
    }

    @Test
    void rawIdIsRequired() {
        assertThatThrownBy(() -> new ListenerEvent(EventSource.MAIL, ListenerEventType.NEW_EMAIL,
                "s", "f", "b", TS, null, Map.of()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void metadataIsDetachedFromCallerMap() {
        Map<String, Object> meta = new HashMap<>();
        meta.put("mailbox", "INBOX");
        ListenerEvent event = new ListenerEvent(EventSource.MAIL, ListenerEventType.NEW_EMAIL,
                "s", "f", "b", TS, "1", meta);

        meta.put("mailbox", "Archive");

        assertThat(event.metadata()).containsEntry("mailbox", "INBOX");
        assertThatThrownBy(() -> event.metadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void summaryTruncatesBodyPreviewAndFormatsDateInZone() {
        ListenerEvent event = new ListenerEvent(EventSource.MAIL, ListenerEventType.NEW_EMAIL,
                "Invoice", "billing@example.com", "y".repeat(800), TS, "42", Map.of());

        String summary = event.toSummary(ZoneOffset.ofHours(2));

        assertThat(summary).contains("Source: mail");
        assertThat(summary).contains("Type: new_email");
        assertThat(summary).contains("From: billing@example.com");
        assertThat(summary).contains("Subject: Invoice");
        assertThat(summary).contains("Body: " + "y".repeat(500) + "...");
        assertThat(summary).doesNotContain("y".repeat(501));
        assertThat(summary).endsWith("Date: 2025-03-01 16:30:00");
    }

    @Test
    void summaryOmitsEmptyBody() {
        ListenerEvent event = new ListenerEvent(EventSource.CALENDAR, ListenerEventType.NEW_EVENT,
                "Standup", "Work", "", TS, "uid-1", Map.of());

        assertThat(event.toSummary(ZoneOffset.UTC)).doesNotContain("Body:");
    }

    @Test
    void toMapUsesWireNames() {
        ListenerEvent event = new ListenerEvent(EventSource.CODE_REVIEW, ListenerEventType.CODE_REVIEW_REQUEST,
                "PR #7", "octocat", "body", TS, "7", Map.of("pr_number", 7));

        Map<String, Object> map = event.toMap();

        assertThat(map).containsEntry("source", "code_review")
                .containsEntry("type", "code_review_request")
                .containsEntry("raw_id", "7")
                .containsEntry("timestamp", "2025-03-01T14:30:00Z");
        assertThat(map.get("metadata")).isEqualTo(Map.of("pr_number", 7));
    }
}

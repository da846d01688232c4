package io.github.drompincen.clawwatch.runtime.router;

import io.github.drompincen.clawwatch.protocol.api.ClassificationResult;
import io.github.drompincen.clawwatch.protocol.api.Priority;
import io.github.drompincen.clawwatch.protocol.api.RouteAction;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;

import java.util.List;
import java.util.Locale;

/**
 * Deterministic fallback used when the remote classifier is unavailable or returns nothing
 * usable. The first keyword found, in list order, decides.
 */
public class KeywordClassifier {

    static final List<String> URGENT_KEYWORDS = List.of(
            "urgent", "asap", "action required", "due today", "deadline", "overdue");

    static final List<String> ACTION_KEYWORDS = List.of(
            "please review", "please send", "please pay", "invoice", "approval needed",
            "sign", "submit", "complete", "respond", "reply needed");

    public ClassificationResult classify(ListenerEvent event) {
        String text = (event.subject() + " " + event.body()).toLowerCase(Locale.ROOT);

        for (String keyword : URGENT_KEYWORDS) {
            if (text.contains(keyword)) {
                return ClassificationResult.of(RouteAction.CREATE_REMINDER, Priority.HIGH,
                        "Matched urgent keyword: " + keyword, event.subject());
            }
        }
        for (String keyword : ACTION_KEYWORDS) {
            if (text.contains(keyword)) {
                return ClassificationResult.of(RouteAction.CREATE_REMINDER, Priority.MEDIUM,
                        "Matched action keyword: " + keyword, event.subject());
            }
        }
        return ClassificationResult.of(RouteAction.IGNORE, Priority.LOW, "No actionable keywords found", null);
    }
}

package io.github.drompincen.clawwatch.protocol.api;

import java.util.Objects;

/**
 * Outcome of classifying one event. {@code rawAction} keeps the classifier's original
 * action string so that {@link RouteAction#UNKNOWN} results can still be logged verbatim.
 */
public record ClassificationResult(
        RouteAction action,
        String rawAction,
        Priority priority,
        String reason,
        String title,
        String dueDate
) {
    public ClassificationResult {
        Objects.requireNonNull(action, "action");
        rawAction = rawAction != null ? rawAction : action.wireName();
        priority = priority != null ? priority : Priority.MEDIUM;
        reason = reason != null ? reason : "";
    }

    public static ClassificationResult of(RouteAction action, Priority priority, String reason, String title) {
        return new ClassificationResult(action, action.wireName(), priority, reason, title, null);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasDueDate() {
        return dueDate != null && !dueDate.isBlank();
    }
}

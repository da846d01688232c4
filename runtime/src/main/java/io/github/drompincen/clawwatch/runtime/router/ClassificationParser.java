package io.github.drompincen.clawwatch.runtime.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawwatch.protocol.api.ClassificationResult;
import io.github.drompincen.clawwatch.protocol.api.Priority;
import io.github.drompincen.clawwatch.protocol.api.RouteAction;

import java.util.Optional;

/**
 * Pulls a classification out of free-form model output. The model may wrap its JSON in prose
 * or code fences, so the text is scanned for the first balanced {@code {...}} block that parses
 * and has an {@code action}.
 */
public class ClassificationParser {

    private final ObjectMapper mapper;

    public ClassificationParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<ClassificationResult> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        int from = response.indexOf('{');
        while (from >= 0) {
            int end = matchingBrace(response, from);
            // an unclosed brace may still precede a complete block
            if (end >= 0) {
                Optional<ClassificationResult> result = toResult(response.substring(from, end + 1));
                if (result.isPresent()) {
                    return result;
                }
            }
            from = response.indexOf('{', from + 1);
        }
        return Optional.empty();
    }

    private Optional<ClassificationResult> toResult(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String action = textOrNull(node, "action");
        if (action == null || action.isBlank()) {
            return Optional.empty();
        }
        String dueDate = textOrNull(node, "due_date");
        if (dueDate == null) dueDate = textOrNull(node, "dueDate");
        return Optional.of(new ClassificationResult(
                RouteAction.fromWire(action),
                action.trim(),
                Priority.fromWire(textOrNull(node, "priority")),
                textOrNull(node, "reason"),
                textOrNull(node, "title"),
                dueDate));
    }

    /** Index of the brace closing the one at {@code start}, ignoring braces inside strings. */
    static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

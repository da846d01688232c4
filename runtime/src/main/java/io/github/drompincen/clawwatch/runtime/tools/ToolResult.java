package io.github.drompincen.clawwatch.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    /** One-line text for logs and the action log: the output's {@code message}, else the error. */
    public String describe() {
        if (!success) {
            return error != null ? error : "unknown error";
        }
        if (output == null || output.isNull()) {
            return "ok";
        }
        JsonNode message = output.get("message");
        return message != null && message.isTextual() ? message.asText() : output.toString();
    }
}

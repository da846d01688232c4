package io.github.drompincen.clawwatch.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A capability the router can invoke for an event, such as creating a reminder.
 */
public interface Tool {

    String name();

    ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream);
}

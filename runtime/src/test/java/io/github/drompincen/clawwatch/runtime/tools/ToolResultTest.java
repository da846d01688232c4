package io.github.drompincen.clawwatch.runtime.tools;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successCreatesSuccessfulResult() {
        ToolResult result = ToolResult.success(new TextNode("output data"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("output data");
        assertThat(result.error()).isNull();
    }

    @Test
    void failureCreatesFailedResult() {
        ToolResult result = ToolResult.failure("something went wrong");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("something went wrong");
        assertThat(result.output()).isNull();
    }

    @Test
    void describePrefersMessageField() {
        var output = JsonNodeFactory.instance.objectNode().put("message", "Reminder created").put("id", "x-1");

        assertThat(ToolResult.success(output).describe()).isEqualTo("Reminder created");
    }

    @Test
    void describeFallsBackToJsonAndError() {
        var output = JsonNodeFactory.instance.objectNode().put("id", "x-1");

        assertThat(ToolResult.success(output).describe()).isEqualTo("{\"id\":\"x-1\"}");
        assertThat(ToolResult.success(null).describe()).isEqualTo("ok");
        assertThat(ToolResult.failure("denied").describe()).isEqualTo("denied");
    }
}

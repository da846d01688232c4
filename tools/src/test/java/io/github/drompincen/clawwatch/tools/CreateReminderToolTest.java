package io.github.drompincen.clawwatch.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawwatch.runtime.exec.AppleScriptRunner;
import io.github.drompincen.clawwatch.runtime.exec.ProcessResult;
import io.github.drompincen.clawwatch.runtime.tools.ToolContext;
import io.github.drompincen.clawwatch.runtime.tools.ToolResult;
import io.github.drompincen.clawwatch.runtime.tools.ToolStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CreateReminderToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private AppleScriptRunner runner;
    @Mock private ToolStream stream;
    @Captor private ArgumentCaptor<String> scriptCaptor;

    private CreateReminderTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        tool = new CreateReminderTool();
        tool.setAppleScriptRunner(runner);
        tool.setHostZone(ZoneId.of("UTC"));
        ctx = new ToolContext("mail", "4711", ZoneId.of("UTC"));
        when(runner.escape(anyString())).thenAnswer(inv -> inv.<String>getArgument(0).replace("\"", "\\\""));
        when(runner.runScript(anyString(), anyInt()))
                .thenReturn(Optional.of(new ProcessResult(0, "x-apple-reminder://ABC", "", false)));
    }

    @Test
    void createsReminderInNamedList() {
        ToolResult result = tool.execute(ctx, input("[high] Pay invoice", "ClawWatch Actions", null), stream);

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("status").asText()).isEqualTo("created");
        assertThat(result.output().get("reminderId").asText()).isEqualTo("x-apple-reminder://ABC");
        assertThat(result.describe()).isEqualTo("Reminder created: [high] Pay invoice");

        verify(runner).runScript(scriptCaptor.capture(), anyInt());
        String script = scriptCaptor.getValue();
        assertThat(script).contains("if not (exists list \"ClawWatch Actions\") then");
        assertThat(script).contains("with properties {name:\"[high] Pay invoice\"}");
        assertThat(script).doesNotContain("due date");
        verify(stream).progress(eq(100), anyString());
    }

    @Test
    void dueDate_becomesNineOClockDateLiteral() {
        ToolResult result = tool.execute(ctx, input("Rent", "Home", "2025-03-05"), stream);

        assertThat(result.success()).isTrue();
        verify(runner).runScript(scriptCaptor.capture(), anyInt());
        assertThat(scriptCaptor.getValue()).contains("due date:date \"March 5, 2025 at 9:00:00 AM\"");
    }

    @Test
    void dueDate_isWrittenInHostLocalTime() {
        // 09:00 in Berlin is 03:00 on a New York host
        tool.setHostZone(ZoneId.of("America/New_York"));
        ToolContext berlin = new ToolContext("mail", "4711", ZoneId.of("Europe/Berlin"));

        ToolResult result = tool.execute(berlin, input("Rent", "Home", "2025-03-05"), stream);

        assertThat(result.success()).isTrue();
        verify(runner).runScript(scriptCaptor.capture(), anyInt());
        assertThat(scriptCaptor.getValue()).contains("due date:date \"March 5, 2025 at 3:00:00 AM\"");
    }

    @Test
    void badDueDate_isDroppedNotFatal() {
        ToolResult result = tool.execute(ctx, input("Rent", "Home", "soonish"), stream);

        assertThat(result.success()).isTrue();
        verify(runner).runScript(scriptCaptor.capture(), anyInt());
        assertThat(scriptCaptor.getValue()).doesNotContain("due date");
    }

    @Test
    void quotesInTitle_areEscaped() {
        tool.execute(ctx, input("Reply to \"Q1 plan\"", "Work", null), stream);

        verify(runner).runScript(scriptCaptor.capture(), anyInt());
        assertThat(scriptCaptor.getValue()).contains("{name:\"Reply to \\\"Q1 plan\\\"\"}");
    }

    @Test
    void missingTitle_fails() {
        ToolResult result = tool.execute(ctx, input(null, "Work", null), stream);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("title");
        verify(runner, never()).runScript(anyString(), anyInt());
    }

    @Test
    void permissionDenied_fails() {
        when(runner.runScript(anyString(), anyInt())).thenReturn(Optional.empty());

        ToolResult result = tool.execute(ctx, input("Rent", "Home", null), stream);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("Not authorized");
    }

    @Test
    void scriptError_fails() {
        when(runner.runScript(anyString(), anyInt()))
                .thenReturn(Optional.of(new ProcessResult(1, "", "Reminders got an error: AppleEvent timed out.", false)));

        ToolResult result = tool.execute(ctx, input("Rent", "Home", null), stream);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("AppleEvent timed out");
    }

    @Test
    void withoutRunner_fails() {
        ToolResult result = new CreateReminderTool().execute(ctx, input("Rent", "Home", null), stream);

        assertThat(result.success()).isFalse();
    }

    @Test
    void nameMatchesRouteAction() {
        assertThat(tool.name()).isEqualTo("create_reminder");
    }

    private static ObjectNode input(String title, String listName, String dueDate) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("action", "create_reminder");
        if (title != null) node.put("title", title);
        node.put("list_name", listName);
        if (dueDate != null) node.put("due_date", dueDate);
        return node;
    }
}

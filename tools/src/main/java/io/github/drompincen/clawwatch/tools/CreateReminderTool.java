package io.github.drompincen.clawwatch.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawwatch.runtime.exec.AppleScriptDates;
import io.github.drompincen.clawwatch.runtime.exec.AppleScriptRunner;
import io.github.drompincen.clawwatch.runtime.exec.ProcessResult;
import io.github.drompincen.clawwatch.runtime.tools.Tool;
import io.github.drompincen.clawwatch.runtime.tools.ToolContext;
import io.github.drompincen.clawwatch.runtime.tools.ToolResult;
import io.github.drompincen.clawwatch.runtime.tools.ToolStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Creates a reminder in the macOS Reminders app, creating the target list on first use.
 * <p>
 * Input: {@code title} and {@code list_name} (required), {@code due_date} as {@code YYYY-MM-DD}
 * (optional). The due time is 9:00 in the event's zone; Reminders reads date literals in the
 * host's local time, so the literal is written in {@code hostZone}.
 */
public class CreateReminderTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(CreateReminderTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int SCRIPT_TIMEOUT_SECONDS = 30;
    static final LocalTime DUE_TIME = LocalTime.of(9, 0);

    private AppleScriptRunner appleScriptRunner;
    private ZoneId hostZone = ZoneId.systemDefault();

    @Override public String name() { return "create_reminder"; }

    public void setAppleScriptRunner(AppleScriptRunner appleScriptRunner) {
        this.appleScriptRunner = appleScriptRunner;
    }

    public void setHostZone(ZoneId hostZone) {
        this.hostZone = hostZone;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (appleScriptRunner == null) {
            return ToolResult.failure("AppleScript runner not available");
        }

        String title = input.path("title").asText(null);
        String listName = input.path("list_name").asText(null);
        if (title == null || title.isBlank()) return ToolResult.failure("'title' is required");
        if (listName == null || listName.isBlank()) return ToolResult.failure("'list_name' is required");

        ZoneId zone = ctx.zone() != null ? ctx.zone() : ZoneId.systemDefault();
        String dueDate = input.path("due_date").asText(null);
        String dueLiteral = null;
        if (dueDate != null && !dueDate.isBlank()) {
            try {
                dueLiteral = AppleScriptDates.format(LocalDate.parse(dueDate.trim())
                        .atTime(DUE_TIME).atZone(zone).withZoneSameInstant(hostZone));
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unparsable due date '{}' for reminder '{}'", dueDate, title);
            }
        }

        stream.progress(10, "Creating reminder in list " + listName);
        Optional<ProcessResult> result = appleScriptRunner.runScript(
                buildScript(title, listName, dueLiteral), SCRIPT_TIMEOUT_SECONDS);
        if (result.isEmpty()) {
            return ToolResult.failure("Not authorized to control Reminders");
        }
        if (!result.get().isSuccess()) {
            String error = result.get().stderr().isBlank() ? "exit code " + result.get().exitCode() : result.get().stderr();
            stream.stderrDelta(error);
            return ToolResult.failure("Reminders script failed: " + error);
        }
        stream.progress(100, "Reminder created: " + title);

        ObjectNode output = MAPPER.createObjectNode();
        output.put("status", "created");
        output.put("reminderId", result.get().stdout());
        output.put("title", title);
        output.put("list", listName);
        if (dueLiteral != null) {
            output.put("due", dueLiteral);
        }
        output.put("message", "Reminder created: " + title);
        return ToolResult.success(output);
    }

    String buildScript(String title, String listName, String dueLiteral) {
        String list = appleScriptRunner.escape(listName);
        String properties = "name:\"" + appleScriptRunner.escape(title) + "\""
                + (dueLiteral != null ? ", due date:date \"" + dueLiteral + "\"" : "");
        return """
                tell application "Reminders"
                    if not (exists list "%s") then
                        make new list with properties {name:"%s"}
                    end if
                    set newReminder to make new reminder at end of list "%s" with properties {%s}
                    return id of newReminder
                end tell
                """.formatted(list, list, list, properties);
    }
}

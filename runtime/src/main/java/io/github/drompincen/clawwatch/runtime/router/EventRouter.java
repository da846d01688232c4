package io.github.drompincen.clawwatch.runtime.router;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.clawwatch.protocol.api.ActionLogEntry;
import io.github.drompincen.clawwatch.protocol.api.ClassificationResult;
import io.github.drompincen.clawwatch.protocol.api.ScheduledTaskDto;
import io.github.drompincen.clawwatch.protocol.api.TaskStatus;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.protocol.event.ListenerEventType;
import io.github.drompincen.clawwatch.runtime.scheduler.TaskStore;
import io.github.drompincen.clawwatch.runtime.tools.Tool;
import io.github.drompincen.clawwatch.runtime.tools.ToolContext;
import io.github.drompincen.clawwatch.runtime.tools.ToolResult;
import io.github.drompincen.clawwatch.runtime.tools.ToolStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Classifies each event and dispatches it to a reminder, a scheduled task, the agent runner,
 * or nowhere. Every decision lands in the in-memory action log.
 */
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    static final int CLASSIFY_MAX_TOKENS = 256;
    static final LocalTime DEFAULT_DUE_TIME = LocalTime.of(9, 0);
    private static final DateTimeFormatter SCHEDULED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final String CLASSIFY_PROMPT = """
            Analyze this incoming event and decide if it requires action.

            %s

            Respond with ONLY a JSON object (no markdown, no explanation):
            {
              "action": "create_reminder" | "schedule_task" | "complex_action" | "ignore",
              "priority": "high" | "medium" | "low",
              "reason": "brief explanation",
              "title": "suggested reminder/task title if applicable",
              "due_date": "suggested due date if applicable, format: YYYY-MM-DD"
            }

            Rules:
            - "create_reminder": For clear action items (pay bill, review document, reply to email, etc.)
            - "schedule_task": For items that need action at a specific future date
            - "complex_action": For items requiring multi-step processing (research, compose reply, etc.)
            - "ignore": For newsletters, marketing, notifications, FYI-only items
            """;

    private final ClassifierBackend classifier;
    private final ClassificationParser parser;
    private final KeywordClassifier keywordClassifier;
    private final Tool reminderTool;
    private final AgentRunner agentRunner;
    private final TaskStore taskStore;
    private final String reminderListName;
    private final Clock clock;
    private final List<ActionLogEntry> actionLog = new CopyOnWriteArrayList<>();

    /**
     * @param classifier remote classifier, or null to always use keywords
     * @param agentRunner runner for complex actions, or null to degrade them to reminders
     * @param taskStore store for scheduled tasks, or null to degrade them to reminders
     */
    public EventRouter(ClassifierBackend classifier, ClassificationParser parser,
                       KeywordClassifier keywordClassifier, Tool reminderTool,
                       AgentRunner agentRunner, TaskStore taskStore,
                       String reminderListName, Clock clock) {
        this.classifier = classifier;
        this.parser = parser;
        this.keywordClassifier = keywordClassifier;
        this.reminderTool = reminderTool;
        this.agentRunner = agentRunner;
        this.taskStore = taskStore;
        this.reminderListName = reminderListName;
        this.clock = clock;
    }

    public void handle(ListenerEvent event) {
        log.info("Routing [{}] {}: {}", event.source(), event.type(), event.subject());

        if (event.type() == ListenerEventType.UPCOMING_EVENT) {
            log.info("Upcoming: {} (in {} min)", event.subject(), event.metadata().get("minutes_until"));
            record(event, "alert", "Logged upcoming event");
            return;
        }

        ClassificationResult classification = classify(event).orElseGet(() -> keywordClassifier.classify(event));
        log.debug("Classified {} as {} ({}): {}", event.rawId(), classification.rawAction(),
                classification.priority().wireName(), classification.reason());

        try {
            switch (classification.action()) {
                case CREATE_REMINDER -> createReminder(event, classification);
                case SCHEDULE_TASK -> scheduleTask(event, classification);
                case COMPLEX_ACTION -> runComplexAction(event, classification);
                case IGNORE -> {
                    log.info("Ignoring: {}", event.subject());
                    record(event, "ignore", "Not actionable");
                }
                case UNKNOWN -> {
                    log.warn("Unknown action '{}' for {}", classification.rawAction(), event.subject());
                    record(event, "unknown_action", "Unrecognized action: " + classification.rawAction());
                }
            }
        } catch (Exception e) {
            log.error("Dispatch of '{}' failed for {}", classification.rawAction(), event.subject(), e);
            record(event, "failed", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Asks the remote classifier. Empty when there is no classifier, the call fails, or the
     * answer holds no usable JSON; callers then fall back to keywords.
     */
    public Optional<ClassificationResult> classify(ListenerEvent event) {
        if (classifier == null) {
            return Optional.empty();
        }
        try {
            String response = classifier.classify(CLASSIFY_PROMPT.formatted(event.toSummary(clock.getZone())),
                    CLASSIFY_MAX_TOKENS);
            Optional<ClassificationResult> result = parser.parse(response);
            if (result.isEmpty()) {
                log.warn("Classifier returned no usable JSON, falling back to keywords");
            }
            return result;
        } catch (Exception e) {
            log.warn("Classification failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public List<ActionLogEntry> getActionLog() {
        return List.copyOf(actionLog);
    }

    public void clearActionLog() {
        actionLog.clear();
    }

    private void createReminder(ListenerEvent event, ClassificationResult classification) {
        String title = classification.hasTitle() ? classification.title() : event.subject();

        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("action", "create_reminder");
        input.put("title", "[" + classification.priority().wireName() + "] " + title);
        input.put("list_name", reminderListName);
        if (classification.hasDueDate()) {
            input.put("due_date", classification.dueDate());
        }

        ToolResult result = reminderTool.execute(
                new ToolContext(event.source().wireName(), event.rawId(), clock.getZone()),
                input, ToolStream.logging(log));
        if (result.success()) {
            log.info("Created reminder: {}", title);
        } else {
            log.warn("{} for '{}' failed: {}", reminderTool.name(), title, result.error());
        }
        record(event, "create_reminder", result.describe());
    }

    private void scheduleTask(ListenerEvent event, ClassificationResult classification) {
        if (taskStore == null) {
            log.warn("No task store configured, creating a reminder instead");
            createReminder(event, classification);
            return;
        }

        Instant nextRunAt = resolveNextRunAt(classification.dueDate());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("created_by", "listener");
        metadata.put("source_event", event.toMap());
        metadata.put("priority", classification.priority().wireName());

        ScheduledTaskDto task = new ScheduledTaskDto(
                newTaskId(),
                classification.hasTitle() ? classification.title() : event.subject(),
                "Follow up on: " + event.subject() + " from " + event.sender()
                        + ". Original content: " + event.body(),
                ScheduledTaskDto.TYPE_ONCE,
                nextRunAt,
                TaskStatus.PENDING,
                metadata,
                clock.instant());
        taskStore.save(task);

        String when = SCHEDULED_FORMAT.format(nextRunAt.atZone(clock.getZone()));
        log.info("Scheduled task {} '{}' for {}", task.id(), task.name(), when);
        record(event, "schedule_task", "Scheduled for " + when);
    }

    private void runComplexAction(ListenerEvent event, ClassificationResult classification) {
        if (agentRunner == null) {
            log.warn("No agent runner configured, creating a reminder instead");
            createReminder(event, classification);
            return;
        }

        String prompt = "Handle this incoming event:\n\n" + event.toSummary(clock.getZone())
                + "\n\nReason for action: " + classification.reason()
                + "\nTake the appropriate action (create reminders, draft replies, etc.)";
        try {
            AgentRunResult result = agentRunner.run(prompt);
            String text = result.answer() != null ? result.answer()
                    : result.error() != null ? result.error() : "unknown";
            log.info("Complex action for '{}' finished (success={})", event.subject(), result.success());
            record(event, "complex_action", text);
        } catch (Exception e) {
            log.error("Complex action failed for {}", event.subject(), e);
            record(event, "complex_action_failed", String.valueOf(e.getMessage()));
        }
    }

    /** {@code yyyy-MM-dd} at 09:00 in the configured zone; otherwise, or if unparsable, one day from now. */
    Instant resolveNextRunAt(String dueDate) {
        if (dueDate != null && !dueDate.isBlank()) {
            try {
                return LocalDate.parse(dueDate.trim()).atTime(DEFAULT_DUE_TIME).atZone(clock.getZone()).toInstant();
            } catch (DateTimeParseException e) {
                log.warn("Unparsable due date '{}', scheduling for tomorrow", dueDate);
            }
        }
        return clock.instant().plus(Duration.ofDays(1));
    }

    private void record(ListenerEvent event, String action, String result) {
        actionLog.add(new ActionLogEntry(event, action, result, clock.instant()));
    }

    private static String newTaskId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}

package io.github.drompincen.clawwatch.persistence.document;

import io.github.drompincen.clawwatch.protocol.api.TaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Document(collection = "scheduled_tasks")
@CompoundIndex(name = "status_next_run", def = "{'status': 1, 'nextRunAt': 1}")
public class ScheduledTaskDocument {

    @Id
    private String taskId;
    private String name;
    private String command;
    private String type;
    private Instant nextRunAt;
    private TaskStatus status;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private Instant createdAt;

    public ScheduledTaskDocument() {}

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }

    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}

package io.github.drompincen.clawwatch.runtime.scheduler;

import io.github.drompincen.clawwatch.persistence.document.ScheduledTaskDocument;
import io.github.drompincen.clawwatch.persistence.repository.ScheduledTaskRepository;
import io.github.drompincen.clawwatch.protocol.api.ScheduledTaskDto;
import io.github.drompincen.clawwatch.protocol.api.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

public class MongoTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(MongoTaskStore.class);

    private final ScheduledTaskRepository repository;

    public MongoTaskStore(ScheduledTaskRepository repository) {
        this.repository = repository;
    }

    @Override
    public ScheduledTaskDto save(ScheduledTaskDto task) {
        ScheduledTaskDocument saved = repository.save(toDocument(task));
        log.debug("Stored task {} due {}", saved.getTaskId(), saved.getNextRunAt());
        return toDto(saved);
    }

    @Override
    public List<ScheduledTaskDto> findPending() {
        return repository.findByStatusOrderByNextRunAtAsc(TaskStatus.PENDING).stream()
                .map(MongoTaskStore::toDto)
                .toList();
    }

    static ScheduledTaskDocument toDocument(ScheduledTaskDto dto) {
        ScheduledTaskDocument doc = new ScheduledTaskDocument();
        doc.setTaskId(dto.id());
        doc.setName(dto.name());
        doc.setCommand(dto.command());
        doc.setType(dto.type());
        doc.setNextRunAt(dto.nextRunAt());
        doc.setStatus(dto.status());
        doc.setMetadata(dto.metadata() != null ? new LinkedHashMap<>(dto.metadata()) : new LinkedHashMap<>());
        doc.setCreatedAt(dto.createdAt());
        return doc;
    }

    static ScheduledTaskDto toDto(ScheduledTaskDocument doc) {
        return new ScheduledTaskDto(doc.getTaskId(), doc.getName(), doc.getCommand(), doc.getType(),
                doc.getNextRunAt(), doc.getStatus(), doc.getMetadata(), doc.getCreatedAt());
    }
}

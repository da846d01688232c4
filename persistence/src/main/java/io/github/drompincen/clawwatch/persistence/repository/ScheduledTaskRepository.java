package io.github.drompincen.clawwatch.persistence.repository;

import io.github.drompincen.clawwatch.persistence.document.ScheduledTaskDocument;
import io.github.drompincen.clawwatch.protocol.api.TaskStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface ScheduledTaskRepository extends MongoRepository<ScheduledTaskDocument, String> {
    List<ScheduledTaskDocument> findByStatusOrderByNextRunAtAsc(TaskStatus status);
    List<ScheduledTaskDocument> findByStatusAndNextRunAtLessThanEqual(TaskStatus status, Instant now);
}

package io.github.drompincen.clawwatch.runtime.scheduler;

import io.github.drompincen.clawwatch.protocol.api.ScheduledTaskDto;

import java.util.List;

public interface TaskStore {

    ScheduledTaskDto save(ScheduledTaskDto task);

    List<ScheduledTaskDto> findPending();
}

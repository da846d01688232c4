package io.github.drompincen.clawwatch.protocol.api;

public enum TaskStatus {
    PENDING, RUNNING, COMPLETED, FAILED, PAUSED
}

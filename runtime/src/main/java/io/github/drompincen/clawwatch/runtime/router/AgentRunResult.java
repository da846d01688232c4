package io.github.drompincen.clawwatch.runtime.router;

public record AgentRunResult(
        boolean success,
        String answer,
        String error
) {
    public static AgentRunResult success(String answer) {
        return new AgentRunResult(true, answer, null);
    }

    public static AgentRunResult failure(String error) {
        return new AgentRunResult(false, null, error);
    }
}

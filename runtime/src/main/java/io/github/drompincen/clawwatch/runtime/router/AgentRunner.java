package io.github.drompincen.clawwatch.runtime.router;

/**
 * General-purpose agent that handles events too involved for a reminder or a scheduled task.
 */
public interface AgentRunner {

    AgentRunResult run(String prompt);
}

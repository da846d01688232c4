package io.github.drompincen.clawwatch.runtime.agent.llm;

import io.github.drompincen.clawwatch.runtime.router.AgentRunResult;
import io.github.drompincen.clawwatch.runtime.router.AgentRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

/**
 * Single-shot agent: one model call with a short system prompt, the answer is the result.
 */
public class ChatModelAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(ChatModelAgentRunner.class);

    static final String SYSTEM_PROMPT = """
            You are a personal assistant acting on incoming events (mail, messages, calendar \
            entries, notifications, code review requests). Decide what needs doing, do it where \
            you can, and answer with a short summary of what you did or what the user should do next.""";

    private final ChatModel chatModel;

    public ChatModelAgentRunner(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public AgentRunResult run(String prompt) {
        List<Message> messages = List.of(new SystemMessage(SYSTEM_PROMPT), new UserMessage(prompt));
        try {
            ChatResponse response = chatModel.call(new Prompt(messages));
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                return AgentRunResult.failure("Empty response from model");
            }
            String text = response.getResult().getOutput().getText();
            if (text == null || text.isBlank()) {
                return AgentRunResult.failure("Empty response from model");
            }
            return AgentRunResult.success(text.trim());
        } catch (Exception e) {
            log.warn("Agent run failed: {}", e.getMessage());
            return AgentRunResult.failure(e.getMessage());
        }
    }
}

package io.github.drompincen.clawwatch.runtime.agent.llm;

import io.github.drompincen.clawwatch.runtime.router.ClassifierBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Event classification through a Spring AI {@link ChatModel}.
 */
public class ChatModelClassifierBackend implements ClassifierBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatModelClassifierBackend.class);

    private final ChatModel chatModel;

    public ChatModelClassifierBackend(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String classify(String prompt, int maxTokens) {
        ChatOptions options = ChatOptions.builder()
                .maxTokens(maxTokens)
                .temperature(0.0)
                .build();
        log.debug("Classifying event ({} chars, max {} tokens)", prompt.length(), maxTokens);
        ChatResponse response = chatModel.call(new Prompt(new UserMessage(prompt), options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }
}

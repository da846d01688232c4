package io.github.drompincen.clawwatch.gateway.config;

import io.github.drompincen.clawwatch.runtime.agent.llm.ChatModelAgentRunner;
import io.github.drompincen.clawwatch.runtime.agent.llm.ChatModelClassifierBackend;
import io.github.drompincen.clawwatch.runtime.router.AgentRunner;
import io.github.drompincen.clawwatch.runtime.router.ClassifierBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Remote model wiring. Only active when {@code clawwatch.classifier.api-key} is set; without it
 * the router classifies by keywords and complex actions degrade to reminders.
 */
@Configuration
@ConditionalOnProperty(prefix = "clawwatch.classifier", name = "api-key")
public class ClassifierConfig {

    private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

    @Bean
    ChatModel classifierChatModel(ListenerProperties properties) {
        ListenerProperties.Classifier settings = properties.getClassifier();
        AnthropicApi api = AnthropicApi.builder()
                .apiKey(settings.getApiKey())
                .build();
        AnthropicChatOptions options = AnthropicChatOptions.builder()
                .model(settings.getModel())
                .maxTokens(1024)
                .build();
        log.info("Anthropic classifier enabled, model {}", settings.getModel());
        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(options)
                .build();
    }

    @Bean
    ClassifierBackend classifierBackend(ChatModel classifierChatModel) {
        return new ChatModelClassifierBackend(classifierChatModel);
    }

    @Bean
    AgentRunner agentRunner(ChatModel classifierChatModel) {
        return new ChatModelAgentRunner(classifierChatModel);
    }
}

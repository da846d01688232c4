package io.github.drompincen.clawwatch.runtime.agent.llm;

import io.github.drompincen.clawwatch.runtime.router.AgentRunResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelAgentRunnerTest {

    @Mock private ChatModel chatModel;
    @Captor private ArgumentCaptor<Prompt> promptCaptor;

    @Test
    void run_returnsModelAnswer() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("  Drafted a reply.  ")))));

        AgentRunResult result = new ChatModelAgentRunner(chatModel).run("Handle this incoming event");

        assertThat(result.success()).isTrue();
        assertThat(result.answer()).isEqualTo("Drafted a reply.");
        verify(chatModel).call(promptCaptor.capture());
        assertThat(promptCaptor.getValue().getInstructions())
                .extracting(m -> m.getMessageType())
                .containsExactly(MessageType.SYSTEM, MessageType.USER);
    }

    @Test
    void run_modelException_becomesFailure() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new RuntimeException("401 invalid x-api-key"));

        AgentRunResult result = new ChatModelAgentRunner(chatModel).run("Handle this");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("401");
    }

    @Test
    void run_blankAnswer_becomesFailure() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("")))));

        assertThat(new ChatModelAgentRunner(chatModel).run("Handle this").success()).isFalse();
    }
}

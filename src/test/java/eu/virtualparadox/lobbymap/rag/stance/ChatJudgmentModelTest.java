package eu.virtualparadox.lobbymap.rag.stance;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.lobbymap.exception.JudgmentParseException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatJudgmentModelTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ChatJudgmentModel judgmentModel =
            new ChatJudgmentModel(chatModel, new JudgmentResponseParser(new ObjectMapper()), "qwen3:1.7b");

    private void answer(final String text) {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(text)))));
    }

    @Test
    void sendsInstructionsAndEvidenceDeterministically() {
        answer("{\"evidence_scores\": [{\"score\": -1, \"reason\": \"lobbies against the levy\"}]}");

        final JudgmentResult result = judgmentModel.judge("Score the stance on carbon tax.", "Acme opposed the levy.");

        assertThat(result.score()).isEqualTo(-1);
        assertThat(result.reason()).isEqualTo("lobbies against the levy");

        final ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        final Prompt prompt = captor.getValue();
        assertThat(prompt.getInstructions()).hasSize(2);
        assertThat(prompt.getInstructions().get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
        assertThat(prompt.getInstructions().get(0).getText()).isEqualTo("Score the stance on carbon tax.");
        assertThat(prompt.getInstructions().get(1).getText()).endsWith("Acme opposed the levy.");
        assertThat(prompt.getOptions().getTemperature()).isEqualTo(0.0);
        assertThat(prompt.getOptions().getModel()).isEqualTo("qwen3:1.7b");
    }

    @Test
    void malformedAnswerIsAJudgmentParseError() {
        answer("I think the company is mildly supportive.");

        assertThatThrownBy(() -> judgmentModel.judge("Score it.", "text"))
                .isInstanceOf(JudgmentParseException.class);
    }
}

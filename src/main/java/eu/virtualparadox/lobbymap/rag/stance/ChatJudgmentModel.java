package eu.virtualparadox.lobbymap.rag.stance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Judgment model backed by a Spring AI {@link ChatModel}, called deterministically (temperature 0).
 */
@Service
@Slf4j
public class ChatJudgmentModel implements JudgmentModel {

    private final ChatModel chatModel;
    private final JudgmentResponseParser responseParser;
    private final String modelId;

    public ChatJudgmentModel(final ChatModel chatModel,
                             final JudgmentResponseParser responseParser,
                             @Value("${lobbymap.model.judgment:qwen3:1.7b}") final String modelId) {
        this.chatModel = chatModel;
        this.responseParser = responseParser;
        this.modelId = modelId;
    }

    @Override
    public JudgmentResult judge(final String prompt, final String evidenceText) {
        final ChatOptions options = ChatOptions.builder()
                .model(modelId)
                .temperature(0.0)
                .build();

        final Prompt chatPrompt = new Prompt(List.of(
                new SystemMessage(prompt),
                new UserMessage("Here is the evidence:\n" + evidenceText)
        ), options);

        final ChatResponse response = chatModel.call(chatPrompt);
        final String content = response.getResult().getOutput().getText();
        log.debug("Judgment model {} answered: {}", modelId, content);
        return responseParser.parse(content);
    }
}

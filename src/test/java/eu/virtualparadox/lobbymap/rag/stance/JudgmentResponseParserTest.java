package eu.virtualparadox.lobbymap.rag.stance;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.lobbymap.exception.JudgmentParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JudgmentResponseParserTest {

    private final JudgmentResponseParser parser = new JudgmentResponseParser(new ObjectMapper());

    @Test
    @DisplayName("Bare JSON object is accepted")
    void parsesBareObject() {
        final JudgmentResult result = parser.parse("{\"evidence_scores\": [{\"score\": 2, \"reason\": \"Backs the carbon tax.\"}]}");
        assertThat(result).isEqualTo(new JudgmentResult(2, "Backs the carbon tax."));
    }

    @Test
    @DisplayName("Reasoning block and code fence around the answer are ignored")
    void stripsThinkBlockAndFence() {
        final String raw = "<think>The text says {not json} and hesitates.</think>\n"
                + "```json\n{\"evidence_scores\": [{\"score\": -1, \"reason\": \"Lobbies for delays.\"}]}\n```";
        assertThat(parser.parse(raw)).isEqualTo(new JudgmentResult(-1, "Lobbies for delays."));
    }

    @Test
    @DisplayName("Tool-call wrapper with object or string arguments is unwrapped")
    void unwrapsToolCallArguments() {
        final String objectArgs = "{\"name\": \"score\", \"arguments\": {\"evidence_scores\": [{\"score\": 0, \"reason\": \"Neutral.\"}]}}";
        final String stringArgs = "{\"function\": {\"name\": \"score\", \"arguments\": "
                + "\"{\\\"evidence_scores\\\": [{\\\"score\\\": 1, \\\"reason\\\": \\\"Mild support.\\\"}]}\"}}";

        assertThat(parser.parse(objectArgs).score()).isZero();
        assertThat(parser.parse(stringArgs)).isEqualTo(new JudgmentResult(1, "Mild support."));
    }

    @Test
    @DisplayName("JSON embedded in prose is found, and the last valid block wins")
    void picksLastEmbeddedObject() {
        final String raw = "First guess: {\"evidence_scores\": [{\"score\": 1, \"reason\": \"draft\"}]} "
                + "Final answer: {\"evidence_scores\": [{\"score\": 2, \"reason\": \"final\"}]} Thanks.";
        assertThat(parser.parse(raw)).isEqualTo(new JudgmentResult(2, "final"));
    }

    @Test
    @DisplayName("Output cut off before its closing brackets is repaired")
    void repairsTruncatedOutput() {
        final String raw = "{\"evidence_scores\": [{\"score\": -2, \"reason\": \"Opposes the regulation.\"";
        assertThat(parser.parse(raw)).isEqualTo(new JudgmentResult(-2, "Opposes the regulation."));
    }

    @Test
    @DisplayName("Integral float scores are accepted")
    void acceptsIntegralFloat() {
        assertThat(parser.parse("{\"evidence_scores\": [{\"score\": 1.0, \"reason\": \"ok\"}]}").score()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "The company supports climate policy.",
            "{\"score\": 1, \"reason\": \"missing wrapper\"}",
            "{\"evidence_scores\": []}",
            "{\"evidence_scores\": [{\"score\": 3, \"reason\": \"too high\"}]}",
            "{\"evidence_scores\": [{\"score\": 1.5, \"reason\": \"fractional\"}]}",
            "{\"evidence_scores\": [{\"score\": \"2\", \"reason\": \"string score\"}]}",
            "{\"evidence_scores\": [{\"score\": 1}]}",
            "{\"evidence_scores\": [{\"score\": 1, \"reason\": 42}]}"
    })
    @DisplayName("Shape mismatches raise JudgmentParseException")
    void rejectsMalformedOutput(final String raw) {
        assertThatThrownBy(() -> parser.parse(raw)).isInstanceOf(JudgmentParseException.class);
    }
}

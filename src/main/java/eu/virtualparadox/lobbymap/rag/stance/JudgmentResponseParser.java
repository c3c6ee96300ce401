package eu.virtualparadox.lobbymap.rag.stance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.lobbymap.exception.JudgmentParseException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts and validates {@code {"evidence_scores": [{"score": int, "reason": string}]}} from raw model output.
 *
 * <ul>
 *   <li>Reasoning blocks ({@code <think>...</think>}) and code fences are ignored.</li>
 *   <li>The object may be the whole answer, embedded in prose, or wrapped as tool-call {@code arguments}
 *       (an object or a JSON string). The last matching object wins.</li>
 *   <li>Output cut off right before its closing brackets is repaired once.</li>
 *   <li>The first entry of {@code evidence_scores} must carry an integral {@code score} in [-2, 2] and a
 *       textual {@code reason}. Anything else is a {@link JudgmentParseException}.</li>
 * </ul>
 */
@Component
public class JudgmentResponseParser {

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>[\\s\\S]*?</think>");
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?");
    private static final List<String> TRUNCATION_REPAIRS = List.of("}", "]}", "}]}", "\"}]}");
    private static final String FIELD_SCORES = "evidence_scores";

    private final ObjectMapper objectMapper;

    public JudgmentResponseParser(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JudgmentResult parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new JudgmentParseException("Empty judgment output");
        }
        final String text = CODE_FENCE.matcher(THINK_BLOCK.matcher(raw).replaceAll("")).replaceAll("").trim();

        JsonNode match = null;
        for (int i = text.indexOf('{'); i >= 0; i = text.indexOf('{', i + 1)) {
            final JsonNode candidate = unwrap(readOrNull(text.substring(i)));
            if (candidate != null && candidate.has(FIELD_SCORES)) {
                match = candidate;
            }
        }
        if (match == null) {
            match = repairTruncated(text);
        }
        if (match == null) {
            throw new JudgmentParseException("No " + FIELD_SCORES + " object found in judgment output");
        }
        return validate(match);
    }

    private JsonNode repairTruncated(final String text) {
        final int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        for (final String suffix : TRUNCATION_REPAIRS) {
            final JsonNode candidate = unwrap(readOrNull(text.substring(start) + suffix));
            if (candidate != null && candidate.has(FIELD_SCORES)) {
                return candidate;
            }
        }
        return null;
    }

    private JsonNode unwrap(final JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode arguments = node.path("function").path("arguments");
        if (arguments.isMissingNode()) {
            arguments = node.path("arguments");
        }
        if (arguments.isObject()) {
            return arguments;
        }
        if (arguments.isTextual()) {
            return readOrNull(arguments.asText());
        }
        return node;
    }

    private JudgmentResult validate(final JsonNode node) {
        final JsonNode scores = node.get(FIELD_SCORES);
        if (!scores.isArray() || scores.isEmpty()) {
            throw new JudgmentParseException(FIELD_SCORES + " must be a non-empty array");
        }
        final JsonNode entry = scores.get(0);
        if (!entry.isObject()) {
            throw new JudgmentParseException(FIELD_SCORES + "[0] must be an object");
        }

        final JsonNode score = entry.get("score");
        if (score == null || !score.isNumber()) {
            throw new JudgmentParseException("score is missing or not a number");
        }
        final double value = score.asDouble();
        if (value != Math.rint(value)) {
            throw new JudgmentParseException("score must be an integer, got " + score);
        }
        if (value < JudgmentResult.MIN_SCORE || value > JudgmentResult.MAX_SCORE) {
            throw new JudgmentParseException("score out of range [-2, 2]: " + score);
        }

        final JsonNode reason = entry.get("reason");
        if (reason == null || !reason.isTextual()) {
            throw new JudgmentParseException("reason is missing or not a string");
        }
        return new JudgmentResult((int) value, reason.asText());
    }

    private JsonNode readOrNull(final String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}

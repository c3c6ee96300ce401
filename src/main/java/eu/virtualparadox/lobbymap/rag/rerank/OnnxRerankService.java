package eu.virtualparadox.lobbymap.rag.rerank;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.lobbymap.util.OrtInitializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.LongBuffer;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

/**
 * ONNX cross-encoder reranker with windowed scoring.
 * <p>
 * The model reads at most {@value #MAX_LEN} tokens. Longer (query, passage) encodings are cut into
 * overlapping windows, each window is scored, and the best window score is the passage score, so
 * relevant text at the end of a long chunk is not lost to truncation.
 */
@Slf4j
public final class OnnxRerankService implements RerankService, AutoCloseable {

    private static final int MAX_LEN = 512;

    private static final int WINDOW_SIZE = 480;

    private static final int WINDOW_OVERLAP = 50;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;

    public OnnxRerankService(final Path modelRoot) throws IOException, OrtException {
        final Path modelPath = modelRoot.resolve("model.onnx");
        final Path tokenizerPath = modelRoot.resolve("tokenizer.json");

        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt());
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX reranker model from {}", modelPath);
    }

    @Override
    public float score(final String query, final String candidateText) {
        try {
            final Encoding encoding = tokenizer.encode(query, candidateText);
            if (encoding.getIds().length > MAX_LEN) {
                return scoreWindows(encoding.getIds(), encoding.getAttentionMask());
            }
            return run(Arrays.copyOf(encoding.getIds(), MAX_LEN), Arrays.copyOf(encoding.getAttentionMask(), MAX_LEN));
        } catch (OrtException e) {
            throw new IllegalStateException("Failed reranking candidate", e);
        }
    }

    private float scoreWindows(final long[] ids, final long[] mask) throws OrtException {
        float bestScore = Float.NEGATIVE_INFINITY;

        for (int start = 0; start < ids.length; start += (WINDOW_SIZE - WINDOW_OVERLAP)) {
            final int end = Math.min(start + WINDOW_SIZE, ids.length);

            final long[] paddedIds = Arrays.copyOf(Arrays.copyOfRange(ids, start, end), MAX_LEN);
            final long[] paddedMask = Arrays.copyOf(Arrays.copyOfRange(mask, start, end), MAX_LEN);

            bestScore = Math.max(bestScore, run(paddedIds, paddedMask));
            if (end == ids.length) {
                break;
            }
        }
        return bestScore;
    }

    private float run(final long[] ids, final long[] mask) throws OrtException {
        try (OnnxTensor inputIds = OnnxTensor.createTensor(env, LongBuffer.wrap(ids), new long[]{1, MAX_LEN});
             OnnxTensor attentionMask = OnnxTensor.createTensor(env, LongBuffer.wrap(mask), new long[]{1, MAX_LEN});
             OrtSession.Result result = session.run(Map.of(
                     "input_ids", inputIds,
                     "attention_mask", attentionMask))) {

            final Object value = result.get(0).getValue();
            if (value instanceof float[][] logits2d) {
                // [batch, num_labels]: single regression score or [not relevant, relevant]
                return logits2d[0].length == 1 ? logits2d[0][0] : logits2d[0][1];
            }
            if (value instanceof float[] logits1d) {
                return logits1d[0];
            }
            throw new IllegalStateException("Unexpected output shape: " + value.getClass());
        }
    }

    @Override
    public void close() throws OrtException {
        tokenizer.close();
        session.close();
    }
}

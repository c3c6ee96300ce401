package eu.virtualparadox.lobbymap.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.lobbymap.util.OrtInitializer;
import eu.virtualparadox.lobbymap.util.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sentence embedding with an ONNX encoder: mean pooling over the attention mask, then L2 normalization.
 * Expects {@code model.onnx} and {@code tokenizer.json} in the model directory.
 */
public final class OnnxEmbeddingService implements EmbeddingService, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OnnxEmbeddingService.class);

    private static final int MAX_LEN = 1024;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final Path modelRoot) throws IOException, OrtException {
        final Path modelPath = modelRoot.resolve("model.onnx");
        final Path tokenizerPath = modelRoot.resolve("tokenizer.json");

        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt());
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        logger.info("Loaded ONNX embedding model: {}", modelPath);
        logger.info("Model expects inputs: {}", session.getInputNames());
    }

    @Override
    public float[] embed(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            final List<Encoding> encodings = new ArrayList<>(texts.size());
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            maxLen = Math.min(maxLen, MAX_LEN);

            final int batchSize = encodings.size();
            final long[][] inputIdArr = new long[batchSize][maxLen];
            final long[][] attnMaskArr = new long[batchSize][maxLen];
            final long[][] tokenTypeArr = new long[batchSize][maxLen];

            for (int i = 0; i < batchSize; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 OnnxTensor tokenTypes = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypes);
                }

                try (OrtSession.Result result = session.run(inputs)) {
                    final float[][][] hidden = (float[][][]) result.get(0).getValue();
                    final List<float[]> out = new ArrayList<>(batchSize);
                    for (int i = 0; i < batchSize; i++) {
                        final float[] vec = meanPool(hidden[i], attnMaskArr[i]);
                        VectorMath.normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (OrtException e) {
            throw new IllegalStateException("Failed to embed batch of " + texts.size(), e);
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVectors[i][j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    @Override
    public void close() throws OrtException {
        tokenizer.close();
        session.close();
    }
}

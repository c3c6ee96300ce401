package eu.virtualparadox.lobbymap.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Session options shared by the embedding and reranker sessions. One core is left free for
     * the parsing and indexing threads.
     */
    public static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);

            log.info("ONNX session threads: intra-op {}, inter-op {}", intraThreads, 1);
            return opts;
        } catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}

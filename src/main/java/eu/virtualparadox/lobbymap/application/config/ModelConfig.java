package eu.virtualparadox.lobbymap.application.config;

import ai.onnxruntime.OrtException;
import eu.virtualparadox.lobbymap.application.executor.ModelCallGuard;
import eu.virtualparadox.lobbymap.ingest.chunker.HuggingFaceTokenCounter;
import eu.virtualparadox.lobbymap.ingest.chunker.TokenCounter;
import eu.virtualparadox.lobbymap.ingest.chunker.WhitespaceTokenCounter;
import eu.virtualparadox.lobbymap.rag.embed.EmbeddingService;
import eu.virtualparadox.lobbymap.rag.embed.GuardedEmbeddingService;
import eu.virtualparadox.lobbymap.rag.embed.OnnxEmbeddingService;
import eu.virtualparadox.lobbymap.rag.rerank.OnnxRerankService;
import eu.virtualparadox.lobbymap.rag.rerank.RerankService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local ONNX models and the tokenizer used for chunk budgets. Models are read from
 * {@code lobbymap.models/<model id>}.
 */
@Configuration
@Slf4j
public class ModelConfig {

    @Bean(destroyMethod = "close")
    public GuardedEmbeddingService embeddingService(final ApplicationConfig config,
                                                    final ModelCallGuard guard) throws IOException, OrtException {
        final Path modelRoot = config.getModels().resolve(config.getModel().getEmbedding());
        log.info("Loading embedding model from {}", modelRoot);
        return new GuardedEmbeddingService(new OnnxEmbeddingService(modelRoot), guard,
                config.getModel().getEmbeddingBatchSize());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "lobbymap.model", name = "reranker-enabled", havingValue = "true", matchIfMissing = true)
    public OnnxRerankService rerankService(final ApplicationConfig config) throws IOException, OrtException {
        final Path modelRoot = config.getModels().resolve(config.getModel().getReranker());
        log.info("Loading reranker model from {}", modelRoot);
        return new OnnxRerankService(modelRoot);
    }

    /**
     * Counts tokens with the embedding model's tokenizer, or by whitespace when the model ships none.
     */
    @Bean
    public TokenCounter tokenCounter(final ApplicationConfig config) throws IOException {
        final Path tokenizer = config.getModels().resolve(config.getModel().getEmbedding()).resolve("tokenizer.json");
        if (Files.exists(tokenizer)) {
            return new HuggingFaceTokenCounter(tokenizer);
        }
        log.warn("No tokenizer at {}, counting whitespace-separated tokens", tokenizer);
        return new WhitespaceTokenCounter();
    }
}

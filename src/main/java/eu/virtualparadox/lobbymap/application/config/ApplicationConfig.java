package eu.virtualparadox.lobbymap.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "lobbymap")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path models;

    private Parser parser = new Parser();
    private Chunker chunker = new Chunker();
    private Models model = new Models();
    private Collection collection = new Collection();
    private Retrieval retrieval = new Retrieval();
    private ModelCall modelCall = new ModelCall();
    private Stance stance = new Stance();
    private Ingestion ingestion = new Ingestion();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
    }

    @Getter @Setter
    public static class Parser {
        /** {@code layout-aware} or {@code plain}. */
        private String strategy = "layout-aware";
        private String device = "cpu";
        private int threadCount = 4;
    }

    @Getter @Setter
    public static class Chunker {
        private int tokenBudget = 1536;
        private double similarityThreshold = 0.75;
        private boolean doublePassMerge = true;
        private int mergePassLimit = 2;
    }

    @Getter @Setter
    public static class Models {
        private String embedding = "embedding";
        private String reranker = "reranker";
        private String judgment = "qwen3:1.7b";
        private boolean rerankerEnabled = true;
        private int embeddingBatchSize = 16;
    }

    @Getter @Setter
    public static class Collection {
        private String name = "V3_docling_semantic_nomic";
    }

    @Getter @Setter
    public static class Retrieval {
        private int overfetchFactor = 3;
        private int defaultTopK = 10;
        private int indexRetryAttempts = 3;
        private long indexRetryBackoffMs = 100;
    }

    @Getter @Setter
    public static class ModelCall {
        private long timeoutMs = 30_000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 200;
        private long maxBackoffMs = 5_000;
        private int concurrencyLimit = 4;
    }

    @Getter @Setter
    public static class Stance {
        /** {@code simple} or {@code token}. */
        private String weighting = "simple";
        private String promptTemplate = "classpath:prompts/stance-prompt.txt";
    }

    @Getter @Setter
    public static class Ingestion {
        /** Parallel ingestions of distinct documents. */
        private int workerCount = 2;
    }
}

package eu.virtualparadox.lobbymap.ingest.lifecycle;

import eu.virtualparadox.lobbymap.application.config.ApplicationConfig;
import eu.virtualparadox.lobbymap.application.executor.IngestionExecutor;
import eu.virtualparadox.lobbymap.exception.IngestionFailedException;
import eu.virtualparadox.lobbymap.exception.IngestionRejectedException;
import eu.virtualparadox.lobbymap.ingest.chunker.SemanticChunker;
import eu.virtualparadox.lobbymap.ingest.model.ChunkDraft;
import eu.virtualparadox.lobbymap.ingest.model.DocumentMetadata;
import eu.virtualparadox.lobbymap.ingest.model.ParsedDocument;
import eu.virtualparadox.lobbymap.ingest.model.ParserOptions;
import eu.virtualparadox.lobbymap.ingest.parser.DocumentParser;
import eu.virtualparadox.lobbymap.ingest.parser.ParserRegistry;
import eu.virtualparadox.lobbymap.rag.embed.EmbeddingService;
import eu.virtualparadox.lobbymap.rag.index.ChunkMetadata;
import eu.virtualparadox.lobbymap.rag.index.ChunkRecord;
import eu.virtualparadox.lobbymap.rag.index.VectorIndexService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;

/**
 * Drives one document through parse, chunk, embed and index.
 * <ul>
 *   <li>Requests for the same document id are serialized by a per-document lock held for the whole run.</li>
 *   <li>A request that waited behind a run which failed transiently is rejected so the caller can retry.</li>
 *   <li>Nothing reaches the index before every stage has succeeded; the index swap itself is atomic.</li>
 *   <li>Failures are recorded as {@code FAILED} with the failing stage and surfaced, never retried here.</li>
 * </ul>
 */
@Service
@Slf4j
public class IngestionOrchestrator {

    private final DocumentParser parser;
    private final ParserOptions parserOptions;
    private final SemanticChunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndex;
    private final DocumentRegistry registry;
    private final DocumentLockTable lockTable;
    private final IngestionExecutor ingestionExecutor;
    private final int tokenBudget;
    private final double similarityThreshold;

    @Autowired
    public IngestionOrchestrator(final ParserRegistry parserRegistry,
                                 final SemanticChunker chunker,
                                 final EmbeddingService embeddingService,
                                 final VectorIndexService vectorIndex,
                                 final DocumentRegistry registry,
                                 final DocumentLockTable lockTable,
                                 final IngestionExecutor ingestionExecutor,
                                 final ApplicationConfig config) {
        this(parserRegistry.active(), parserRegistry.options(), chunker, embeddingService, vectorIndex, registry,
                lockTable, ingestionExecutor,
                config.getChunker().getTokenBudget(), config.getChunker().getSimilarityThreshold());
    }

    public IngestionOrchestrator(final DocumentParser parser,
                                 final ParserOptions parserOptions,
                                 final SemanticChunker chunker,
                                 final EmbeddingService embeddingService,
                                 final VectorIndexService vectorIndex,
                                 final DocumentRegistry registry,
                                 final DocumentLockTable lockTable,
                                 final IngestionExecutor ingestionExecutor,
                                 final int tokenBudget,
                                 final double similarityThreshold) {
        if (tokenBudget <= 0) {
            throw new IllegalArgumentException("tokenBudget must be positive");
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
        }
        this.parser = parser;
        this.parserOptions = parserOptions;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.registry = registry;
        this.lockTable = lockTable;
        this.ingestionExecutor = ingestionExecutor;
        this.tokenBudget = tokenBudget;
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Ingests a file, using its file name as document id.
     */
    public IngestionStatus ingest(final Path file, final DocumentMetadata metadata) {
        final String documentId = file.getFileName().toString();
        final byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IngestionFailedException(documentId, IngestionStage.RECEIVED, new UncheckedIOException(e));
        }
        return ingest(documentId, content, metadata);
    }

    /**
     * Ingests (or re-ingests) one document and blocks until it is committed.
     *
     * @return the {@code COMMITTED} status
     * @throws IngestionFailedException   if a stage failed; the status is {@code FAILED} with that stage
     * @throws IngestionRejectedException if this request waited behind a run that failed transiently
     * @throws CancellationException      if the calling thread was interrupted
     */
    public IngestionStatus ingest(final String documentId, final byte[] content, final DocumentMetadata metadata) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata must not be null");
        }

        try (DocumentLockTable.Handle lock = acquire(documentId)) {
            if (lock.waited()) {
                final Optional<IngestionStatus> previous = registry.get(documentId);
                if (previous.isPresent() && previous.get().isFailedTransiently()) {
                    log.warn("Rejecting ingestion of {}: preceding attempt failed transiently during {}",
                            documentId, previous.get().failedStage());
                    throw new IngestionRejectedException(documentId,
                            new IllegalStateException(previous.get().cause()));
                }
            }
            return run(documentId, content, metadata);
        }
    }

    /**
     * Queues an ingestion on the ingestion executor. Cancelling the returned future with
     * {@code mayInterruptIfRunning} interrupts the run, which then releases the document lock.
     *
     * @return future of the committed status; fails with the ingestion failure
     */
    public Future<IngestionStatus> submit(final String documentId,
                                          final byte[] content,
                                          final DocumentMetadata metadata) {
        log.info("Queued ingestion of {}", documentId);
        return ingestionExecutor.submit(() -> {
            try {
                final IngestionStatus status = ingest(documentId, content, metadata);
                log.info("Queued ingestion of {} finished: {}", documentId, status.stage());
                return status;
            } catch (IngestionRejectedException e) {
                log.warn("Queued ingestion of {} rejected, status left at the preceding failure: {}",
                        documentId, e.getMessage());
                throw e;
            } catch (CancellationException e) {
                log.warn("Queued ingestion of {} cancelled: {}", documentId, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.warn("Queued ingestion of {} failed: {}", documentId, e.getMessage());
                throw e;
            }
        });
    }

    /**
     * Removes a document and its chunks. Waits for a running ingestion of the same document.
     *
     * @return {@code false} if the index held no chunk of the document
     */
    public boolean delete(final String documentId) {
        try (DocumentLockTable.Handle ignored = acquire(documentId)) {
            final boolean removed = vectorIndex.delete(documentId);
            registry.remove(documentId);
            if (removed) {
                log.info("Deleted document {}", documentId);
            } else {
                log.info("Delete of {}: document not found", documentId);
            }
            return removed;
        }
    }

    public Optional<IngestionStatus> status(final String documentId) {
        return registry.get(documentId);
    }

    private DocumentLockTable.Handle acquire(final String documentId) {
        try {
            return lockTable.acquire(documentId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Cancelled while waiting for the lock of " + documentId);
        }
    }

    private IngestionStatus run(final String documentId, final byte[] content, final DocumentMetadata metadata) {
        IngestionStatus status = transition(IngestionStatus.received(documentId, sha256(content)));
        try {
            checkCancelled(documentId);
            status = transition(status.advance(IngestionStage.PARSING));
            final ParsedDocument parsed = parser.parse(content, parserOptions);
            if (!parsed.failedPages().isEmpty()) {
                log.warn("Document {}: skipped unreadable page(s) {}", documentId, parsed.failedPages());
            }

            checkCancelled(documentId);
            status = transition(status.advance(IngestionStage.CHUNKING));
            final List<ChunkDraft> drafts = chunker.chunk(documentId, parsed.segments(), tokenBudget, similarityThreshold);
            if (drafts.isEmpty()) {
                log.warn("Document {} produced no text, committing an empty chunk set", documentId);
            }

            checkCancelled(documentId);
            status = transition(status.advance(IngestionStage.INDEXING));
            vectorIndex.insert(documentId, toRecords(drafts, metadata));

            status = transition(status.committed(drafts.size()));
            return status;
        } catch (CancellationException e) {
            transition(status.failed(e, true));
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                transition(status.failed(e, true));
                log.warn("Ingestion of {} cancelled during {}", documentId, status.stage());
                throw new CancellationException("Ingestion of " + documentId + " cancelled during " + status.stage());
            }
            final IngestionFailedException failure = new IngestionFailedException(documentId, status.stage(), e);
            transition(status.failed(e, failure.isTransient()));
            log.error("Ingestion of {} failed during {}: {}", documentId, status.stage(), e.getMessage(), e);
            throw failure;
        }
    }

    private List<ChunkRecord> toRecords(final List<ChunkDraft> drafts, final DocumentMetadata metadata) {
        if (drafts.isEmpty()) {
            return List.of();
        }
        final List<String> texts = new ArrayList<>(drafts.size());
        for (final ChunkDraft draft : drafts) {
            texts.add(draft.text());
        }
        final List<float[]> vectors = embeddingService.embedBatch(texts);
        if (vectors.size() != drafts.size()) {
            throw new IllegalStateException("Embedder returned " + vectors.size() + " vector(s) for " + drafts.size() + " chunk(s)");
        }

        final Instant uploadTime = Instant.now();
        final List<ChunkRecord> records = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            final ChunkDraft draft = drafts.get(i);
            final ChunkMetadata chunkMetadata = new ChunkMetadata(draft.documentId(), metadata.author(),
                    metadata.region(), metadata.date(), draft.ordinal(), draft.language(), draft.tokenCount(),
                    draft.pageStart(), draft.pageEnd(), uploadTime);
            records.add(new ChunkRecord(draft.chunkId(), vectors.get(i), draft.text(), chunkMetadata));
        }
        return records;
    }

    private static void checkCancelled(final String documentId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Ingestion of " + documentId + " cancelled");
        }
    }

    private IngestionStatus transition(final IngestionStatus status) {
        registry.update(status);
        if (status.stage() == IngestionStage.COMMITTED) {
            log.info("Document {} committed with {} chunk(s)", status.documentId(), status.chunkCount());
        } else {
            log.info("Document {} -> {}", status.documentId(), status.stage());
        }
        return status;
    }

    private static String sha256(final byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

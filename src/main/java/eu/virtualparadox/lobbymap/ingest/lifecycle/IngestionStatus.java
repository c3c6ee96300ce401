package eu.virtualparadox.lobbymap.ingest.lifecycle;

import java.time.Instant;

/**
 * Latest known ingestion state of a document.
 *
 * @param documentId       document id
 * @param stage            current stage
 * @param failedStage      stage that failed, set only when {@code stage == FAILED}
 * @param cause            failure message, set only when {@code stage == FAILED}
 * @param transientFailure whether the failure is worth retrying
 * @param contentHash      SHA-256 of the submitted bytes, hex encoded
 * @param chunkCount       committed chunk count, {@code 0} until committed
 * @param updatedAt        time of the last transition
 */
public record IngestionStatus(String documentId,
                              IngestionStage stage,
                              IngestionStage failedStage,
                              String cause,
                              boolean transientFailure,
                              String contentHash,
                              int chunkCount,
                              Instant updatedAt) {

    public static IngestionStatus received(final String documentId, final String contentHash) {
        return new IngestionStatus(documentId, IngestionStage.RECEIVED, null, null, false, contentHash, 0, Instant.now());
    }

    public IngestionStatus advance(final IngestionStage next) {
        return new IngestionStatus(documentId, next, null, null, false, contentHash, chunkCount, Instant.now());
    }

    public IngestionStatus committed(final int chunks) {
        return new IngestionStatus(documentId, IngestionStage.COMMITTED, null, null, false, contentHash, chunks, Instant.now());
    }

    public IngestionStatus failed(final Throwable failure, final boolean isTransient) {
        return new IngestionStatus(documentId, IngestionStage.FAILED, stage, String.valueOf(failure.getMessage()),
                isTransient, contentHash, 0, Instant.now());
    }

    public boolean isFailedTransiently() {
        return stage == IngestionStage.FAILED && transientFailure;
    }
}

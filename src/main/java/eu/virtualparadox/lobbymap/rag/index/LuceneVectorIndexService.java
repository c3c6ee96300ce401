package eu.virtualparadox.lobbymap.rag.index;

import eu.virtualparadox.lobbymap.exception.DuplicateInsertException;
import eu.virtualparadox.lobbymap.exception.IndexUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.util.Bits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import static eu.virtualparadox.lobbymap.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code document_id}, {@code chunk_id}, {@code author}, {@code region}, {@code language}: stored
 *       {@link StringField}s, usable as exact filters</li>
 *   <li>{@code text}: {@link TextField}, stored</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField} with cosine similarity</li>
 *   <li>{@code date}: stored ISO string plus a {@link LongPoint} epoch day for range filters</li>
 *   <li>{@code ordinal}, {@code token_count}, pages, {@code upload_time}: stored only</li>
 * </ul>
 *
 * <h3>Consistency</h3>
 * A document's chunks are replaced with a single {@link IndexWriter#updateDocuments} call, which
 * deletes and adds as one block, followed by a commit and a searcher refresh. Searchers therefore
 * see the old set or the new set, never a mix. Overlapping inserts for one document are refused
 * with {@link DuplicateInsertException}.
 */
@Service
@Slf4j
public final class LuceneVectorIndexService implements VectorIndexService {

    private static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble((SearchHit h) -> h.similarity()).reversed()
            .thenComparingInt(h -> h.metadata().ordinal())
            .thenComparing(h -> h.metadata().documentId());

    private static final Map<String, String> ATTRIBUTE_FIELDS = Map.of(
            "author", FIELD_AUTHOR,
            "region", FIELD_REGION,
            "document_id", FIELD_DOC_ID,
            "language", FIELD_LANGUAGE,
            "date", FIELD_DATE);

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final String collectionName;
    private final Set<String> insertsInFlight = ConcurrentHashMap.newKeySet();

    /**
     * Dimension of the stored vectors, read from the collection on startup or taken from the first insert.
     * Lucene enforces a single dimension per vector field.
     */
    private Integer vectorDim;

    public LuceneVectorIndexService(final IndexWriter writer,
                                    final SearcherManager searcherManager,
                                    @Value("${lobbymap.collection.name:V3_docling_semantic_nomic}") final String collectionName) {
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.collectionName = collectionName;
        this.vectorDim = storedDimension();
        if (vectorDim != null) {
            log.info("Collection {} holds {}-dimensional vectors", collectionName, vectorDim);
        }
    }

    @Override
    public void insert(final String documentId, final List<ChunkRecord> chunks) {
        requireNonBlank(documentId, "documentId");
        if (chunks == null) {
            throw new IllegalArgumentException("chunks must not be null");
        }

        final List<Document> documents = new ArrayList<>(chunks.size());
        for (final ChunkRecord chunk : chunks) {
            validate(documentId, chunk);
            documents.add(buildLuceneDocument(chunk));
        }

        if (!insertsInFlight.add(documentId)) {
            throw new DuplicateInsertException(documentId);
        }
        try {
            final Term documentTerm = new Term(FIELD_DOC_ID, documentId);
            if (documents.isEmpty()) {
                writer.deleteDocuments(documentTerm);
            } else {
                writer.updateDocuments(documentTerm, documents);
            }
            commitAndRefresh();
            log.info("Indexed {} chunk(s) for {} in collection {}", documents.size(), documentId, collectionName);
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Failed to write chunks of " + documentId, e);
        } finally {
            insertsInFlight.remove(documentId);
        }
    }

    @Override
    public boolean delete(final String documentId) {
        requireNonBlank(documentId, "documentId");
        try {
            final boolean existed = countMatching(new TermQuery(new Term(FIELD_DOC_ID, documentId))) > 0;
            writer.deleteDocuments(new Term(FIELD_DOC_ID, documentId));
            commitAndRefresh();
            log.info("Deleted chunks of {} (present: {})", documentId, existed);
            return existed;
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Failed to delete chunks of " + documentId, e);
        }
    }

    @Override
    public List<SearchHit> search(final float[] queryVector, final SearchFilters filters, final int topK) {
        if (queryVector == null || queryVector.length == 0) {
            throw new IllegalArgumentException("queryVector must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Query filter = buildFilter(filters == null ? SearchFilters.none() : filters);
                final Query query = new KnnFloatVectorQuery(FIELD_VECTOR, queryVector, topK, filter);
                final TopDocs topDocs = searcher.search(query, topK);
                final StoredFields storedFields = searcher.storedFields();

                final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    final Document stored = storedFields.document(scoreDoc.doc);
                    hits.add(new SearchHit(
                            stored.get(FIELD_CHUNK_ID),
                            stored.get(FIELD_TEXT),
                            readMetadata(stored),
                            toCosine(scoreDoc.score)));
                }
                hits.sort(RANKING);
                return hits;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Vector search failed on collection " + collectionName, e);
        }
    }

    @Override
    public long count() {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Failed to count chunks", e);
        }
    }

    @Override
    public Map<String, Long> distinctValues(final String attribute) {
        final String field = ATTRIBUTE_FIELDS.get(attribute);
        if (field == null) {
            throw new IllegalArgumentException("Unsupported attribute '" + attribute + "', expected one of " + DISTINCT_ATTRIBUTES);
        }
        final Map<String, Long> counts = new TreeMap<>();
        forEachStored(Set.of(field), doc -> {
            final String value = doc.get(field);
            if (value != null) {
                counts.merge(value, 1L, Long::sum);
            }
        });
        return counts;
    }

    @Override
    public List<DocumentSummary> listDocuments() {
        final Map<String, List<ChunkMetadata>> byDocument = new TreeMap<>();
        forEachStored(null, doc -> {
            final ChunkMetadata metadata = readMetadata(doc);
            byDocument.computeIfAbsent(metadata.documentId(), k -> new ArrayList<>()).add(metadata);
        });

        final List<DocumentSummary> summaries = new ArrayList<>(byDocument.size());
        for (final Map.Entry<String, List<ChunkMetadata>> entry : byDocument.entrySet()) {
            final ChunkMetadata first = entry.getValue().get(0);
            final TreeSet<String> languages = new TreeSet<>();
            for (final ChunkMetadata metadata : entry.getValue()) {
                if (metadata.language() != null) {
                    languages.add(metadata.language());
                }
            }
            summaries.add(new DocumentSummary(entry.getKey(), first.author(), first.region(), first.date(),
                    languages, entry.getValue().size(), first.uploadTime()));
        }
        return summaries;
    }

    @Override
    public void clear() {
        try {
            writer.deleteAll();
            commitAndRefresh();
            resetDimension();
            log.info("Cleared collection {}", collectionName);
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Failed to clear collection " + collectionName, e);
        }
    }

    @Override
    public String collectionName() {
        return collectionName;
    }

    private void commitAndRefresh() throws IOException {
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private long countMatching(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.count(query);
        } finally {
            searcherManager.release(searcher);
        }
    }

    private void forEachStored(final Set<String> fields, final Consumer<Document> consumer) {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                for (final LeafReaderContext context : searcher.getIndexReader().leaves()) {
                    final LeafReader leaf = context.reader();
                    final Bits liveDocs = leaf.getLiveDocs();
                    final StoredFields storedFields = leaf.storedFields();
                    for (int i = 0; i < leaf.maxDoc(); i++) {
                        if (liveDocs != null && !liveDocs.get(i)) {
                            continue;
                        }
                        consumer.accept(fields == null ? storedFields.document(i) : storedFields.document(i, fields));
                    }
                }
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Failed to scan collection " + collectionName, e);
        }
    }

    private Query buildFilter(final SearchFilters filters) {
        if (filters.isEmpty()) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        if (filters.author() != null) {
            builder.add(new TermQuery(new Term(FIELD_AUTHOR, filters.author())), BooleanClause.Occur.FILTER);
        }
        if (filters.region() != null) {
            builder.add(new TermQuery(new Term(FIELD_REGION, filters.region())), BooleanClause.Occur.FILTER);
        }
        if (filters.documentId() != null) {
            builder.add(new TermQuery(new Term(FIELD_DOC_ID, filters.documentId())), BooleanClause.Occur.FILTER);
        }
        if (filters.dateFrom() != null || filters.dateTo() != null) {
            final long from = filters.dateFrom() == null ? Long.MIN_VALUE : filters.dateFrom().toEpochDay();
            final long to = filters.dateTo() == null ? Long.MAX_VALUE : filters.dateTo().toEpochDay();
            builder.add(LongPoint.newRangeQuery(FIELD_DATE_POINT, from, to), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private void validate(final String documentId, final ChunkRecord chunk) {
        if (chunk == null || chunk.metadata() == null) {
            throw new IllegalArgumentException("chunk and its metadata must not be null");
        }
        requireNonBlank(chunk.chunkId(), "chunkId");
        requireNonBlank(chunk.text(), "text");
        if (!documentId.equals(chunk.metadata().documentId())) {
            throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " belongs to "
                    + chunk.metadata().documentId() + ", not " + documentId);
        }
        if (chunk.vector() == null) {
            throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " has no vector");
        }
        ensureConsistentDimension(chunk.vector().length);
    }

    private synchronized void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh collection if you changed the embedder)");
        }
    }

    private Integer storedDimension() {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                for (final LeafReaderContext context : searcher.getIndexReader().leaves()) {
                    final FieldInfo info = context.reader().getFieldInfos().fieldInfo(FIELD_VECTOR);
                    if (info != null && info.getVectorDimension() > 0) {
                        return info.getVectorDimension();
                    }
                }
                return null;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException("Failed to open collection " + collectionName, e);
        }
    }

    private synchronized void resetDimension() {
        vectorDim = null;
    }

    private Document buildLuceneDocument(final ChunkRecord chunk) {
        final ChunkMetadata m = chunk.metadata();
        final Document d = new Document();

        d.add(new StringField(FIELD_DOC_ID, m.documentId(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, chunk.chunkId(), Field.Store.YES));
        d.add(new TextField(FIELD_TEXT, chunk.text(), Field.Store.YES));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, chunk.vector(), VectorSimilarityFunction.COSINE));

        d.add(new StringField(FIELD_AUTHOR, m.author(), Field.Store.YES));
        if (m.region() != null) {
            d.add(new StringField(FIELD_REGION, m.region(), Field.Store.YES));
        }
        if (m.date() != null) {
            d.add(new StoredField(FIELD_DATE, m.date().toString()));
            d.add(new LongPoint(FIELD_DATE_POINT, m.date().toEpochDay()));
        }
        if (m.language() != null) {
            d.add(new StringField(FIELD_LANGUAGE, m.language(), Field.Store.YES));
        }

        d.add(new StoredField(FIELD_ORDINAL, m.ordinal()));
        d.add(new StoredField(FIELD_TOKEN_COUNT, m.tokenCount()));
        d.add(new StoredField(FIELD_FROM_PAGE, m.pageStart()));
        d.add(new StoredField(FIELD_TO_PAGE, m.pageEnd()));
        if (m.uploadTime() != null) {
            d.add(new StoredField(FIELD_UPLOAD_TIME, m.uploadTime().toEpochMilli()));
        }
        return d;
    }

    private static ChunkMetadata readMetadata(final Document d) {
        final String date = d.get(FIELD_DATE);
        final Number uploadTime = d.getField(FIELD_UPLOAD_TIME) == null ? null : d.getField(FIELD_UPLOAD_TIME).numericValue();
        return new ChunkMetadata(
                d.get(FIELD_DOC_ID),
                d.get(FIELD_AUTHOR),
                d.get(FIELD_REGION),
                date == null ? null : LocalDate.parse(date),
                intField(d, FIELD_ORDINAL),
                d.get(FIELD_LANGUAGE),
                intField(d, FIELD_TOKEN_COUNT),
                intField(d, FIELD_FROM_PAGE),
                intField(d, FIELD_TO_PAGE),
                uploadTime == null ? null : Instant.ofEpochMilli(uploadTime.longValue()));
    }

    private static int intField(final Document d, final String name) {
        return d.getField(name) == null ? -1 : d.getField(name).numericValue().intValue();
    }

    /**
     * Lucene reports cosine scores as {@code (1 + cos) / 2}.
     */
    private static float toCosine(final float luceneScore) {
        return 2f * luceneScore - 1f;
    }

    private static void requireNonBlank(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}

package eu.virtualparadox.lobbymap.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and manages the Lucene resources of the chunk collection.
 * <p>The collection lives under {@code lobbymap.index/<collection name>}; resources are closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    /**
     * @param props application properties
     * @return opened {@link Directory} of the configured collection
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path collectionPath = props.getIndex().resolve(props.getCollection().getName());
        Files.createDirectories(collectionPath);
        log.info("Opening collection '{}' at {}", props.getCollection().getName(), collectionPath);
        this.directory = FSDirectory.open(collectionPath);
        return this.directory;
    }

    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    /**
     * Provides the writer in create-or-append mode. It is the single writer of the collection.
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        return this.indexWriter;
    }

    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    @PreDestroy
    public void close() {
        try { if (searcherManager != null) searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager", e);
        }

        try { if (indexWriter != null) indexWriter.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter", e);
        }

        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }

        try { if (directory != null) directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}

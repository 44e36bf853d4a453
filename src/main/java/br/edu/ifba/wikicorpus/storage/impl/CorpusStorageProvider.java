package br.edu.ifba.wikicorpus.storage.impl;

import br.edu.ifba.wikicorpus.embedding.EmbeddingConfig;
import br.edu.ifba.wikicorpus.exception.CorpusStoreException;
import br.edu.ifba.wikicorpus.ingest.IngestionConfig;
import br.edu.ifba.wikicorpus.ingest.ParallelIngestionCoordinator;
import br.edu.ifba.wikicorpus.storage.CorpusReader;
import br.edu.ifba.wikicorpus.storage.EmbeddingStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * CDI producer for the corpus and embedding stores.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>creates one {@link SQLiteConnectionManager} per database file</li>
 *   <li>runs corpus schema migrations on startup</li>
 *   <li>produces {@link CorpusReader}, {@link EmbeddingStore} and
 *       {@link ParallelIngestionCoordinator}</li>
 * </ul>
 *
 * <p>Example configuration:</p>
 * <pre>
 * wiki.store.corpus-path=data/corpus.db
 * wiki.store.embedding-path=data/embeddings.db
 * </pre>
 */
@ApplicationScoped
public class CorpusStorageProvider {

    private static final Logger LOG = Logger.getLogger(CorpusStorageProvider.class);

    @ConfigProperty(name = "wiki.store.corpus-path", defaultValue = "data/corpus.db")
    String corpusPath;

    @ConfigProperty(name = "wiki.store.embedding-path", defaultValue = "data/embeddings.db")
    String embeddingPath;

    @ConfigProperty(name = "wiki.store.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "wiki.store.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "wiki.store.wal-mode", defaultValue = "true")
    boolean walMode;

    @Inject
    IngestionConfig ingestionConfig;

    @Inject
    EmbeddingConfig embeddingConfig;

    private SQLiteConnectionManager corpusConnections;
    private SQLiteConnectionManager embeddingConnections;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing corpus storage: corpus=%s, embeddings=%s", corpusPath, embeddingPath);
        ingestionConfig.validate();

        Duration busyTimeout = Duration.ofMillis(busyTimeoutMs);
        corpusConnections = new SQLiteConnectionManager(corpusPath, busyTimeout, walMode, readPoolSize);
        embeddingConnections = new SQLiteConnectionManager(embeddingPath, busyTimeout, walMode, readPoolSize);

        Connection conn = corpusConnections.getWriteConnection();
        try {
            int applied = new SQLiteSchemaMigrator().migrateToLatest(conn);
            LOG.infof("Corpus schema up to date (%d migrations applied)", applied);
        } catch (SQLException e) {
            throw new CorpusStoreException("Failed to migrate corpus schema at " + corpusPath, e);
        } finally {
            corpusConnections.releaseWriteConnection(conn);
        }
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down corpus storage");
        if (corpusConnections != null) {
            corpusConnections.close();
        }
        if (embeddingConnections != null) {
            embeddingConnections.close();
        }
    }

    @Produces
    @ApplicationScoped
    public CorpusReader produceCorpusReader() {
        return new SQLiteCorpusReader(corpusConnections);
    }

    @Produces
    @ApplicationScoped
    public EmbeddingStore produceEmbeddingStore() {
        SQLiteEmbeddingStore store = new SQLiteEmbeddingStore(
            embeddingConnections, embeddingConfig.section(), embeddingConfig.dimension());
        store.initialize().join();
        return store;
    }

    @Produces
    @Singleton
    public ParallelIngestionCoordinator produceIngestionCoordinator() {
        return new ParallelIngestionCoordinator(
            corpusConnections,
            ingestionConfig.workers(),
            ingestionConfig.subBatchSize(),
            ingestionConfig.dedupCacheCapacity(),
            ingestionConfig.progressInterval());
    }
}

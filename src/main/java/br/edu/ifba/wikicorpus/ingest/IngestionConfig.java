package br.edu.ifba.wikicorpus.ingest;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Ingestion settings, read from application.properties with the prefix
 * "wiki.ingest".
 */
@ConfigMapping(prefix = "wiki.ingest")
public interface IngestionConfig {

    /**
     * Number of parallel writer workers.
     */
    @WithDefault("4")
    int workers();

    /**
     * Articles committed per transaction by each worker.
     */
    @WithName("sub-batch-size")
    @WithDefault("100")
    int subBatchSize();

    @WithName("invalid-record-policy")
    @WithDefault("SKIP")
    InvalidRecordPolicy invalidRecordPolicy();

    /**
     * Log a progress line every this many imported articles.
     */
    @WithName("progress-interval")
    @WithDefault("10000")
    long progressInterval();

    /**
     * Category/image ids each worker remembers.
     */
    @WithName("dedup-cache-capacity")
    @WithDefault("100000")
    int dedupCacheCapacity();

    /**
     * Throws IllegalArgumentException if a setting is out of range.
     */
    default void validate() {
        if (workers() < 1) {
            throw new IllegalArgumentException("wiki.ingest.workers must be at least 1, got " + workers());
        }
        if (subBatchSize() < 1) {
            throw new IllegalArgumentException(
                "wiki.ingest.sub-batch-size must be at least 1, got " + subBatchSize());
        }
        if (progressInterval() < 1) {
            throw new IllegalArgumentException(
                "wiki.ingest.progress-interval must be at least 1, got " + progressInterval());
        }
    }
}

package br.edu.ifba.wikicorpus.ingest;

import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe counter of committed articles, shared by all ingestion workers.
 * Logs a line each time the total crosses a multiple of the interval.
 */
public final class IngestionProgress {

    private static final Logger LOG = Logger.getLogger(IngestionProgress.class);

    private final long total;
    private final long interval;
    private final long startNanos = System.nanoTime();
    private final LongAdder imported = new LongAdder();
    private final LongAdder subBatches = new LongAdder();

    /**
     * @param total expected number of articles, used for the percentage
     * @param interval articles between two progress lines
     */
    public IngestionProgress(long total, long interval) {
        this.total = total;
        this.interval = Math.max(1, interval);
    }

    /**
     * Records one committed sub-batch.
     */
    public void recordSubBatch(int count) {
        imported.add(count);
        subBatches.increment();
        long now = imported.sum();
        if (now / interval > (now - count) / interval) {
            LOG.infof("Imported %d/%d articles (%.1f%%, %.0f articles/s)",
                now, total, percent(now), articlesPerSecond());
        }
    }

    public long imported() {
        return imported.sum();
    }

    public long committedSubBatches() {
        return subBatches.sum();
    }

    public long total() {
        return total;
    }

    public double articlesPerSecond() {
        double seconds = (System.nanoTime() - startNanos) / (double) TimeUnit.SECONDS.toNanos(1);
        return seconds <= 0 ? 0.0 : imported.sum() / seconds;
    }

    private double percent(final long now) {
        return total == 0 ? 100.0 : now * 100.0 / total;
    }
}

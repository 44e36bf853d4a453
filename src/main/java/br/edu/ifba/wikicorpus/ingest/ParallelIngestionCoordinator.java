package br.edu.ifba.wikicorpus.ingest;

import br.edu.ifba.wikicorpus.exception.CorpusStoreException;
import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.storage.DedupCache;
import br.edu.ifba.wikicorpus.storage.impl.SQLiteConnectionManager;
import br.edu.ifba.wikicorpus.storage.impl.SQLiteCorpusWriter;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Imports a finite, already collected batch of articles with a fixed pool of
 * writer workers.
 *
 * <p>The batch is cut into contiguous chunks of {@code ceil(N / workers)}
 * articles. Each worker opens its own writer connection, writer and
 * {@link DedupCache}, and commits its chunk one sub-batch per transaction.</p>
 *
 * <p>The first worker failure is rethrown as a {@link CorpusStoreException}
 * naming the worker and the sub-batch range. Remaining workers are neither
 * awaited nor cancelled, and sub-batches already committed stay committed.</p>
 */
public class ParallelIngestionCoordinator {

    private static final Logger LOG = Logger.getLogger(ParallelIngestionCoordinator.class);

    public static final int DEFAULT_SUB_BATCH_SIZE = 100;
    public static final long DEFAULT_PROGRESS_INTERVAL = 10_000L;

    private final SQLiteConnectionManager connectionManager;
    private final int workers;
    private final int subBatchSize;
    private final int cacheCapacity;
    private final long progressInterval;

    public ParallelIngestionCoordinator(@NotNull SQLiteConnectionManager connectionManager, int workers) {
        this(connectionManager, workers, DEFAULT_SUB_BATCH_SIZE, DedupCache.DEFAULT_CAPACITY,
            DEFAULT_PROGRESS_INTERVAL);
    }

    /**
     * @param connectionManager manager of the corpus database
     * @param workers size of the worker pool
     * @param subBatchSize articles per committed transaction
     * @param cacheCapacity capacity of each worker's dedup cache
     * @param progressInterval articles between progress log lines
     */
    public ParallelIngestionCoordinator(@NotNull SQLiteConnectionManager connectionManager, int workers,
            int subBatchSize, int cacheCapacity, long progressInterval) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
        if (subBatchSize < 1) {
            throw new IllegalArgumentException("subBatchSize must be at least 1: " + subBatchSize);
        }
        this.connectionManager = connectionManager;
        this.workers = workers;
        this.subBatchSize = subBatchSize;
        this.cacheCapacity = cacheCapacity;
        this.progressInterval = progressInterval;
    }

    /**
     * Imports every article.
     *
     * @return number of imported articles, equal to {@code articles.size()}
     * @throws CorpusStoreException for the first failing worker
     */
    public long importAll(@NotNull List<Article> articles) {
        return importAll(articles, new IngestionProgress(articles.size(), progressInterval));
    }

    public long importAll(@NotNull List<Article> articles, @NotNull IngestionProgress progress) {
        int n = articles.size();
        if (n == 0) {
            return 0;
        }

        int chunkSize = (n + workers - 1) / workers;
        List<int[]> chunks = new ArrayList<>();
        for (int start = 0; start < n; start += chunkSize) {
            chunks.add(new int[] {start, Math.min(start + chunkSize, n)});
        }
        LOG.infof("Importing %d articles with %d workers (chunk size %d, sub-batch size %d)",
            n, chunks.size(), chunkSize, subBatchSize);

        ExecutorService executor = Executors.newFixedThreadPool(chunks.size(), new WorkerThreadFactory());
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<Long>> futures = new ArrayList<>(chunks.size());
        try {
            for (int worker = 0; worker < chunks.size(); worker++) {
                int id = worker;
                int[] chunk = chunks.get(worker);
                CompletableFuture<Long> future = CompletableFuture.supplyAsync(
                    () -> runWorker(id, articles, chunk[0], chunk[1], progress), executor);
                future.whenComplete((count, error) -> {
                    if (error != null) {
                        firstFailure.completeExceptionally(error);
                    }
                });
                futures.add(future);
            }

            CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
            CompletableFuture.anyOf(all, firstFailure).join();
        } catch (CompletionException e) {
            throw asStoreException(e.getCause() != null ? e.getCause() : e);
        } finally {
            // no shutdownNow: running siblings finish their current work
            executor.shutdown();
        }

        long imported = futures.stream().mapToLong(CompletableFuture::join).sum();
        LOG.infof("Imported %d articles in %d sub-batches (%.0f articles/s)",
            imported, progress.committedSubBatches(), progress.articlesPerSecond());
        return imported;
    }

    public int getWorkers() {
        return workers;
    }

    public int getSubBatchSize() {
        return subBatchSize;
    }

    private long runWorker(final int worker, final List<Article> articles, final int from, final int to,
            final IngestionProgress progress) {
        LOG.debugf("Worker %d starting on articles [%d, %d)", worker, from, to);
        long written = 0;
        int batchStart = from;
        try (Connection connection = connectionManager.createWriterConnection();
             SQLiteCorpusWriter writer = new SQLiteCorpusWriter(connection, new DedupCache(cacheCapacity))) {
            while (batchStart < to) {
                int batchEnd = Math.min(batchStart + subBatchSize, to);
                written += writer.writeBatch(articles.subList(batchStart, batchEnd));
                progress.recordSubBatch(batchEnd - batchStart);
                batchStart = batchEnd;
            }
        } catch (SQLException e) {
            throw new CorpusStoreException(String.format("Worker %d failed to close its connection", worker), e);
        } catch (RuntimeException e) {
            int batchEnd = Math.min(batchStart + subBatchSize, to);
            throw new CorpusStoreException(String.format("Worker %d failed on sub-batch [%d, %d): %s",
                worker, batchStart, batchEnd, e.getMessage()), e);
        }
        LOG.debugf("Worker %d finished, %d articles", worker, written);
        return written;
    }

    private static CorpusStoreException asStoreException(final Throwable cause) {
        if (cause instanceof CorpusStoreException storeException) {
            return storeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CorpusStoreException("Ingestion failed: " + cause.getMessage(), cause);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL = new AtomicInteger();

        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ingest-" + pool + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

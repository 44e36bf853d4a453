package br.edu.ifba.wikicorpus.storage;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Key to vector store with brute-force cosine retrieval.
 * All vectors of one store share the dimension returned by {@link #dimension()}.
 *
 * <p>Failures surface through the returned future; dimension errors complete it
 * exceptionally with {@link br.edu.ifba.wikicorpus.exception.DimensionMismatchException}.</p>
 */
public interface EmbeddingStore extends AutoCloseable {

    int dimension();

    /**
     * Inserts or replaces the vector stored under {@code key}. The write is
     * committed when the future completes.
     */
    CompletableFuture<Void> put(@NotNull String key, @NotNull float[] vector);

    /**
     * Upserts all entries in one transaction.
     */
    CompletableFuture<Void> putAll(@NotNull Map<String, float[]> vectors);

    CompletableFuture<Optional<float[]>> get(@NotNull String key);

    /**
     * @return true if a vector was removed
     */
    CompletableFuture<Boolean> delete(@NotNull String key);

    CompletableFuture<Long> size();

    CompletableFuture<Void> clear();

    /**
     * Scores every stored vector against {@code query} by cosine similarity.
     *
     * @param query vector of the store's dimension
     * @param k maximum number of results; {@code k <= 0} yields an empty list
     * @return at most {@code k} keys, highest score first; ties in any order
     */
    CompletableFuture<List<ScoredKey>> findSimilar(@NotNull float[] query, int k);

    @Override
    void close();

    record ScoredKey(@NotNull String key, double score) {
    }
}

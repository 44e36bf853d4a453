package br.edu.ifba.wikicorpus.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Turns texts into embedding vectors. Treated as a black box by the corpus:
 * any model or provider may sit behind it.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    /**
     * @param texts texts to embed
     * @return one vector per input text, in input order
     */
    CompletableFuture<List<float[]>> embed(@NotNull List<String> texts);

    default CompletableFuture<float[]> embedSingle(@NotNull String text) {
        return embed(List.of(text)).thenApply(vectors -> {
            if (vectors.isEmpty()) {
                throw new IllegalStateException("Embedding function returned no vector");
            }
            return vectors.get(0);
        });
    }
}

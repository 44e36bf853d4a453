package br.edu.ifba.wikicorpus.embedding;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Embedding settings, read from application.properties with the prefix
 * "wiki.embedding".
 */
@ConfigMapping(prefix = "wiki.embedding")
public interface EmbeddingConfig {

    /**
     * Model name sent to the embedding endpoint.
     */
    @WithDefault("nomic-embed-text")
    String model();

    /**
     * Vector length of every stored embedding.
     */
    @WithDefault("768")
    int dimension();

    /**
     * Table of the embedding database that holds article vectors.
     */
    @WithDefault("articles")
    String section();

    /**
     * Characters of title plus content sent to the model per article.
     */
    @WithName("max-chars")
    @WithDefault("2000")
    int maxChars();

    /**
     * Texts per embedding request when indexing.
     */
    @WithName("batch-size")
    @WithDefault("32")
    int batchSize();
}

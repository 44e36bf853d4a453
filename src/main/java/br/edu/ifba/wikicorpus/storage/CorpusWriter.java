package br.edu.ifba.wikicorpus.storage;

import br.edu.ifba.wikicorpus.parser.Article;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Writes articles and their relations into the corpus store.
 *
 * <p>An instance is bound to one connection and is used by one thread at a
 * time. Every call runs in its own transaction: either all rows of the call
 * are committed or none are.</p>
 */
public interface CorpusWriter extends AutoCloseable {

    /**
     * Writes one article in its own transaction.
     *
     * @throws br.edu.ifba.wikicorpus.exception.ArticleValidationException before any row is touched
     * @throws br.edu.ifba.wikicorpus.exception.CorpusStoreException on any storage failure
     */
    void write(@NotNull Article article);

    /**
     * Writes all articles in a single transaction.
     *
     * @return number of articles written
     */
    int writeBatch(@NotNull List<Article> articles);

    @Override
    void close();
}

package br.edu.ifba.wikicorpus.storage;

import br.edu.ifba.wikicorpus.parser.Article;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to an ingested corpus.
 */
public interface CorpusReader extends AutoCloseable {

    /**
     * Looks up an article by title, following redirects. A redirect cycle,
     * a chain longer than the hop limit or a dangling target yields empty.
     *
     * @param title exact title
     * @return the resolved article with its categories and ordered images
     */
    CompletableFuture<Optional<Article>> getArticle(@NotNull String title);

    /**
     * @return the direct redirect target of {@code title}, if it is a redirect
     */
    CompletableFuture<Optional<String>> getRedirectTarget(@NotNull String title);

    /**
     * Full-text search over titles and content. Redirects are excluded.
     *
     * @param query free text; every term must match
     * @param limit maximum number of hits
     * @return hits ordered best first
     */
    CompletableFuture<List<SearchHit>> search(@NotNull String query, int limit);

    CompletableFuture<List<String>> listCategories();

    CompletableFuture<List<String>> getArticlesInCategory(@NotNull String category);

    CompletableFuture<Long> countArticles();

    @Override
    void close();

    /**
     * One full-text match.
     *
     * @param title article title
     * @param snippet excerpt with matched terms in brackets
     * @param score relevance, higher is better
     */
    record SearchHit(@NotNull String title, @NotNull String snippet, double score) {
    }
}

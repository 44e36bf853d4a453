package br.edu.ifba.wikicorpus.embedding;

import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.storage.EmbeddingStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Indexes articles into the {@link EmbeddingStore} and answers semantic
 * similarity queries. Embedder and store failures surface unchanged as the
 * cause of the returned future's failure.
 */
@ApplicationScoped
public class ArticleEmbeddingService {

    private static final Logger LOG = Logger.getLogger(ArticleEmbeddingService.class);

    private final EmbeddingFunction embedder;
    private final EmbeddingStore store;
    private final int maxChars;
    private final int batchSize;

    @Inject
    public ArticleEmbeddingService(EmbeddingFunction embedder, EmbeddingStore store, EmbeddingConfig config) {
        this(embedder, store, config.maxChars(), config.batchSize());
    }

    public ArticleEmbeddingService(@NotNull EmbeddingFunction embedder, @NotNull EmbeddingStore store,
            int maxChars, int batchSize) {
        if (maxChars < 1 || batchSize < 1) {
            throw new IllegalArgumentException("maxChars and batchSize must be positive");
        }
        this.embedder = embedder;
        this.store = store;
        this.maxChars = maxChars;
        this.batchSize = batchSize;
    }

    /**
     * Text sent to the model for an article: the title, a blank line, then
     * the content, cut to the configured length.
     */
    public String embeddingText(@NotNull Article article) {
        String text = article.content().isEmpty()
            ? article.title()
            : article.title() + "\n\n" + article.content();
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    public CompletableFuture<Void> index(@NotNull Article article) {
        return embedder.embedSingle(embeddingText(article))
            .thenCompose(vector -> store.put(article.title(), vector));
    }

    /**
     * Embeds and stores every non-redirect article, one request and one
     * store transaction per batch.
     *
     * @return number of articles indexed
     */
    public CompletableFuture<Integer> indexAll(@NotNull List<Article> articles) {
        List<Article> indexable = articles.stream().filter(article -> !article.isRedirect()).toList();
        CompletableFuture<Integer> chain = CompletableFuture.completedFuture(0);
        for (int start = 0; start < indexable.size(); start += batchSize) {
            List<Article> batch = indexable.subList(start, Math.min(start + batchSize, indexable.size()));
            chain = chain.thenCompose(done -> indexBatch(batch).thenApply(count -> done + count));
        }
        return chain.thenApply(total -> {
            LOG.infof("Indexed %d article embeddings", total);
            return total;
        });
    }

    /**
     * Embeds {@code queryText} and returns the {@code k} most similar articles.
     */
    public CompletableFuture<List<SimilarArticle>> findSimilar(@NotNull String queryText, int k) {
        return embedder.embedSingle(queryText)
            .thenCompose(query -> store.findSimilar(query, k))
            .thenApply(keys -> keys.stream()
                .map(scored -> new SimilarArticle(scored.key(), scored.score()))
                .toList());
    }

    private CompletableFuture<Integer> indexBatch(final List<Article> batch) {
        List<String> texts = batch.stream().map(this::embeddingText).toList();
        return embedder.embed(texts).thenCompose(vectors -> {
            if (vectors.size() != batch.size()) {
                throw new IllegalStateException(String.format(
                    "Embedding function returned %d vectors for %d articles", vectors.size(), batch.size()));
            }
            Map<String, float[]> entries = new LinkedHashMap<>();
            for (int i = 0; i < batch.size(); i++) {
                entries.put(batch.get(i).title(), vectors.get(i));
            }
            return store.putAll(entries).thenApply(ignored -> batch.size());
        });
    }
}

package br.edu.ifba.wikicorpus.embedding;

import br.edu.ifba.wikicorpus.exception.DimensionMismatchException;
import br.edu.ifba.wikicorpus.utils.EmbeddingUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link EmbeddingFunction} backed by an OpenAI-compatible {@code /embeddings}
 * endpoint through {@link LlmEmbeddingClient}.
 *
 * <p>Vectors come back in request order (by {@code index} when the server
 * sends one) and must have the configured dimension.</p>
 */
@ApplicationScoped
public class RestEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(RestEmbeddingAdapter.class);

    private final LlmEmbeddingClient client;
    private final String model;
    private final int dimension;

    @Inject
    public RestEmbeddingAdapter(@RestClient LlmEmbeddingClient client, EmbeddingConfig config) {
        this(client, config.model(), config.dimension());
    }

    public RestEmbeddingAdapter(@NotNull LlmEmbeddingClient client, @NotNull String model, int dimension) {
        this.client = client;
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        try {
            LOG.debugf("Embedding %d texts with model %s", texts.size(), model);
            EmbeddingResponse response = client.embed(new EmbeddingRequest(model, texts));
            return CompletableFuture.completedFuture(toVectors(response, texts.size()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Embedding request for %d texts failed", texts.size());
            return CompletableFuture.failedFuture(e);
        }
    }

    private List<float[]> toVectors(final EmbeddingResponse response, final int expected) {
        if (response == null || response.getData() == null || response.getData().isEmpty()) {
            throw new IllegalStateException("Embedding API returned no data");
        }
        if (response.getData().size() != expected) {
            throw new IllegalStateException(String.format(
                "Embedding API returned %d vectors for %d texts", response.getData().size(), expected));
        }

        List<EmbeddingResponse.Embedding> data = new ArrayList<>(response.getData());
        if (data.stream().allMatch(item -> item.getIndex() != null)) {
            data.sort(Comparator.comparingInt(EmbeddingResponse.Embedding::getIndex));
        }

        List<float[]> vectors = new ArrayList<>(data.size());
        for (EmbeddingResponse.Embedding item : data) {
            List<Double> values = item.getEmbedding();
            if (values == null || values.isEmpty()) {
                throw new IllegalStateException("Embedding API returned an empty vector");
            }
            if (values.size() != dimension) {
                throw new DimensionMismatchException("embedding response from " + model, dimension, values.size());
            }
            vectors.add(EmbeddingUtil.toFloatArray(values));
        }
        return vectors;
    }
}

package br.edu.ifba.wikicorpus.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Request body of the embeddings endpoint.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddingRequest {

    private String model;
    private List<String> input;

    // Default constructor for Jackson
    public EmbeddingRequest() {
    }

    public EmbeddingRequest(final String model, final List<String> input) {
        this.model = model;
        this.input = input;
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = model;
    }

    public List<String> getInput() {
        return input;
    }

    public void setInput(final List<String> input) {
        this.input = input;
    }
}

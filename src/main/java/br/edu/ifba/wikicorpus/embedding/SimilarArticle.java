package br.edu.ifba.wikicorpus.embedding;

/**
 * An article title ranked by cosine similarity to a query.
 */
public record SimilarArticle(String title, double score) {
}

package br.edu.ifba.wikicorpus.exception;

/**
 * Thrown when a parsed article violates a field invariant, e.g. an empty title.
 * Raised per record; the caller decides whether to skip the record or abort.
 */
public class ArticleValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String title;

    public ArticleValidationException(final String title, final String message) {
        super("Invalid article '" + title + "': " + message);
        this.title = title;
    }

    /**
     * Returns the title of the offending record as parsed (may be empty).
     *
     * @return the raw title
     */
    public String getTitle() {
        return title;
    }
}

package br.edu.ifba.wikicorpus.exception;

public class CorpusStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CorpusStoreException(final String message) {
        super(message);
    }

    public CorpusStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package br.edu.ifba.wikicorpus.exception;

/**
 * Thrown when a dump cannot be read as a well-formed sequence of documents:
 * malformed bytes, bad element nesting, or a stream that ends inside a document.
 *
 * <p>The whole parse is aborted; no partial document is ever emitted.</p>
 */
public class DumpStreamException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long line;

    public DumpStreamException(final String message) {
        this(message, -1L, null);
    }

    public DumpStreamException(final String message, final Throwable cause) {
        this(message, -1L, cause);
    }

    public DumpStreamException(final String message, final long line, final Throwable cause) {
        super(line > 0 ? message + " (line " + line + ")" : message, cause);
        this.line = line;
    }

    /**
     * Returns the input line where the violation was detected, or -1 when unknown.
     *
     * @return one-based line number or -1
     */
    public long getLine() {
        return line;
    }
}

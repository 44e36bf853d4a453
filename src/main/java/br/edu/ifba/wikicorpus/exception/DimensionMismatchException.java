package br.edu.ifba.wikicorpus.exception;

/**
 * Thrown when a vector does not have the dimension of the embedding store it is
 * compared against or written to. Always fatal to the triggering call.
 */
public class DimensionMismatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public DimensionMismatchException(final String context, final int expected, final int actual) {
        super(String.format("Vector dimension mismatch for %s: expected %d but got %d", context, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}

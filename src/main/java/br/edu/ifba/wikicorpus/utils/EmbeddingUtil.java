package br.edu.ifba.wikicorpus.utils;

import br.edu.ifba.wikicorpus.exception.DimensionMismatchException;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Conversions and similarity math for embedding vectors.
 * Stored vectors are little-endian float32 blobs.
 */
public final class EmbeddingUtil {

    private EmbeddingUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static byte[] toBytes(@NotNull float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException if the blob length is not a multiple of 4
     */
    @NotNull
    public static float[] fromBytes(@NotNull byte[] bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Vector blob length " + bytes.length + " is not a multiple of 4");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * Number of floats a blob of the given length holds.
     */
    public static int dimensionOf(@NotNull byte[] bytes) {
        return bytes.length / Float.BYTES;
    }

    /**
     * Cosine similarity in [-1, 1]. A zero-norm operand, or any arithmetic that
     * yields NaN, scores 0.
     *
     * @throws DimensionMismatchException if the lengths differ
     */
    public static double cosineSimilarity(@NotNull float[] a, @NotNull float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException("cosine similarity", a.length, b.length);
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        return Double.isNaN(similarity) ? 0.0 : similarity;
    }

    public static float[] toFloatArray(@NotNull List<? extends Number> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}

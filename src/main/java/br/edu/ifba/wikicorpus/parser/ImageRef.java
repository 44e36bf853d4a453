package br.edu.ifba.wikicorpus.parser;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Reference to an image used by an article.
 *
 * <p>{@code hash} is the deduplication key: two references with the same hash
 * are the same stored image regardless of file name or caption.</p>
 */
public record ImageRef(
        @NotNull String filename,
        @NotNull String path,
        long size,
        @NotNull String mimeType,
        @NotNull String hash,
        String caption) {

    public ImageRef {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(hash, "hash");
        if (caption != null && caption.isBlank()) {
            caption = null;
        }
    }
}

package br.edu.ifba.wikicorpus.parser;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One encyclopedia article as produced by {@link DumpStreamParser}.
 *
 * <p>A redirect article never carries categories or images; the canonical
 * constructor drops them when {@code redirectTarget} is present.</p>
 *
 * @param title unique title of the article
 * @param content cleaned body text
 * @param size UTF-8 byte length of the cleaned content
 * @param lastModified revision timestamp
 * @param redirectTarget title this article redirects to, or {@code null}
 * @param categories category names, order irrelevant
 * @param images image references in order of appearance
 */
public record Article(
        @NotNull String title,
        @NotNull String content,
        long size,
        @NotNull Instant lastModified,
        String redirectTarget,
        @NotNull Set<String> categories,
        @NotNull List<ImageRef> images) {

    public Article {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(lastModified, "lastModified");
        if (redirectTarget != null) {
            categories = Set.of();
            images = List.of();
        } else {
            categories = categories == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(categories));
            images = images == null ? List.of() : List.copyOf(images);
        }
    }

    /**
     * Creates a non-redirect article whose size is derived from its content.
     */
    public static Article of(final String title, final String content, final Instant lastModified,
            final Set<String> categories, final List<ImageRef> images) {
        return new Article(title, content, byteSize(content), lastModified, null, categories, images);
    }

    /**
     * Creates a redirect article. Redirects carry no relations.
     */
    public static Article redirect(final String title, final String content, final Instant lastModified,
            final String target) {
        Objects.requireNonNull(target, "target");
        return new Article(title, content, byteSize(content), lastModified, target, Set.of(), List.of());
    }

    public boolean isRedirect() {
        return redirectTarget != null;
    }

    static long byteSize(final String content) {
        return content == null ? 0L : content.getBytes(StandardCharsets.UTF_8).length;
    }
}

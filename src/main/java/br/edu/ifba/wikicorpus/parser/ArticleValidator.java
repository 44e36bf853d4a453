package br.edu.ifba.wikicorpus.parser;

import br.edu.ifba.wikicorpus.exception.ArticleValidationException;
import org.jetbrains.annotations.NotNull;

/**
 * Checks the invariants every stored article must satisfy.
 */
public final class ArticleValidator {

    public static final int MAX_TITLE_LENGTH = 255;

    private ArticleValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws ArticleValidationException naming the first violated rule
     */
    public static void validate(@NotNull Article article) {
        String title = article.title();
        if (title.isBlank()) {
            throw new ArticleValidationException(title, "title is blank");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new ArticleValidationException(title,
                "title exceeds " + MAX_TITLE_LENGTH + " characters (" + title.length() + ")");
        }
        if (title.chars().anyMatch(Character::isISOControl)) {
            throw new ArticleValidationException(title, "title contains control characters");
        }
        if (article.redirectTarget() != null && article.redirectTarget().isBlank()) {
            throw new ArticleValidationException(title, "redirect target is blank");
        }
    }

    public static boolean isValid(@NotNull Article article) {
        try {
            validate(article);
            return true;
        } catch (ArticleValidationException e) {
            return false;
        }
    }
}

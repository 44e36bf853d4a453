package br.edu.ifba.wikicorpus.parser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless wikitext transforms used to turn raw article markup into plain
 * content and to pull out redirect, category and image references.
 *
 * <p>Every method accepts any input, including {@code null}, and degrades to an
 * empty result instead of throwing.</p>
 *
 * <p>Known limitation: {@link #stripTemplates(String)} works in a single
 * non-recursive pass, so nested templates such as {@code {{a|{{b}}}}} leave
 * their outer remains behind.</p>
 */
public final class WikitextExtractor {

    private static final Pattern TEMPLATE = Pattern.compile("\\{\\{[^}]*\\}\\}");
    private static final Pattern CATEGORY_LINK = Pattern.compile(
        "(?i)\\[\\[\\s*category\\s*:([^\\]|]*)(?:\\|[^\\]]*)?\\]\\]");
    private static final Pattern FILE_LINK = Pattern.compile(
        "(?i)\\[\\[\\s*(?:file|image)\\s*:([^\\]|]*)((?:\\|[^\\]]*)?)\\]\\]");
    private static final Pattern INTERNAL_LINK = Pattern.compile("\\[\\[([^\\]|]*)(?:\\|([^\\]]*))?\\]\\]");
    private static final Pattern EXTERNAL_LINK = Pattern.compile(
        "\\[((?:https?|ftp|mailto):[^\\s\\]]+|//[^\\s\\]]+)(?:\\s+([^\\]]*))?\\]");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern REDIRECT = Pattern.compile(
        "(?i)\\A\\s*#REDIRECT\\s*:?\\s*\\[\\[([^\\]|#]*)(?:#[^\\]|]*)?(?:\\|[^\\]]*)?\\]\\]");

    /** Image layout options that are never a caption. */
    private static final Pattern IMAGE_OPTION = Pattern.compile(
        "(?i)(thumb|thumbnail|frame|framed|frameless|border|left|right|center|centre|none|upright"
            + "|baseline|middle|sub|super|text-top|text-bottom|top|bottom|\\d*x?\\d+\\s*px"
            + "|(alt|link|page|lang|class|upright|thumb|thumbnail)\\s*=.*)");

    private static final String IMAGE_PATH_PREFIX = "/images/";
    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final Map<String, String> MIME_TYPES = Map.ofEntries(
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("png", "image/png"),
        Map.entry("gif", "image/gif"),
        Map.entry("svg", "image/svg+xml"),
        Map.entry("webp", "image/webp"),
        Map.entry("tif", "image/tiff"),
        Map.entry("tiff", "image/tiff"),
        Map.entry("bmp", "image/bmp"),
        Map.entry("ogg", "audio/ogg"),
        Map.entry("oga", "audio/ogg"),
        Map.entry("ogv", "video/ogg"),
        Map.entry("webm", "video/webm"),
        Map.entry("pdf", "application/pdf"),
        Map.entry("djvu", "image/vnd.djvu"));

    private WikitextExtractor() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Runs the full cleaning pipeline: templates, category and file links,
     * remaining links, tags, blank lines, then trims the result.
     *
     * @param text raw wikitext
     * @return cleaned plain content, never {@code null}
     */
    public static String clean(final String text) {
        String cleaned = normalizeLineEndings(text);
        cleaned = stripTemplates(cleaned);
        cleaned = stripRelationLinks(cleaned);
        cleaned = resolveLinks(cleaned);
        cleaned = stripTags(cleaned);
        cleaned = collapseBlankLines(cleaned);
        return cleaned.trim();
    }

    public static String stripTemplates(final String text) {
        if (isEmpty(text)) {
            return "";
        }
        return TEMPLATE.matcher(text).replaceAll("");
    }

    /**
     * Removes category and file/image links so they do not leak into content.
     */
    public static String stripRelationLinks(final String text) {
        if (isEmpty(text)) {
            return "";
        }
        String stripped = CATEGORY_LINK.matcher(text).replaceAll("");
        return FILE_LINK.matcher(stripped).replaceAll("");
    }

    /**
     * Replaces internal and external link markup with its display text, falling
     * back to the link target or URL when no display text is given.
     */
    public static String resolveLinks(final String text) {
        if (isEmpty(text)) {
            return "";
        }
        Matcher internal = INTERNAL_LINK.matcher(text);
        String resolved = internal.replaceAll(match -> Matcher.quoteReplacement(
            displayOrTarget(match.group(2), stripLeadingColon(match.group(1)))));

        Matcher external = EXTERNAL_LINK.matcher(resolved);
        return external.replaceAll(match -> Matcher.quoteReplacement(
            displayOrTarget(match.group(2), match.group(1))));
    }

    /**
     * Removes angle-bracket delimiters. Text between an opening and a closing
     * tag is kept.
     */
    public static String stripTags(final String text) {
        if (isEmpty(text)) {
            return "";
        }
        return TAG.matcher(text).replaceAll("");
    }

    /**
     * Collapses every run of two or more blank (or whitespace-only) lines into
     * a single empty line.
     */
    public static String collapseBlankLines(final String text) {
        if (isEmpty(text)) {
            return "";
        }
        // line by line; a repeated regex group recurses once per blank line
        String[] lines = normalizeLineEndings(text).split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        int i = 0;
        while (i < lines.length) {
            if (!lines[i].isBlank()) {
                kept.add(lines[i++]);
                continue;
            }
            int runEnd = i;
            while (runEnd < lines.length && lines[runEnd].isBlank()) {
                runEnd++;
            }
            kept.add(runEnd - i >= 2 ? "" : lines[i]);
            i = runEnd;
        }
        return String.join("\n", kept);
    }

    /**
     * Reads the target of a {@code #REDIRECT [[Target]]} body. Section anchors
     * and display text are dropped.
     *
     * @param text raw wikitext
     * @return the redirect target, or empty when the text is not a redirect
     */
    public static Optional<String> extractRedirectTarget(final String text) {
        if (isEmpty(text)) {
            return Optional.empty();
        }
        Matcher matcher = REDIRECT.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String target = matcher.group(1).trim();
        return target.isEmpty() ? Optional.empty() : Optional.of(target);
    }

    /**
     * Collects {@code [[Category:Name|sort key]]} names in order of first
     * appearance. Sort keys are dropped.
     */
    public static Set<String> extractCategories(final String text) {
        Set<String> categories = new LinkedHashSet<>();
        if (isEmpty(text)) {
            return categories;
        }
        Matcher matcher = CATEGORY_LINK.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            if (!name.isEmpty()) {
                categories.add(name);
            }
        }
        return categories;
    }

    /**
     * Collects {@code [[File:...]]} and {@code [[Image:...]]} references in
     * order of appearance.
     */
    public static List<ImageRef> extractImageReferences(final String text) {
        List<ImageRef> images = new ArrayList<>();
        if (isEmpty(text)) {
            return images;
        }
        Matcher matcher = FILE_LINK.matcher(text);
        while (matcher.find()) {
            String filename = canonicalFileName(matcher.group(1));
            if (filename.isEmpty()) {
                continue;
            }
            images.add(new ImageRef(
                filename,
                IMAGE_PATH_PREFIX + filename.replace(' ', '_'),
                0L,
                guessMimeType(filename),
                sha256Hex(filename),
                captionOf(matcher.group(2))));
        }
        return images;
    }

    /**
     * Normalizes a file name the way the wiki does: underscores become spaces,
     * runs of whitespace collapse and the first letter is upper-cased.
     */
    static String canonicalFileName(final String raw) {
        if (raw == null) {
            return "";
        }
        String name = raw.replace('_', ' ').trim().replaceAll("\\s+", " ");
        if (name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }

    static String guessMimeType(final String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return DEFAULT_MIME_TYPE;
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return MIME_TYPES.getOrDefault(extension, DEFAULT_MIME_TYPE);
    }

    static String sha256Hex(final String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String captionOf(final String options) {
        if (options == null || options.isEmpty()) {
            return null;
        }
        // options starts with '|'
        String[] segments = options.substring(1).split("\\|", -1);
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = segments[i].trim();
            if (!segment.isEmpty() && !IMAGE_OPTION.matcher(segment).matches()) {
                return segment;
            }
        }
        return null;
    }

    private static String displayOrTarget(final String display, final String target) {
        if (display != null && !display.isBlank()) {
            return display.trim();
        }
        return target == null ? "" : target.trim();
    }

    private static String stripLeadingColon(final String target) {
        if (target != null && target.startsWith(":")) {
            return target.substring(1);
        }
        return target;
    }

    private static String normalizeLineEndings(final String text) {
        if (isEmpty(text)) {
            return "";
        }
        return text.indexOf('\r') < 0 ? text : text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static boolean isEmpty(final String text) {
        return text == null || text.isEmpty();
    }
}

package br.edu.ifba.wikicorpus.parser;

import br.edu.ifba.wikicorpus.exception.DumpStreamException;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Push-style state machine that turns a stream of markup events from a dump
 * into {@link Article} records.
 *
 * <p>Expected structure: a root element whose children are document elements
 * ({@code page} or {@code doc}) and an optional {@code siteinfo} header. Each
 * document holds a {@code title}, an optional self-closing {@code redirect}
 * marker carrying its target as an attribute, and a {@code text} body of raw
 * wikitext. {@code revision} is a transparent wrapper and {@code timestamp}
 * becomes the article's last-modified time. The page and revision metadata
 * elements of MediaWiki exports ({@code ns}, {@code id}, {@code contributor},
 * ...) are skipped together with their subtrees; any other child of a
 * document is a structural violation.</p>
 *
 * <p>A body is cleaned and its relations extracted as soon as its
 * {@code text} element closes; only the results are kept until the document
 * ends.</p>
 *
 * <p>Only one document is accumulated at a time. A document is handed to the
 * consumer when it closes; a stream that ends while a document is open, or
 * any structural violation, raises {@link DumpStreamException} and nothing
 * more is emitted.</p>
 *
 * <p>Instances are single-threaded and not reusable concurrently; each call to
 * {@link #parse(InputStream, Consumer)} starts from a clean state.</p>
 */
public final class DumpStreamParser {

    private static final Logger LOG = Logger.getLogger(DumpStreamParser.class);

    private static final Set<String> DOCUMENT_ELEMENTS = Set.of("page", "doc");
    private static final Set<String> SITEINFO_FIELDS = Set.of("sitename", "generator", "lang", "dbname");
    private static final String SITEINFO = "siteinfo";
    private static final String TITLE = "title";
    private static final String TEXT = "text";
    private static final String REDIRECT = "redirect";
    private static final String REVISION = "revision";
    private static final String TIMESTAMP = "timestamp";
    private static final List<String> REDIRECT_TARGET_ATTRIBUTES = List.of("title", "target");
    private static final Set<String> SKIPPED_METADATA = Set.of(
        "ns", "id", "parentid", "contributor", "comment", "minor", "model", "format", "sha1",
        "restrictions", "origin", "discussionthreadinginfo", "upload");

    private static final int PROGRESS_INTERVAL = 1000;

    enum State {
        IDLE,
        IN_SITEINFO,
        IN_DOCUMENT,
        IN_TITLE,
        IN_BODY,
        IN_REDIRECT_TAG,
        IN_TIMESTAMP
    }

    private final Clock clock;

    private Consumer<Article> consumer;
    private State state = State.IDLE;
    private int depth;
    private int skipDepth;
    private long emitted;
    private boolean rootClosed;

    // per-document accumulator
    private String documentElement;
    private StringBuilder title;
    private boolean titleSeen;
    private StringBuilder body;
    private StringBuilder timestamp;
    private String redirectTarget;

    // results of the last closed body
    private String content;
    private String bodyRedirectTarget;
    private Set<String> categories;
    private List<ImageRef> images;

    // siteinfo accumulator
    private final Map<String, String> siteInfo = new HashMap<>();
    private String siteInfoField;
    private StringBuilder siteInfoText;
    private Instant dumpDate;
    private String rootLanguage;
    private DumpMetadata metadata = DumpMetadata.empty();

    public DumpStreamParser() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of the last-modified time for documents without a timestamp
     */
    public DumpStreamParser(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Reads a whole dump and pushes every complete article to {@code consumer}.
     * Exceptions thrown by the consumer propagate unchanged and stop the parse.
     *
     * @param input the dump bytes (uncompressed XML)
     * @param consumer receives each article as soon as its document closes
     * @return number of articles emitted
     * @throws DumpStreamException on malformed XML or invalid structure
     */
    public long parse(@NotNull InputStream input, @NotNull Consumer<Article> consumer) {
        Objects.requireNonNull(input, "input");
        begin(consumer);

        XMLStreamReader reader = null;
        try {
            reader = newInputFactory().createXMLStreamReader(input);
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> startElement(reader.getLocalName(), attributesOf(reader));
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE ->
                        characters(reader.getText());
                    case XMLStreamConstants.END_ELEMENT -> endElement(reader.getLocalName());
                    default -> {
                        // comments, processing instructions
                    }
                }
            }
            endOfStream();
        } catch (XMLStreamException e) {
            long line = e.getLocation() != null ? e.getLocation().getLineNumber() : -1L;
            throw new DumpStreamException("Malformed dump: " + e.getMessage(), line, e);
        } finally {
            closeQuietly(reader);
        }

        LOG.infof("Finished parsing dump: %d articles", emitted);
        return emitted;
    }

    /**
     * Resets the machine and sets the consumer for a new event stream. Used by
     * {@link #parse(InputStream, Consumer)} and by callers that push events
     * themselves.
     */
    public void begin(@NotNull Consumer<Article> consumer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        state = State.IDLE;
        depth = 0;
        skipDepth = 0;
        emitted = 0;
        rootClosed = false;
        resetDocument();
        siteInfo.clear();
        siteInfoField = null;
        siteInfoText = null;
        dumpDate = null;
        rootLanguage = null;
        metadata = DumpMetadata.empty();
    }

    public void startElement(@NotNull String name, @NotNull Map<String, String> attributes) {
        depth++;
        if (skipDepth > 0) {
            skipDepth++;
            return;
        }

        switch (state) {
            case IDLE -> startAtTopLevel(name, attributes);
            case IN_SITEINFO -> {
                siteInfoField = name;
                siteInfoText = new StringBuilder();
            }
            case IN_DOCUMENT -> startInDocument(name, attributes);
            default -> throw structural("Unexpected element <" + name + "> inside " + describeState());
        }
    }

    public void characters(@NotNull String text) {
        if (skipDepth > 0 || text.isEmpty()) {
            return;
        }
        switch (state) {
            case IN_TITLE -> title.append(text);
            case IN_BODY -> body.append(text);
            case IN_TIMESTAMP -> timestamp.append(text);
            case IN_SITEINFO -> {
                if (siteInfoText != null) {
                    siteInfoText.append(text);
                }
            }
            default -> {
                if (!text.isBlank()) {
                    throw structural("Unexpected text content inside " + describeState());
                }
            }
        }
    }

    public void endElement(@NotNull String name) {
        depth--;
        if (skipDepth > 0) {
            skipDepth--;
            return;
        }

        switch (state) {
            case IN_TITLE, IN_REDIRECT_TAG -> state = State.IN_DOCUMENT;
            case IN_BODY -> {
                finishBody();
                state = State.IN_DOCUMENT;
            }
            case IN_TIMESTAMP -> state = State.IN_DOCUMENT;
            case IN_DOCUMENT -> {
                if (name.equals(documentElement) && depth == 1) {
                    emitDocument();
                    state = State.IDLE;
                }
                // closing revision keeps us in the document
            }
            case IN_SITEINFO -> endInSiteInfo(name);
            case IDLE -> {
                if (depth == 0) {
                    rootClosed = true;
                }
            }
            default -> throw structural("Unexpected </" + name + ">");
        }
    }

    /**
     * Signals that the input is exhausted.
     *
     * @throws DumpStreamException if a document or the root element is still open
     */
    public void endOfStream() {
        if (state != State.IDLE) {
            String pending = title == null ? "" : title.toString().trim();
            throw structural("Unexpected end of stream inside " + describeState()
                + (pending.isEmpty() ? "" : " (document '" + pending + "')"));
        }
        if (depth != 0) {
            throw structural("Unexpected end of stream: " + depth + " element(s) still open");
        }
        metadata = buildMetadata().withArticleCount(emitted);
    }

    /**
     * Returns header information read so far; complete after a successful parse.
     */
    public DumpMetadata getMetadata() {
        return metadata;
    }

    State getState() {
        return state;
    }

    private void startAtTopLevel(final String name, final Map<String, String> attributes) {
        if (depth == 1) {
            if (rootClosed) {
                throw structural("Content after the root element: <" + name + ">");
            }
            dumpDate = parseInstant(attributes.get(TIMESTAMP));
            rootLanguage = attributes.get("xml:lang");
            return;
        }
        if (DOCUMENT_ELEMENTS.contains(name)) {
            resetDocument();
            documentElement = name;
            state = State.IN_DOCUMENT;
        } else if (SITEINFO.equals(name)) {
            state = State.IN_SITEINFO;
        } else {
            throw structural("Unexpected element <" + name + "> at top level");
        }
    }

    private void startInDocument(final String name, final Map<String, String> attributes) {
        switch (name) {
            case TITLE -> {
                if (titleSeen) {
                    throw structural("Duplicate <title> in document '" + title.toString().trim() + "'");
                }
                titleSeen = true;
                state = State.IN_TITLE;
            }
            case TEXT -> {
                // with several revisions the last body wins
                body = new StringBuilder();
                state = State.IN_BODY;
            }
            case REDIRECT -> {
                String target = redirectTargetOf(attributes);
                if (target != null) {
                    redirectTarget = target;
                }
                state = State.IN_REDIRECT_TAG;
            }
            case TIMESTAMP -> {
                timestamp = new StringBuilder();
                state = State.IN_TIMESTAMP;
            }
            case REVISION -> {
                // transparent wrapper
            }
            default -> {
                if (!SKIPPED_METADATA.contains(name)) {
                    throw structural("Unexpected element <" + name + "> inside a document");
                }
                skipDepth = 1;
            }
        }
    }

    private void endInSiteInfo(final String name) {
        if (SITEINFO.equals(name) && depth == 1) {
            siteInfoField = null;
            siteInfoText = null;
            state = State.IDLE;
            return;
        }
        if (name.equals(siteInfoField)) {
            if (SITEINFO_FIELDS.contains(name) && siteInfoText != null) {
                siteInfo.put(name, siteInfoText.toString().trim());
            }
            siteInfoField = null;
            siteInfoText = null;
        }
    }

    private void finishBody() {
        String raw = body.toString();
        body = null;
        content = WikitextExtractor.clean(raw);
        bodyRedirectTarget = WikitextExtractor.extractRedirectTarget(raw).orElse(null);
        if (bodyRedirectTarget == null) {
            categories = WikitextExtractor.extractCategories(raw);
            images = WikitextExtractor.extractImageReferences(raw);
        } else {
            categories = Set.of();
            images = List.of();
        }
    }

    private void emitDocument() {
        Instant lastModified = timestamp != null ? parseInstant(timestamp.toString().trim()) : null;
        if (lastModified == null) {
            lastModified = clock.instant();
        }

        String target = redirectTarget != null ? redirectTarget : bodyRedirectTarget;

        String articleTitle = title.toString().trim();
        Article article;
        if (target != null) {
            // relations are never derived for a redirect
            article = Article.redirect(articleTitle, content, lastModified, target);
        } else {
            article = Article.of(articleTitle, content, lastModified, categories, images);
        }
        resetDocument();

        consumer.accept(article);
        emitted++;
        if (emitted % PROGRESS_INTERVAL == 0) {
            LOG.infof("Parsed %d articles", emitted);
        }
    }

    private void resetDocument() {
        documentElement = null;
        title = new StringBuilder();
        titleSeen = false;
        body = null;
        timestamp = null;
        redirectTarget = null;
        content = "";
        bodyRedirectTarget = null;
        categories = Set.of();
        images = List.of();
    }

    private DumpMetadata buildMetadata() {
        String language = siteInfo.getOrDefault("lang", rootLanguage);
        return new DumpMetadata(siteInfo.get("sitename"), siteInfo.get("generator"), language, dumpDate, 0L);
    }

    private String describeState() {
        return switch (state) {
            case IDLE -> "top level";
            case IN_SITEINFO -> "<siteinfo>";
            case IN_DOCUMENT -> "a document";
            case IN_TITLE -> "<title>";
            case IN_BODY -> "<text>";
            case IN_REDIRECT_TAG -> "<redirect>";
            case IN_TIMESTAMP -> "<timestamp>";
        };
    }

    private DumpStreamException structural(final String message) {
        return new DumpStreamException(message);
    }

    private static String redirectTargetOf(final Map<String, String> attributes) {
        for (String attribute : REDIRECT_TARGET_ATTRIBUTES) {
            String value = attributes.get(attribute);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static Instant parseInstant(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable timestamp '%s'", value);
            return null;
        }
    }

    private static Map<String, String> attributesOf(final XMLStreamReader reader) {
        int count = reader.getAttributeCount();
        if (count == 0) {
            return Map.of();
        }
        Map<String, String> attributes = new HashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            String prefix = reader.getAttributePrefix(i);
            String name = reader.getAttributeLocalName(i);
            String key = prefix == null || prefix.isEmpty() ? name : prefix + ":" + name;
            attributes.put(key, reader.getAttributeValue(i));
        }
        return attributes;
    }

    private static XMLInputFactory newInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        return factory;
    }

    private static void closeQuietly(final XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            LOG.debug("Error closing dump reader", e);
        }
    }
}

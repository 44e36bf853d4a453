package br.edu.ifba.wikicorpus.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.wikicorpus.exception.DumpStreamException;

/**
 * Unit tests for DumpStreamParser and DumpSource.
 *
 * Tests verify:
 * 1. Articles are built from title, text, redirect and timestamp elements
 * 2. Known metadata children are skipped and siteinfo is read
 * 3. Unknown elements, structural violations and truncated input raise DumpStreamException
 * 4. A dangling document is never emitted
 * 5. Gzip dumps parse like plain ones
 */
class DumpStreamParserTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private DumpStreamParser parser;
    private List<Article> articles;

    @BeforeEach
    void setUp() {
        parser = new DumpStreamParser(Clock.fixed(NOW, ZoneOffset.UTC));
        articles = new ArrayList<>();
    }

    /**
     * Test that a category link is taken out of the content and into the categories.
     */
    @Test
    void testParsesMinimalDocument() {
        long count = parse("<root><doc><title>A</title><text>[[Category:X]] hello</text></doc></root>");

        assertEquals(1, count);
        Article article = articles.get(0);
        assertEquals("A", article.title());
        assertTrue(article.content().contains("hello"), "content should keep body text");
        assertEquals(Set.of("X"), article.categories());
        assertFalse(article.isRedirect());
        assertEquals(NOW, article.lastModified(), "missing timestamp falls back to the clock");
    }

    @Test
    void testParsesMediaWikiDump() throws IOException {
        try (InputStream in = resource("/dumps/sample-dump.xml")) {
            assertEquals(4, parser.parse(in, articles::add));
        }

        Article paris = articles.get(0);
        assertEquals("Paris", paris.title());
        assertEquals("'''Paris''' is the capital of France.", paris.content());
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"), paris.lastModified());
        assertEquals(List.of("Capitals in Europe", "Cities in France"), List.copyOf(paris.categories()));
        assertEquals(1, paris.images().size());
        assertEquals("Eiffel Tower.jpg", paris.images().get(0).filename());
        assertEquals("The Eiffel Tower", paris.images().get(0).caption());

        Article lyon = articles.get(1);
        assertEquals("'''Lyon''' is a city in France.", lyon.content());
        assertEquals(2, lyon.images().size());
        assertEquals(paris.images().get(0).hash(), lyon.images().get(1).hash());

        DumpMetadata metadata = parser.getMetadata();
        assertEquals("Wikipedia", metadata.siteName());
        assertEquals("MediaWiki 1.41.0-wmf.1", metadata.generator());
        assertEquals("en", metadata.language());
        assertEquals(4, metadata.articleCount());
    }

    @Test
    void testRedirectMarkerSetsTargetAndDropsRelations() throws IOException {
        try (InputStream in = resource("/dumps/sample-dump.xml")) {
            parser.parse(in, articles::add);
        }

        Article marker = articles.get(2);
        assertEquals("Capital of France", marker.title());
        assertTrue(marker.isRedirect());
        assertEquals("Paris", marker.redirectTarget());
        assertTrue(marker.categories().isEmpty());
        assertTrue(marker.images().isEmpty());

        Article bodyRedirect = articles.get(3);
        assertEquals("Capital of France", bodyRedirect.redirectTarget(), "body #REDIRECT is the fallback");
    }

    @Test
    void testRedirectMarkerWinsOverBody() {
        parse("<root><doc><title>R</title><redirect target=\"A\"/>"
            + "<text>#REDIRECT [[B]] [[Category:Ignored]]</text></doc></root>");

        Article article = articles.get(0);
        assertEquals("A", article.redirectTarget());
        assertTrue(article.categories().isEmpty(), "a redirect never carries categories");
    }

    @Test
    void testSizeIsUtf8ByteLengthOfCleanedContent() {
        parse("<root><doc><title>Café</title><text>café</text></doc></root>");

        assertEquals("café", articles.get(0).content());
        assertEquals(5, articles.get(0).size());
    }

    @Test
    void testDocumentWithoutTextHasEmptyContent() {
        parse("<root><page><title>Stub</title></page></root>");

        assertEquals("", articles.get(0).content());
        assertEquals(0, articles.get(0).size());
    }

    @Test
    void testLastRevisionTextWins() {
        parse("<root><page><title>T</title>"
            + "<revision><text>old</text></revision>"
            + "<revision><text>new</text></revision></page></root>");

        assertEquals("new", articles.get(0).content());
    }

    @Test
    void testRelationsComeFromLastRevisionOnly() {
        parse("<root><page><title>T</title>"
            + "<revision><text>[[Category:Old]] [[File:old.png]]</text></revision>"
            + "<revision><text>[[Category:New]] body</text></revision></page></root>");

        Article article = articles.get(0);
        assertEquals(Set.of("New"), article.categories());
        assertTrue(article.images().isEmpty());
        assertEquals("body", article.content());
    }

    @Test
    void testMediaWikiMetadataElementsAreSkipped() {
        parse("<root><page><title>T</title><ns>0</ns><id>1</id>"
            + "<revision><id>2</id><parentid>1</parentid><contributor><ip>127.0.0.1</ip></contributor>"
            + "<comment>edit</comment><minor/><model>wikitext</model><format>text/x-wiki</format>"
            + "<text>kept</text><sha1>abc</sha1></revision></page></root>");

        assertEquals(1, articles.size());
        assertEquals("kept", articles.get(0).content());
    }

    @Test
    void testUnparseableTimestampFallsBackToClock() {
        parse("<root><page><title>T</title><revision><timestamp>yesterday</timestamp>"
            + "<text>x</text></revision></page></root>");

        assertEquals(NOW, articles.get(0).lastModified());
    }

    @Test
    void testTruncatedStreamRaisesAndNeverEmitsDanglingDocument() {
        String xml = "<root><doc><title>Complete</title><text>done</text></doc>"
            + "<doc><title>Dangling</title><text>never closed";

        assertThrows(DumpStreamException.class, () -> parse(xml));
        assertEquals(1, articles.size());
        assertEquals("Complete", articles.get(0).title());
    }

    @Test
    void testEndOfStreamInsideDocumentRaises() {
        parser.begin(articles::add);
        parser.startElement("root", Map.of());
        parser.startElement("doc", Map.of());
        parser.startElement("title", Map.of());
        parser.characters("A");
        parser.endElement("title");

        DumpStreamException e = assertThrows(DumpStreamException.class, parser::endOfStream);
        assertTrue(e.getMessage().contains("'A'"), "message should name the pending document");
        assertTrue(articles.isEmpty());
    }

    @Test
    void testPushEventsEmitOnDocumentEnd() {
        parser.begin(articles::add);
        parser.startElement("root", Map.of());
        parser.startElement("page", Map.of());
        parser.startElement("title", Map.of());
        parser.characters("Pushed");
        parser.endElement("title");
        assertEquals(DumpStreamParser.State.IN_DOCUMENT, parser.getState());
        parser.endElement("page");
        assertEquals(DumpStreamParser.State.IDLE, parser.getState());
        parser.endElement("root");
        parser.endOfStream();

        assertEquals(1, articles.size());
        assertEquals("Pushed", articles.get(0).title());
    }

    @Test
    void testUnexpectedTopLevelElementRaises() {
        assertThrows(DumpStreamException.class, () -> parse("<root><article><title>A</title></article></root>"));
    }

    @Test
    void testNestedDocumentRaises() {
        assertThrows(DumpStreamException.class,
            () -> parse("<root><page><title>A</title><page><title>B</title></page></page></root>"));
        assertTrue(articles.isEmpty());
    }

    @Test
    void testUnknownDocumentChildRaises() {
        DumpStreamException e = assertThrows(DumpStreamException.class,
            () -> parse("<root><doc><title>A</title><bogus>zzz</bogus><text>hello</text></doc></root>"));

        assertTrue(e.getMessage().contains("<bogus>"), "message should name the element");
        assertTrue(articles.isEmpty());
    }

    @Test
    void testSecondTitleAfterEmptyTitleRaises() {
        assertThrows(DumpStreamException.class,
            () -> parse("<root><doc><title/><title>B</title><text>x</text></doc></root>"));
        assertTrue(articles.isEmpty());
    }

    @Test
    void testMarkupInsideTitleRaises() {
        assertThrows(DumpStreamException.class, () -> parse("<root><doc><title>A<b>x</b></title></doc></root>"));
    }

    @Test
    void testMarkupInsideTextRaises() {
        assertThrows(DumpStreamException.class,
            () -> parse("<root><doc><title>A</title><text>a <i>b</i></text></doc></root>"));
    }

    @Test
    void testTextInsideRedirectRaises() {
        assertThrows(DumpStreamException.class,
            () -> parse("<root><doc><title>A</title><redirect>Foo</redirect></doc></root>"));
    }

    @Test
    void testMalformedXmlReportsLine() {
        DumpStreamException e = assertThrows(DumpStreamException.class,
            () -> parse("<root>\n<doc>\n<title>A</title>\n</root>"));
        assertTrue(e.getLine() > 0, "malformed XML should carry a line number");
    }

    @Test
    void testGzipDumpParsesLikePlainDump() throws IOException {
        byte[] plain;
        try (InputStream in = resource("/dumps/sample-dump.xml")) {
            plain = in.readAllBytes();
        }
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write(plain);
        }
        Path gzFile = tempDir.resolve("dump.xml.gz");
        Files.write(gzFile, compressed.toByteArray());

        List<Article> fromPlain = new ArrayList<>();
        new DumpStreamParser(Clock.fixed(NOW, ZoneOffset.UTC))
            .parse(DumpSource.wrap(new ByteArrayInputStream(plain)), fromPlain::add);

        try (InputStream in = DumpSource.open(gzFile)) {
            parser.parse(in, articles::add);
        }

        assertEquals(fromPlain, articles);
    }

    @Test
    void testOpenMissingFileRaises() {
        assertThrows(DumpStreamException.class, () -> DumpSource.open(tempDir.resolve("missing.xml")));
    }

    private long parse(final String xml) {
        return parser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), articles::add);
    }

    private InputStream resource(final String name) {
        InputStream in = getClass().getResourceAsStream(name);
        if (in == null) {
            throw new IllegalStateException("Missing test resource " + name);
        }
        return in;
    }
}

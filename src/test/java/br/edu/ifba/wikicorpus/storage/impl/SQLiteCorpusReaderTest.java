package br.edu.ifba.wikicorpus.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.parser.DumpStreamParser;
import br.edu.ifba.wikicorpus.parser.ImageRef;
import br.edu.ifba.wikicorpus.storage.CorpusReader.SearchHit;
import br.edu.ifba.wikicorpus.storage.DedupCache;

/**
 * Unit tests for SQLiteCorpusReader.
 *
 * Tests verify:
 * 1. A parsed article reads back with its categories and ordered images
 * 2. Redirects resolve through chains up to the hop limit
 * 3. Cycles and dangling targets resolve to empty
 * 4. Full-text search, category listing and counts skip redirects
 */
class SQLiteCorpusReaderTest {

    private static final Instant WHEN = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteCorpusReader reader;
    private List<Article> parsed;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("corpus.db").toString());
        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        reader = new SQLiteCorpusReader(connectionManager);

        parsed = new ArrayList<>();
        try (InputStream in = getClass().getResourceAsStream("/dumps/sample-dump.xml")) {
            new DumpStreamParser().parse(in, parsed::add);
        }
        write(parsed);
    }

    @AfterEach
    void tearDown() {
        if (reader != null) {
            reader.close();
        }
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    /**
     * Test that parse, write and read give back the parsed article.
     */
    @Test
    void testRoundTripMatchesParsedArticle() {
        Article paris = parsed.get(0);

        Optional<Article> read = reader.getArticle("Paris").join();

        assertTrue(read.isPresent());
        assertEquals(paris, read.get());
    }

    @Test
    void testImagesReadInPositionOrder() {
        Article lyon = reader.getArticle("Lyon").join().orElseThrow();

        List<String> hashes = lyon.images().stream().map(ImageRef::hash).toList();
        List<String> expected = parsed.get(1).images().stream().map(ImageRef::hash).toList();
        assertEquals(expected, hashes);
        // the shared image row keeps the metadata of its first writer
        assertEquals("The Eiffel Tower", lyon.images().get(1).caption());
    }

    @Test
    void testRedirectChainResolves() {
        Article viaTwoHops = reader.getArticle("Lutetia").join().orElseThrow();

        assertEquals("Paris", viaTwoHops.title());
        assertEquals(Optional.of("Capital of France"), reader.getRedirectTarget("Lutetia").join());
        assertEquals(Optional.empty(), reader.getRedirectTarget("Paris").join());
    }

    /**
     * Test that a chain of exactly the hop limit resolves and one more does not.
     */
    @Test
    void testRedirectHopLimit() {
        writeChain("Short", SQLiteCorpusReader.MAX_REDIRECT_HOPS);
        writeChain("Long", SQLiteCorpusReader.MAX_REDIRECT_HOPS + 1);

        assertEquals("Paris", reader.getArticle("Short-1").join().map(Article::title).orElse(null));
        assertTrue(reader.getArticle("Long-1").join().isEmpty());
    }

    @Test
    void testRedirectCycleResolvesToEmpty() {
        write(List.of(
            Article.redirect("Ping", "", WHEN, "Pong"),
            Article.redirect("Pong", "", WHEN, "Ping")));

        assertTrue(reader.getArticle("Ping").join().isEmpty());
    }

    @Test
    void testDanglingRedirectResolvesToEmpty() {
        write(List.of(Article.redirect("Nowhere", "", WHEN, "Missing page")));

        assertTrue(reader.getArticle("Nowhere").join().isEmpty());
        assertTrue(reader.getArticle("Missing page").join().isEmpty());
    }

    @Test
    void testSearchSkipsRedirectsAndHighlights() {
        List<SearchHit> hits = reader.search("capital", 10).join();

        assertEquals(1, hits.size());
        assertEquals("Paris", hits.get(0).title());
        assertTrue(hits.get(0).snippet().contains("[capital]"), "snippet should mark the match");
    }

    @Test
    void testSearchOrdersBestFirstAndRespectsLimit() {
        List<SearchHit> hits = reader.search("France", 10).join();

        assertEquals(2, hits.size());
        assertTrue(hits.get(0).score() >= hits.get(1).score());
        assertEquals(1, reader.search("France", 1).join().size());
    }

    @Test
    void testSearchToleratesQuerySyntax() {
        assertTrue(reader.search("\"unbalanced AND", 10).join().isEmpty());
        assertTrue(reader.search("   ", 10).join().isEmpty());
    }

    @Test
    void testToMatchExpressionQuotesTerms() {
        assertEquals("\"paris\" \"\"\"x\"", SQLiteCorpusReader.toMatchExpression(" paris  \"x "));
        assertEquals("", SQLiteCorpusReader.toMatchExpression(null));
    }

    @Test
    void testCategoriesAndCounts() {
        assertEquals(List.of("Capitals in Europe", "Cities in France"), reader.listCategories().join());
        assertEquals(List.of("Lyon", "Paris"), reader.getArticlesInCategory("Cities in France").join());
        assertTrue(reader.getArticlesInCategory("Unknown").join().isEmpty());
        assertEquals(2L, reader.countArticles().join());
    }

    private void writeChain(final String prefix, final int redirects) {
        List<Article> chain = new ArrayList<>();
        for (int i = 1; i <= redirects; i++) {
            String target = i == redirects ? "Paris" : prefix + "-" + (i + 1);
            chain.add(Article.redirect(prefix + "-" + i, "", WHEN, target));
        }
        write(chain);
    }

    private void write(final List<Article> articles) {
        try (Connection conn = connectionManager.createWriterConnection();
             SQLiteCorpusWriter writer = new SQLiteCorpusWriter(conn, new DedupCache())) {
            writer.writeBatch(articles);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }
}

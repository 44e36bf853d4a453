package br.edu.ifba.wikicorpus.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.wikicorpus.exception.ArticleValidationException;
import br.edu.ifba.wikicorpus.exception.DumpStreamException;
import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.storage.impl.SQLiteConnectionManager;
import br.edu.ifba.wikicorpus.storage.impl.SQLiteCorpusReader;
import br.edu.ifba.wikicorpus.storage.impl.SQLiteSchemaMigrator;

/**
 * Unit tests for DumpImportService.
 *
 * Tests verify:
 * 1. A dump file is imported end to end and readable afterwards
 * 2. Invalid and duplicate records are skipped or abort, by policy
 * 3. Gzip dumps are accepted
 * 4. A broken dump writes nothing
 */
class DumpImportServiceTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteCorpusReader reader;
    private ParallelIngestionCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("corpus.db").toString());
        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        reader = new SQLiteCorpusReader(connectionManager);
        coordinator = new ParallelIngestionCoordinator(connectionManager, 2);
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Test
    void testImportsSampleDump() throws IOException {
        Path dump = copyResource("/dumps/sample-dump.xml", "sample.xml");

        ImportReport report = service(InvalidRecordPolicy.SKIP).importDump(dump);

        assertEquals(4, report.parsed());
        assertEquals(4, report.imported());
        assertEquals(0, report.skipped());
        assertEquals("en", report.metadata().language());
        assertEquals(4, report.metadata().articleCount());

        assertEquals(2L, reader.countArticles().join());
        Article resolved = reader.getArticle("Lutetia").join().orElseThrow();
        assertEquals("Paris", resolved.title());
        assertEquals("Paris", reader.search("capital", 5).join().get(0).title());
    }

    /**
     * Test that invalid records and repeated titles are skipped and reported.
     */
    @Test
    void testSkipPolicyDropsInvalidRecords() throws IOException {
        ImportReport report;
        try (InputStream in = resource("/dumps/invalid-records.xml")) {
            report = service(InvalidRecordPolicy.SKIP).importDump(in);
        }

        assertEquals(5, report.parsed());
        assertEquals(2, report.imported());
        assertEquals(List.of("", "Tab\ttitle", "Valid one"), report.skippedTitles());

        assertTrue(reader.getArticle("Valid one").join().orElseThrow().content().startsWith("First"));
        assertEquals(List.of("Kept"), reader.listCategories().join());
    }

    @Test
    void testAbortPolicyFailsWithoutWriting() throws IOException {
        try (InputStream in = resource("/dumps/invalid-records.xml")) {
            DumpImportService service = service(InvalidRecordPolicy.ABORT);
            ArticleValidationException e = assertThrows(ArticleValidationException.class,
                () -> service.importDump(in));
            assertEquals("", e.getTitle());
        }

        assertEquals(0L, reader.countArticles().join());
    }

    @Test
    void testImportsGzipDump() throws IOException {
        Path dump = tempDir.resolve("sample.xml.gz");
        try (InputStream in = resource("/dumps/sample-dump.xml");
             OutputStream out = new GZIPOutputStream(Files.newOutputStream(dump))) {
            in.transferTo(out);
        }

        ImportReport report = service(InvalidRecordPolicy.SKIP).importDump(dump);

        assertEquals(4, report.imported());
        assertTrue(reader.getArticle("Lyon").join().isPresent());
    }

    @Test
    void testTruncatedDumpWritesNothing() {
        String truncated = "<root><doc><title>Complete</title><text>done</text></doc><doc><title>Cut";
        DumpImportService service = service(InvalidRecordPolicy.SKIP);

        assertThrows(DumpStreamException.class,
            () -> service.importDump(new ByteArrayInputStream(truncated.getBytes(StandardCharsets.UTF_8))));

        assertEquals(0L, reader.countArticles().join());
    }

    @Test
    void testMissingDumpFile() {
        DumpImportService service = service(InvalidRecordPolicy.SKIP);

        assertThrows(DumpStreamException.class, () -> service.importDump(tempDir.resolve("absent.xml")));
    }

    private DumpImportService service(final InvalidRecordPolicy policy) {
        return new DumpImportService(coordinator, policy, Clock.systemUTC());
    }

    private Path copyResource(final String name, final String fileName) throws IOException {
        Path target = tempDir.resolve(fileName);
        try (InputStream in = resource(name)) {
            Files.copy(in, target);
        }
        return target;
    }

    private InputStream resource(final String name) {
        InputStream in = getClass().getResourceAsStream(name);
        if (in == null) {
            throw new IllegalStateException("Missing test resource " + name);
        }
        return in;
    }
}

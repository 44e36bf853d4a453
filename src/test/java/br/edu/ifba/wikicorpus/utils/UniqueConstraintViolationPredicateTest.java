package br.edu.ifba.wikicorpus.utils;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.wikicorpus.exception.CorpusStoreException;

/**
 * Unit tests for UniqueConstraintViolationPredicate.
 *
 * Tests verify:
 * 1. UNIQUE and PRIMARY KEY violations raised by SQLite match
 * 2. Other constraint failures do not match
 * 3. The cause chain is searched
 */
class UniqueConstraintViolationPredicateTest {

    private final UniqueConstraintViolationPredicate predicate = new UniqueConstraintViolationPredicate();

    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:sqlite::memory:");
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA foreign_keys = ON");
            stmt.execute("CREATE TABLE categories (id INTEGER PRIMARY KEY, name TEXT NOT NULL UNIQUE)");
            stmt.execute("CREATE TABLE redirects (from_title TEXT PRIMARY KEY, to_title TEXT NOT NULL)");
            stmt.execute("CREATE TABLE links (category_id INTEGER REFERENCES categories(id))");
            stmt.execute("INSERT INTO categories (id, name) VALUES (1, 'Physics')");
            stmt.execute("INSERT INTO redirects VALUES ('A', 'B')");
        }
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.close();
    }

    @Test
    void testMatchesUniqueViolation() {
        assertTrue(predicate.test(failure("INSERT INTO categories (name) VALUES ('Physics')")));
    }

    @Test
    void testMatchesPrimaryKeyViolation() {
        assertTrue(predicate.test(failure("INSERT INTO redirects VALUES ('A', 'C')")));
        assertTrue(predicate.test(failure("INSERT INTO categories (id, name) VALUES (1, 'Chemistry')")));
    }

    @Test
    void testIgnoresOtherConstraintFailures() {
        assertFalse(predicate.test(failure("INSERT INTO categories (name) VALUES (NULL)")));
        assertFalse(predicate.test(failure("INSERT INTO links VALUES (42)")));
        assertFalse(predicate.test(failure("SELECT * FROM missing_table")));
    }

    @Test
    void testSearchesCauseChain() {
        SQLException cause = failure("INSERT INTO categories (name) VALUES ('Physics')");

        assertTrue(predicate.test(new CorpusStoreException("write failed", cause)));
        assertFalse(predicate.test(new CorpusStoreException("write failed")));
        assertFalse(predicate.test(null));
    }

    private SQLException failure(final String sql) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            return e;
        }
        throw new AssertionError("Expected failure for: " + sql);
    }
}

package br.edu.ifba.wikicorpus.storage.impl;

import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies classpath SQL migrations to a corpus database.
 *
 * <p>Migration files live under {@code /db/migrations/} and are named
 * {@code V{version}__{description}.sql}. Every applied version is recorded in
 * {@code schema_version}; all pending migrations run in one transaction.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private static final String CREATE_VERSION_TABLE = """
        CREATE TABLE IF NOT EXISTS schema_version (
            version     INTEGER PRIMARY KEY,
            description TEXT    NOT NULL,
            applied_at  TEXT    NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now'))
        )
        """;

    private final List<Migration> migrations;

    /**
     * Creates a migrator for the corpus schema.
     */
    public SQLiteSchemaMigrator() {
        this(List.of(new ResourceMigration(1, "Corpus schema", MIGRATION_PATH + "V001__corpus_schema.sql")));
    }

    public SQLiteSchemaMigrator(List<Migration> migrations) {
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(Migration::getVersion));
        this.migrations = List.copyOf(sorted);
    }

    /**
     * @return highest applied version, 0 for an empty database
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies every migration newer than the current version.
     *
     * @return number of migrations applied
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public int migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.debugf("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        int applied = 0;
        try {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_VERSION_TABLE);
            }
            for (Migration migration : migrations) {
                if (migration.getVersion() <= currentVersion) {
                    continue;
                }
                LOG.infof("Applying migration V%03d: %s", migration.getVersion(), migration.getDescription());
                migration.apply(conn);
                recordVersion(conn, migration);
                applied++;
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
        return applied;
    }

    public List<Migration> getMigrations() {
        return migrations;
    }

    private static void recordVersion(final Connection conn, final Migration migration) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
            ps.setInt(1, migration.getVersion());
            ps.setString(2, migration.getDescription());
            ps.executeUpdate();
        }
    }

    /**
     * One schema step.
     */
    public interface Migration {

        int getVersion();

        String getDescription();

        void apply(Connection conn) throws SQLException;
    }

    /**
     * Migration read from a classpath SQL script. Statements are split on
     * semicolons outside quotes; {@code --} comments are dropped. Scripts must
     * not contain triggers.
     */
    static final class ResourceMigration implements Migration {

        private final int version;
        private final String description;
        private final String resourcePath;

        ResourceMigration(int version, String description, String resourcePath) {
            this.version = version;
            this.description = description;
            this.resourcePath = resourcePath;
        }

        @Override
        public int getVersion() {
            return version;
        }

        @Override
        public String getDescription() {
            return description;
        }

        @Override
        public void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(60, statement.length())));
                    stmt.execute(statement);
                }
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read migration " + resourcePath, e);
            }
        }

        static List<String> splitStatements(final String sql) {
            StringBuilder cleaned = new StringBuilder();
            for (String line : sql.split("\n")) {
                int comment = commentStart(line);
                String code = comment >= 0 ? line.substring(0, comment) : line;
                if (!code.isBlank()) {
                    cleaned.append(code).append('\n');
                }
            }

            List<String> statements = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            char quote = 0;
            for (int i = 0; i < cleaned.length(); i++) {
                char c = cleaned.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                    current.append(c);
                } else if (c == '\'' || c == '"') {
                    quote = c;
                    current.append(c);
                } else if (c == ';') {
                    addIfPresent(statements, current);
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
            addIfPresent(statements, current);
            return statements;
        }

        private static void addIfPresent(final List<String> statements, final StringBuilder current) {
            String statement = current.toString().trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }

        private static int commentStart(final String line) {
            char quote = 0;
            for (int i = 0; i < line.length() - 1; i++) {
                char c = line.charAt(i);
                if (quote != 0) {
                    if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '-' && line.charAt(i + 1) == '-') {
                    return i;
                }
            }
            return -1;
        }
    }
}

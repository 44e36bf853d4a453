package br.edu.ifba.wikicorpus.storage.impl;

import br.edu.ifba.wikicorpus.exception.CorpusStoreException;
import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.parser.ImageRef;
import br.edu.ifba.wikicorpus.storage.CorpusReader;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-backed {@link CorpusReader}. Reads use pooled read connections and
 * never block the ingestion writers.
 */
public final class SQLiteCorpusReader implements CorpusReader {

    private static final Logger LOG = Logger.getLogger(SQLiteCorpusReader.class);

    /** Longest redirect chain followed before giving up. */
    public static final int MAX_REDIRECT_HOPS = 8;

    private static final String SELECT_ARTICLE = """
        SELECT id, title, content, size, last_modified, is_redirect
        FROM articles
        WHERE title = ?
        """;

    private static final String SELECT_REDIRECT = "SELECT to_title FROM redirects WHERE from_title = ?";

    private static final String SELECT_CATEGORIES = """
        SELECT c.name
        FROM article_categories ac
        JOIN categories c ON c.id = ac.category_id
        WHERE ac.article_id = ?
        ORDER BY c.id
        """;

    private static final String SELECT_IMAGES = """
        SELECT i.filename, i.path, i.size, i.mime_type, i.hash, i.caption
        FROM article_images ai
        JOIN images i ON i.id = ai.image_id
        WHERE ai.article_id = ?
        ORDER BY ai.position
        """;

    private static final String SEARCH = """
        SELECT a.title, snippet(articles_fts, 1, '[', ']', '...', 16), articles_fts.rank
        FROM articles_fts
        JOIN articles a ON a.id = articles_fts.rowid
        WHERE articles_fts MATCH ? AND a.is_redirect = 0
        ORDER BY articles_fts.rank
        LIMIT ?
        """;

    private static final String SELECT_CATEGORY_MEMBERS = """
        SELECT a.title
        FROM categories c
        JOIN article_categories ac ON ac.category_id = c.id
        JOIN articles a ON a.id = ac.article_id
        WHERE c.name = ?
        ORDER BY a.title
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteCorpusReader(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<Optional<Article>> getArticle(@NotNull String title) {
        return CompletableFuture.supplyAsync(() -> withConnection("get article '" + title + "'", conn -> {
            Set<String> visited = new HashSet<>();
            String current = title;
            for (int hop = 0; hop <= MAX_REDIRECT_HOPS; hop++) {
                if (!visited.add(current)) {
                    LOG.debugf("Redirect cycle starting at '%s'", title);
                    return Optional.empty();
                }
                Optional<ArticleRow> row = findRow(conn, current);
                if (row.isEmpty()) {
                    return Optional.empty();
                }
                if (!row.get().redirect()) {
                    return Optional.of(load(conn, row.get()));
                }
                Optional<String> target = redirectTarget(conn, current);
                if (target.isEmpty()) {
                    return Optional.empty();
                }
                current = target.get();
            }
            LOG.debugf("Redirect chain from '%s' exceeds %d hops", title, MAX_REDIRECT_HOPS);
            return Optional.empty();
        }));
    }

    @Override
    public CompletableFuture<Optional<String>> getRedirectTarget(@NotNull String title) {
        return CompletableFuture.supplyAsync(() ->
            withConnection("get redirect of '" + title + "'", conn -> redirectTarget(conn, title)));
    }

    @Override
    public CompletableFuture<List<SearchHit>> search(@NotNull String query, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            String match = toMatchExpression(query);
            if (match.isEmpty() || limit <= 0) {
                return List.of();
            }
            return withConnection("search '" + query + "'", conn -> {
                List<SearchHit> hits = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(SEARCH)) {
                    ps.setString(1, match);
                    ps.setInt(2, limit);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            String snippet = rs.getString(2);
                            // fts5 rank is bm25, lower is better
                            hits.add(new SearchHit(rs.getString(1), snippet == null ? "" : snippet, -rs.getDouble(3)));
                        }
                    }
                }
                return hits;
            });
        });
    }

    @Override
    public CompletableFuture<List<String>> listCategories() {
        return CompletableFuture.supplyAsync(() -> withConnection("list categories", conn -> {
            List<String> names = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT name FROM categories ORDER BY name")) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        }));
    }

    @Override
    public CompletableFuture<List<String>> getArticlesInCategory(@NotNull String category) {
        return CompletableFuture.supplyAsync(() -> withConnection("list category '" + category + "'", conn -> {
            List<String> titles = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SELECT_CATEGORY_MEMBERS)) {
                ps.setString(1, category);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        titles.add(rs.getString(1));
                    }
                }
            }
            return titles;
        }));
    }

    @Override
    public CompletableFuture<Long> countArticles() {
        return CompletableFuture.supplyAsync(() -> withConnection("count articles", conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM articles WHERE is_redirect = 0")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }));
    }

    @Override
    public void close() {
        // connection manager is owned by the provider
    }

    /**
     * Quotes every whitespace-separated term so user input cannot break the
     * FTS5 query syntax. Terms are implicitly AND-ed.
     */
    static String toMatchExpression(final String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        StringBuilder match = new StringBuilder();
        for (String term : query.trim().split("\\s+")) {
            if (match.length() > 0) {
                match.append(' ');
            }
            match.append('"').append(term.replace("\"", "\"\"")).append('"');
        }
        return match.toString();
    }

    private Optional<ArticleRow> findRow(final Connection conn, final String title) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_ARTICLE)) {
            ps.setString(1, title);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ArticleRow(
                    rs.getLong("id"),
                    rs.getString("title"),
                    rs.getString("content"),
                    rs.getLong("size"),
                    Instant.parse(rs.getString("last_modified")),
                    rs.getInt("is_redirect") != 0));
            }
        }
    }

    private Optional<String> redirectTarget(final Connection conn, final String title) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_REDIRECT)) {
            ps.setString(1, title);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private Article load(final Connection conn, final ArticleRow row) throws SQLException {
        Set<String> categories = new LinkedHashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_CATEGORIES)) {
            ps.setLong(1, row.id());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    categories.add(rs.getString(1));
                }
            }
        }

        List<ImageRef> images = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_IMAGES)) {
            ps.setLong(1, row.id());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    images.add(new ImageRef(
                        rs.getString("filename"),
                        rs.getString("path"),
                        rs.getLong("size"),
                        rs.getString("mime_type"),
                        rs.getString("hash"),
                        rs.getString("caption")));
                }
            }
        }

        return new Article(row.title(), row.content(), row.size(), row.lastModified(), null, categories, images);
    }

    private <T> T withConnection(final String operation, final SqlFunction<T> work) {
        Connection conn = connectionManager.getReadConnection();
        try {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new CorpusStoreException("Failed to " + operation, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    private record ArticleRow(long id, String title, String content, long size, Instant lastModified,
            boolean redirect) {
    }
}

package br.edu.ifba.wikicorpus.storage.impl;

import br.edu.ifba.wikicorpus.exception.CorpusStoreException;
import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.parser.ArticleValidator;
import br.edu.ifba.wikicorpus.parser.ImageRef;
import br.edu.ifba.wikicorpus.storage.CorpusWriter;
import br.edu.ifba.wikicorpus.storage.DedupCache;
import br.edu.ifba.wikicorpus.utils.UniqueConstraintViolationPredicate;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * {@link CorpusWriter} over one SQLite connection.
 *
 * <p>Per article, inside the caller's transaction:</p>
 * <ol>
 *   <li>validate the article before touching the store</li>
 *   <li>insert the {@code articles} row and its {@code articles_fts} copy</li>
 *   <li>for a redirect, insert the {@code redirects} row and stop</li>
 *   <li>get-or-create each category (cache, then SELECT, then INSERT) and link it</li>
 *   <li>get-or-create each image by hash and link it with its position</li>
 * </ol>
 *
 * <p>An INSERT that loses a get-or-create race to another connection fails
 * with a unique violation; the writer then re-reads the winning row. The
 * connection is owned by the caller. The {@link DedupCache} is owned by this
 * writer alone and is cleared on every rollback.</p>
 */
public final class SQLiteCorpusWriter implements CorpusWriter {

    private static final Logger LOG = Logger.getLogger(SQLiteCorpusWriter.class);

    private static final String INSERT_ARTICLE =
        "INSERT INTO articles (title, content, size, last_modified, is_redirect) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_FTS = "INSERT INTO articles_fts (rowid, title, content) VALUES (?, ?, ?)";
    private static final String INSERT_REDIRECT = "INSERT INTO redirects (from_title, to_title) VALUES (?, ?)";
    private static final String SELECT_CATEGORY = "SELECT id FROM categories WHERE name = ?";
    private static final String INSERT_CATEGORY = "INSERT INTO categories (name) VALUES (?)";
    private static final String LINK_CATEGORY =
        "INSERT OR IGNORE INTO article_categories (article_id, category_id) VALUES (?, ?)";
    private static final String SELECT_IMAGE = "SELECT id FROM images WHERE hash = ?";
    private static final String INSERT_IMAGE =
        "INSERT INTO images (hash, filename, path, size, mime_type, caption) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String LINK_IMAGE =
        "INSERT OR IGNORE INTO article_images (article_id, image_id, position) VALUES (?, ?, ?)";
    private static final String LAST_ROWID = "SELECT last_insert_rowid()";

    private final Connection connection;
    private final DedupCache cache;
    private final Predicate<Throwable> uniqueViolation;
    private final List<PreparedStatement> openStatements = new ArrayList<>();

    private PreparedStatement insertArticle;
    private PreparedStatement insertFts;
    private PreparedStatement insertRedirect;
    private PreparedStatement selectCategory;
    private PreparedStatement insertCategory;
    private PreparedStatement linkCategory;
    private PreparedStatement selectImage;
    private PreparedStatement insertImage;
    private PreparedStatement linkImage;
    private PreparedStatement lastRowId;

    public SQLiteCorpusWriter(@NotNull Connection connection, @NotNull DedupCache cache) {
        this(connection, cache, new UniqueConstraintViolationPredicate());
    }

    SQLiteCorpusWriter(Connection connection, DedupCache cache, Predicate<Throwable> uniqueViolation) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.uniqueViolation = uniqueViolation;
    }

    @Override
    public void write(@NotNull Article article) {
        writeBatch(List.of(article));
    }

    @Override
    public int writeBatch(@NotNull List<Article> articles) {
        if (articles.isEmpty()) {
            return 0;
        }
        for (Article article : articles) {
            ArticleValidator.validate(article);
        }

        String inFlight = null;
        boolean autoCommit = true;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            for (Article article : articles) {
                inFlight = article.title();
                insert(article);
            }
            connection.commit();
            LOG.debugf("Committed %d articles", articles.size());
            return articles.size();
        } catch (SQLException e) {
            rollback();
            throw new CorpusStoreException(describeFailure(inFlight, articles.size()), e);
        } catch (RuntimeException e) {
            rollback();
            throw e;
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    /**
     * Exposed for tests.
     */
    DedupCache cache() {
        return cache;
    }

    @Override
    public void close() {
        for (PreparedStatement statement : openStatements) {
            try {
                statement.close();
            } catch (SQLException e) {
                LOG.debug("Error closing prepared statement", e);
            }
        }
        openStatements.clear();
    }

    private void insert(final Article article) throws SQLException {
        long articleId = insertArticle(article);

        if (article.isRedirect()) {
            insertRedirect = prepared(insertRedirect, INSERT_REDIRECT);
            insertRedirect.setString(1, article.title());
            insertRedirect.setString(2, article.redirectTarget());
            insertRedirect.executeUpdate();
            return;
        }

        for (String category : article.categories()) {
            long categoryId = categoryId(category);
            linkCategory = prepared(linkCategory, LINK_CATEGORY);
            linkCategory.setLong(1, articleId);
            linkCategory.setLong(2, categoryId);
            linkCategory.executeUpdate();
        }

        List<ImageRef> images = article.images();
        for (int position = 0; position < images.size(); position++) {
            long imageId = imageId(images.get(position));
            linkImage = prepared(linkImage, LINK_IMAGE);
            linkImage.setLong(1, articleId);
            linkImage.setLong(2, imageId);
            linkImage.setInt(3, position);
            linkImage.executeUpdate();
        }
    }

    private long insertArticle(final Article article) throws SQLException {
        insertArticle = prepared(insertArticle, INSERT_ARTICLE);
        insertArticle.setString(1, article.title());
        insertArticle.setString(2, article.content());
        insertArticle.setLong(3, article.size());
        insertArticle.setString(4, article.lastModified().toString());
        insertArticle.setInt(5, article.isRedirect() ? 1 : 0);
        insertArticle.executeUpdate();
        long articleId = lastInsertRowId();

        insertFts = prepared(insertFts, INSERT_FTS);
        insertFts.setLong(1, articleId);
        insertFts.setString(2, article.title());
        insertFts.setString(3, article.content());
        insertFts.executeUpdate();
        return articleId;
    }

    private long categoryId(final String name) throws SQLException {
        Long cached = cache.categoryId(name);
        if (cached != null) {
            return cached;
        }

        selectCategory = prepared(selectCategory, SELECT_CATEGORY);
        Long id = selectId(selectCategory, name);
        if (id == null) {
            insertCategory = prepared(insertCategory, INSERT_CATEGORY);
            insertCategory.setString(1, name);
            id = insertOrReread(insertCategory, selectCategory, name, "category");
        }
        cache.putCategory(name, id);
        return id;
    }

    private long imageId(final ImageRef image) throws SQLException {
        Long cached = cache.imageId(image.hash());
        if (cached != null) {
            return cached;
        }

        selectImage = prepared(selectImage, SELECT_IMAGE);
        Long id = selectId(selectImage, image.hash());
        if (id == null) {
            insertImage = prepared(insertImage, INSERT_IMAGE);
            insertImage.setString(1, image.hash());
            insertImage.setString(2, image.filename());
            insertImage.setString(3, image.path());
            insertImage.setLong(4, image.size());
            insertImage.setString(5, image.mimeType());
            insertImage.setString(6, image.caption());
            id = insertOrReread(insertImage, selectImage, image.hash(), "image");
        }
        cache.putImage(image.hash(), id);
        return id;
    }

    /**
     * Runs a get-or-create INSERT. When another writer committed the same key
     * first, the unique violation is absorbed and the winner's id returned.
     */
    private long insertOrReread(final PreparedStatement insert, final PreparedStatement select,
            final String key, final String kind) throws SQLException {
        try {
            insert.executeUpdate();
            return lastInsertRowId();
        } catch (SQLException e) {
            if (!uniqueViolation.test(e)) {
                throw e;
            }
            Long winner = selectId(select, key);
            if (winner == null) {
                throw e;
            }
            LOG.debugf("Lost insert race for %s '%s', reusing id %d", kind, key, winner);
            return winner;
        }
    }

    private Long selectId(final PreparedStatement select, final String key) throws SQLException {
        select.setString(1, key);
        try (ResultSet rs = select.executeQuery()) {
            return rs.next() ? rs.getLong(1) : null;
        }
    }

    private long lastInsertRowId() throws SQLException {
        lastRowId = prepared(lastRowId, LAST_ROWID);
        try (ResultSet rs = lastRowId.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private PreparedStatement prepared(final PreparedStatement current, final String sql) throws SQLException {
        if (current != null) {
            return current;
        }
        PreparedStatement statement = connection.prepareStatement(sql);
        openStatements.add(statement);
        return statement;
    }

    private void rollback() {
        cache.clear();
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Failed to roll back corpus transaction", e);
        }
    }

    private void restoreAutoCommit(final boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            LOG.warn("Failed to restore auto-commit", e);
        }
    }

    private static String describeFailure(final String title, final int batchSize) {
        if (title == null) {
            return "Failed to write batch of " + batchSize + " articles";
        }
        return "Failed to write article '" + title + "' (batch of " + batchSize + ")";
    }
}

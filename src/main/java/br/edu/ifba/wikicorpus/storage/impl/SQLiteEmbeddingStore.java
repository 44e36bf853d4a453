package br.edu.ifba.wikicorpus.storage.impl;

import br.edu.ifba.wikicorpus.exception.CorpusStoreException;
import br.edu.ifba.wikicorpus.exception.DimensionMismatchException;
import br.edu.ifba.wikicorpus.storage.EmbeddingStore;
import br.edu.ifba.wikicorpus.utils.EmbeddingUtil;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * {@link EmbeddingStore} over one table ("section") of a dedicated SQLite
 * database used as a key-value engine.
 *
 * <p>Table layout: {@code key TEXT PRIMARY KEY, vector BLOB}, the blob being
 * little-endian float32. Writes go through the manager's exclusive write
 * connection; {@link #findSimilar(float[], int)} scans every row inside one
 * read transaction on a pooled read connection and is O(N*D).</p>
 */
public final class SQLiteEmbeddingStore implements EmbeddingStore {

    private static final Logger LOG = Logger.getLogger(SQLiteEmbeddingStore.class);

    private static final Pattern SECTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

    private static final Comparator<ScoredKey> BY_SCORE = Comparator.comparingDouble(ScoredKey::score);

    private final SQLiteConnectionManager connectionManager;
    private final String section;
    private final int dimension;

    private final String upsertSql;
    private final String selectSql;
    private final String deleteSql;
    private final String countSql;
    private final String clearSql;
    private final String scanSql;

    /**
     * @param connectionManager manager of the embedding database
     * @param section table name, letters, digits and underscore only
     * @param dimension length of every stored vector
     */
    public SQLiteEmbeddingStore(@NotNull SQLiteConnectionManager connectionManager, @NotNull String section,
            int dimension) {
        if (!SECTION_NAME.matcher(section).matches()) {
            throw new IllegalArgumentException("Invalid section name: " + section);
        }
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.connectionManager = connectionManager;
        this.section = section;
        this.dimension = dimension;

        this.upsertSql = String.format(
            "INSERT INTO %s (key, vector) VALUES (?, ?) ON CONFLICT(key) DO UPDATE SET vector = excluded.vector",
            section);
        this.selectSql = String.format("SELECT vector FROM %s WHERE key = ?", section);
        this.deleteSql = String.format("DELETE FROM %s WHERE key = ?", section);
        this.countSql = String.format("SELECT COUNT(*) FROM %s", section);
        this.clearSql = String.format("DELETE FROM %s", section);
        this.scanSql = String.format("SELECT key, vector FROM %s", section);
    }

    /**
     * Creates the section table if it does not exist.
     */
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            String createTableSql = String.format(
                "CREATE TABLE IF NOT EXISTS %s (key TEXT PRIMARY KEY, vector BLOB NOT NULL)", section);
            Connection conn = connectionManager.getWriteConnection();
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(createTableSql);
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to create embedding section " + section, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
            LOG.infof("Initialized embedding section '%s' with dimension %d", section, dimension);
        });
    }

    @Override
    public int dimension() {
        return dimension;
    }

    public String section() {
        return section;
    }

    @Override
    public CompletableFuture<Void> put(@NotNull String key, @NotNull float[] vector) {
        return CompletableFuture.runAsync(() -> {
            checkDimension(key, vector.length);
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement ps = conn.prepareStatement(upsertSql)) {
                ps.setString(1, key);
                ps.setBytes(2, EmbeddingUtil.toBytes(vector));
                ps.executeUpdate();
                LOG.debugf("Stored vector for '%s'", key);
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to store vector for '" + key + "'", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putAll(@NotNull Map<String, float[]> vectors) {
        return CompletableFuture.runAsync(() -> {
            if (vectors.isEmpty()) {
                return;
            }
            vectors.forEach((key, vector) -> checkDimension(key, vector.length));

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement ps = conn.prepareStatement(upsertSql)) {
                    for (Map.Entry<String, float[]> entry : vectors.entrySet()) {
                        ps.setString(1, entry.getKey());
                        ps.setBytes(2, EmbeddingUtil.toBytes(entry.getValue()));
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                conn.commit();
                LOG.debugf("Stored %d vectors in section '%s'", vectors.size(), section);
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    LOG.warn("Failed to roll back batch vector upsert", rollbackEx);
                }
                throw new CorpusStoreException("Failed to store " + vectors.size() + " vectors", e);
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException e) {
                    LOG.warn("Failed to reset auto-commit", e);
                }
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<float[]>> get(@NotNull String key) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(EmbeddingUtil.fromBytes(rs.getBytes(1)));
                }
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to read vector for '" + key + "'", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(@NotNull String key) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement ps = conn.prepareStatement(deleteSql)) {
                ps.setString(1, key);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to delete vector for '" + key + "'", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Long> size() {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(countSql)) {
                return rs.next() ? rs.getLong(1) : 0L;
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to count vectors in section " + section, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Void> clear() {
        return CompletableFuture.runAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (Statement stmt = conn.createStatement()) {
                int removed = stmt.executeUpdate(clearSql);
                LOG.infof("Cleared %d vectors from section '%s'", removed, section);
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to clear section " + section, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<ScoredKey>> findSimilar(@NotNull float[] query, int k) {
        return CompletableFuture.supplyAsync(() -> {
            checkDimension("query", query.length);
            if (k <= 0) {
                return List.of();
            }

            // min-heap of the best k seen so far
            PriorityQueue<ScoredKey> best = new PriorityQueue<>(Math.min(k, 1024) + 1, BY_SCORE);
            Connection conn = connectionManager.getReadConnection();
            boolean autoCommit = true;
            try {
                autoCommit = conn.getAutoCommit();
                conn.setAutoCommit(false);
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(scanSql)) {
                    while (rs.next()) {
                        String key = rs.getString(1);
                        byte[] blob = rs.getBytes(2);
                        int storedDimension = EmbeddingUtil.dimensionOf(blob);
                        if (storedDimension != dimension || blob.length % Float.BYTES != 0) {
                            throw new DimensionMismatchException("stored key '" + key + "'", dimension,
                                storedDimension);
                        }
                        double score = EmbeddingUtil.cosineSimilarity(query, EmbeddingUtil.fromBytes(blob));
                        best.offer(new ScoredKey(key, score));
                        if (best.size() > k) {
                            best.poll();
                        }
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                throw new CorpusStoreException("Failed to scan section " + section, e);
            } finally {
                endReadTransaction(conn, autoCommit);
                connectionManager.releaseReadConnection(conn);
            }

            List<ScoredKey> ranked = new ArrayList<>(best);
            ranked.sort(BY_SCORE.reversed());
            LOG.debugf("findSimilar returned %d of at most %d keys", ranked.size(), k);
            return ranked;
        });
    }

    @Override
    public void close() {
        // connection manager is owned by the provider
    }

    private void checkDimension(final String context, final int actual) {
        if (actual != dimension) {
            throw new DimensionMismatchException(context, dimension, actual);
        }
    }

    private static void endReadTransaction(final Connection conn, final boolean autoCommit) {
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            LOG.debug("Failed to end read transaction", e);
        }
    }
}

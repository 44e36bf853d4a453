package br.edu.ifba.wikicorpus.storage.impl;

import br.edu.ifba.wikicorpus.exception.CorpusStoreException;
import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out configured SQLite connections for one database file.
 *
 * <ul>
 *   <li>WAL journal so readers never block the single writer</li>
 *   <li>busy timeout for waiting on the file lock instead of failing</li>
 *   <li>pooled read connections</li>
 *   <li>one shared write connection guarded by a {@link ReentrantLock}</li>
 *   <li>dedicated writer connections whose transactions start with
 *       {@code BEGIN IMMEDIATE}, one per ingestion worker</li>
 * </ul>
 *
 * <p>Parallel ingestion needs a file-backed database: every {@code :memory:}
 * connection sees its own private database.</p>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final String MEMORY = ":memory:";
    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -8000; // 8MB
    private static final long DEFAULT_MMAP_SIZE = 268435456L; // 256MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final int cacheSize;
    private final long mmapSize;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock = new ReentrantLock();

    private Connection writeConnection;
    private volatile boolean closed;

    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, true, DEFAULT_POOL_SIZE);
    }

    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        this(databasePath, busyTimeout, walMode, readPoolSize, DEFAULT_CACHE_SIZE, DEFAULT_MMAP_SIZE);
    }

    /**
     * @param databasePath path to the database file
     * @param busyTimeout how long a connection waits for the file lock
     * @param walMode whether to switch the journal to WAL
     * @param readPoolSize number of idle read connections kept
     * @param cacheSize page cache size (negative = KB, positive = pages)
     * @param mmapSize memory-mapped I/O size in bytes, 0 to disable
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode,
            int readPoolSize, int cacheSize, long mmapSize) {
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.cacheSize = cacheSize;
        this.mmapSize = mmapSize;
        this.readPool = new ArrayBlockingQueue<>(Math.max(1, readPoolSize));
    }

    /**
     * Opens a new connection in auto-commit mode with pragmas applied.
     *
     * @throws CorpusStoreException if the database cannot be opened
     */
    public Connection createConnection() {
        return open(baseConfig(), "connection");
    }

    /**
     * Opens a connection whose transactions take the write lock up front
     * ({@code BEGIN IMMEDIATE}). The caller owns and closes it.
     *
     * @throws CorpusStoreException if the database cannot be opened
     */
    public Connection createWriterConnection() {
        SQLiteConfig config = baseConfig();
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return open(config, "writer connection");
    }

    public Connection getReadConnection() {
        ensureOpen();
        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Pooled read connection unusable, opening a new one", e);
            }
        }
        return createConnection();
    }

    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (closed || conn.isClosed() || !readPool.offer(conn)) {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Returns the shared write connection with the write lock held. Every
     * call must be paired with {@link #releaseWriteConnection(Connection)}.
     */
    public Connection getWriteConnection() {
        ensureOpen();
        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new CorpusStoreException("Failed to obtain write connection for " + databasePath, e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode && !isInMemory()) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA mmap_size = " + mmapSize);
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public boolean isInMemory() {
        return databasePath.startsWith(MEMORY);
    }

    @Override
    public void close() {
        closed = true;
        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }
        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }
        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }

    private SQLiteConfig baseConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout((int) busyTimeout.toMillis());
        config.setCacheSize(cacheSize);
        return config;
    }

    private Connection open(final SQLiteConfig config, final String kind) {
        ensureOpen();
        createParentDirectory();
        try {
            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            try {
                applyPragmas(conn);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            LOG.debugf("Opened SQLite %s to %s", kind, databasePath);
            return conn;
        } catch (SQLException e) {
            throw new CorpusStoreException("Failed to open SQLite " + kind + " to " + databasePath, e);
        }
    }

    private void createParentDirectory() {
        if (isInMemory()) {
            return;
        }
        Path parent = Paths.get(databasePath).toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            try {
                Files.createDirectories(parent);
                LOG.infof("Created database directory: %s", parent);
            } catch (IOException e) {
                LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }
}

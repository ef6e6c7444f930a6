package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.config.StoreConfig;
import de.bsommerfeld.skillbook.core.error.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;

/**
 * Connection source and transaction boundary for the SQLite database file.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after; no state survives between calls. Every connection enforces foreign
 * keys, so deleting a plan cascades to its task lists and tasks.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #write} runs its work in one transaction and rolls back on any
 * failure, including unchecked exceptions such as a
 * {@code NotFoundException} raised half-way. {@link #read} uses auto-commit.
 * Both translate {@link SQLException} into {@link DatabaseException}
 * carrying the operation name and its input.
 */
@Singleton
public class Database {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    private final String url;
    private final int busyTimeoutMillis;

    @Inject
    public Database(StoreConfig config) {
        ensureParentDirectory(config.getDatabasePath());
        this.url = config.getJdbcUrl();
        this.busyTimeoutMillis = config.getBusyTimeoutMillis();
        LOG.info("Using database at {}", url);
    }

    private static void ensureParentDirectory(Path databaseFile) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            LOG.info("Created database directory {}", parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create database directory " + parent, e);
        }
    }

    public String getUrl() {
        return url;
    }

    public Connection getConnection() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(busyTimeoutMillis);
        return DriverManager.getConnection(url, sqlite.toProperties());
    }

    /** Unit of work against an open connection. */
    @FunctionalInterface
    public interface Work<T> {
        T apply(Connection conn) throws SQLException;
    }

    /**
     * Runs {@code work} on a fresh auto-commit connection.
     *
     * @throws DatabaseException if the work raises an {@link SQLException}
     */
    public <T> T read(String operation, Map<String, ?> input, Work<T> work) {
        try (Connection conn = getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new DatabaseException(operation, input, e);
        }
    }

    /**
     * Runs {@code work} inside one transaction: commit on success, rollback
     * on any exception.
     *
     * @throws DatabaseException if the work raises an {@link SQLException}
     */
    public <T> T write(String operation, Map<String, ?> input, Work<T> work) {
        try {
            return inTransaction(work);
        } catch (SQLException e) {
            LOG.debug("[DB] {} rolled back: {}", operation, e.getMessage());
            throw new DatabaseException(operation, input, e);
        }
    }

    /**
     * Runs several reads inside one transaction so they observe the same
     * snapshot of the file.
     *
     * @throws DatabaseException if the work raises an {@link SQLException}
     */
    public <T> T snapshot(String operation, Map<String, ?> input, Work<T> work) {
        try {
            return inTransaction(work);
        } catch (SQLException e) {
            throw new DatabaseException(operation, input, e);
        }
    }

    /**
     * Transaction primitive without exception translation, for callers that
     * report failures in their own terms (the schema migrator).
     */
    public <T> T inTransaction(Work<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }
}

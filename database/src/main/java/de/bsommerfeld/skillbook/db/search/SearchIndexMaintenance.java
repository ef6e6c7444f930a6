package de.bsommerfeld.skillbook.db.search;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.error.DatabaseException;
import de.bsommerfeld.skillbook.db.Database;
import de.bsommerfeld.skillbook.db.Jdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * Administrative FTS5 commands. The triggers keep the indexes current on
 * their own; these are for repairing an index after it was written around
 * (e.g. restored from a file copy) and for compacting it.
 */
@Singleton
public class SearchIndexMaintenance {

    private static final Logger LOG = LoggerFactory.getLogger(SearchIndexMaintenance.class);

    private final Database database;

    @Inject
    public SearchIndexMaintenance(Database database) {
        this.database = database;
    }

    /** Discards the index and rebuilds it from the source table. */
    public void rebuild(SearchIndex index) {
        command(index, "rebuild");
        LOG.info("[DB] Rebuilt {}", index.table());
    }

    /** Merges index b-tree segments. */
    public void optimize(SearchIndex index) {
        command(index, "optimize");
        LOG.info("[DB] Optimized {}", index.table());
    }

    /**
     * Compares the index with its source table.
     *
     * @return {@code true} if they agree; {@code false} if FTS5 reports the
     *         index as corrupt
     * @throws DatabaseException for any other failure
     */
    public boolean integrityCheck(SearchIndex index) {
        try {
            database.inTransaction(conn -> {
                Jdbc.execute(conn, "INSERT INTO " + index.table() + "(" + index.table() + ", rank) "
                        + "VALUES ('integrity-check', 1)");
                return null;
            });
            return true;
        } catch (SQLException e) {
            if (isCorrupt(e)) {
                LOG.warn("[DB] Integrity check failed for {}: {}", index.table(), e.getMessage());
                return false;
            }
            throw new DatabaseException("check " + index.table(), Jdbc.context("index", index), e);
        }
    }

    private static boolean isCorrupt(SQLException e) {
        String message = String.valueOf(e.getMessage()).toLowerCase();
        return message.contains("corrupt") || message.contains("malformed");
    }

    private void command(SearchIndex index, String command) {
        database.write(command + " " + index.table(), Jdbc.context("index", index), conn -> {
            Jdbc.execute(conn, "INSERT INTO " + index.table() + "(" + index.table() + ") VALUES ('" + command + "')");
            return null;
        });
    }
}

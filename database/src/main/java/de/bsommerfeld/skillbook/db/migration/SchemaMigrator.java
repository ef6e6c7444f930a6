package de.bsommerfeld.skillbook.db.migration;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.db.Database;
import de.bsommerfeld.skillbook.db.Jdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies versioned {@link Migration} units and records each in the
 * {@code schema_version} ledger.
 *
 * <p>
 * Every unit runs in its own transaction together with its ledger row, so a
 * failing statement leaves the schema at the previous version. Running
 * {@link #migrate()} with nothing pending executes no DDL at all.
 */
@Singleton
public class SchemaMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

    /** Errors a down statement may raise against a partially migrated schema. */
    private static final Pattern MISSING_OBJECT = Pattern.compile("no such (table|trigger|index)");

    private static final String CREATE_LEDGER = "CREATE TABLE IF NOT EXISTS schema_version ("
            + "version INTEGER PRIMARY KEY, "
            + "applied_at TEXT NOT NULL DEFAULT (datetime('now')))";

    private final Database database;
    private final List<Migration> migrations;

    @Inject
    public SchemaMigrator(Database database) {
        this(database, Migrations.defaults());
    }

    public SchemaMigrator(Database database, List<Migration> migrations) {
        this.database = database;
        this.migrations = sortedAndChecked(migrations);
    }

    private static List<Migration> sortedAndChecked(List<Migration> migrations) {
        Set<Integer> seen = new HashSet<>();
        for (Migration m : migrations) {
            if (m.version() < 1) {
                throw new MigrationException("Migration version must be positive: " + m.version());
            }
            if (!seen.add(m.version())) {
                throw new MigrationException("Duplicate migration version: " + m.version());
            }
        }
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort((a, b) -> Integer.compare(a.version(), b.version()));
        return List.copyOf(sorted);
    }

    public List<Migration> getMigrations() {
        return migrations;
    }

    /** Highest applied version, 0 if the ledger does not exist yet. */
    public int currentVersion() {
        try (Connection conn = database.getConnection()) {
            return currentVersion(conn);
        } catch (SQLException e) {
            throw new MigrationException(0, "could not read schema version", e);
        }
    }

    private static int currentVersion(Connection conn) throws SQLException {
        if (!ledgerExists(conn)) {
            return 0;
        }
        return (int) Jdbc.queryLong(conn, "SELECT COALESCE(MAX(version), 0) FROM schema_version");
    }

    private static boolean ledgerExists(Connection conn) throws SQLException {
        return Jdbc.queryLong(conn,
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'schema_version'") > 0;
    }

    /**
     * Applies every unit newer than the current version, ascending.
     *
     * @throws MigrationException on the first failing unit; earlier units stay
     *                            applied
     */
    public MigrationReport migrate() {
        int from = currentVersion();
        List<Migration> pending = new ArrayList<>();
        for (Migration m : migrations) {
            if (m.version() > from) {
                pending.add(m);
            }
        }
        if (pending.isEmpty()) {
            LOG.info("[DB] Schema is up to date at v{}", from);
            return new MigrationReport(from, from, List.of());
        }

        LOG.info("[DB] Running {} migration(s) from v{}", pending.size(), from);
        List<Integer> applied = new ArrayList<>();
        for (Migration m : pending) {
            apply(m);
            applied.add(m.version());
        }
        int to = applied.get(applied.size() - 1);
        LOG.info("[DB] Migrations complete, schema at v{}", to);
        return new MigrationReport(from, to, applied);
    }

    private void apply(Migration m) {
        LOG.info("[DB] Applying migration v{} ({})", m.version(), m.description());
        try {
            database.inTransaction(conn -> {
                Jdbc.execute(conn, CREATE_LEDGER);
                for (String statement : m.up()) {
                    Jdbc.execute(conn, statement);
                }
                Jdbc.update(conn, "INSERT INTO schema_version (version) VALUES (?)", m.version());
                return null;
            });
        } catch (SQLException e) {
            throw new MigrationException(m.version(), "could not apply " + m.description(), e);
        }
    }

    /** Reverts the most recently applied unit. */
    public MigrationReport rollback() {
        return rollback(1);
    }

    /**
     * Reverts up to {@code steps} units, newest first, each in its own
     * transaction with the removal of its ledger row.
     */
    public MigrationReport rollback(int steps) {
        if (steps < 1) {
            throw new MigrationException("Rollback steps must be at least 1: " + steps);
        }
        int from = currentVersion();
        int current = from;
        List<Integer> reverted = new ArrayList<>();
        while (reverted.size() < steps && current > 0) {
            Migration m = find(current);
            revert(m);
            reverted.add(m.version());
            current = currentVersion();
        }
        LOG.info("[DB] Rolled back {} migration(s), schema at v{}", reverted.size(), current);
        return new MigrationReport(from, current, reverted);
    }

    private Migration find(int version) {
        for (Migration m : migrations) {
            if (m.version() == version) {
                return m;
            }
        }
        throw new MigrationException("Applied version v" + version + " has no known migration");
    }

    private void revert(Migration m) {
        LOG.info("[DB] Reverting migration v{} ({})", m.version(), m.description());
        try {
            database.inTransaction(conn -> {
                for (String statement : m.down()) {
                    Jdbc.execute(conn, statement);
                }
                Jdbc.update(conn, "DELETE FROM schema_version WHERE version = ?", m.version());
                return null;
            });
        } catch (SQLException e) {
            throw new MigrationException(m.version(), "could not revert " + m.description(), e);
        }
    }

    /**
     * Drops everything the known units create, newest first, in one
     * transaction, then migrates from scratch. Missing tables, triggers and
     * indexes are skipped so a partially migrated database can be reset.
     */
    public MigrationReport reset() {
        LOG.warn("[DB] Resetting database schema");
        int[] current = new int[1];
        try {
            database.inTransaction(conn -> {
                for (int i = migrations.size() - 1; i >= 0; i--) {
                    current[0] = migrations.get(i).version();
                    for (String statement : migrations.get(i).down()) {
                        executeTolerant(conn, statement);
                    }
                }
                current[0] = 0;
                if (ledgerExists(conn)) {
                    Jdbc.update(conn, "DELETE FROM schema_version");
                }
                return null;
            });
        } catch (SQLException e) {
            throw new MigrationException(current[0], "could not reset schema", e);
        }
        return migrate();
    }

    private static void executeTolerant(Connection conn, String statement) throws SQLException {
        try {
            Jdbc.execute(conn, statement);
        } catch (SQLException e) {
            String message = String.valueOf(e.getMessage());
            if (!MISSING_OBJECT.matcher(message).find()) {
                throw e;
            }
            LOG.debug("[DB] Skipped during reset: {}", message);
        }
    }

    /** Applied state of every known unit, ascending. */
    public List<MigrationStatus> status() {
        Map<Integer, Instant> applied = new HashMap<>();
        try (Connection conn = database.getConnection()) {
            if (ledgerExists(conn)) {
                for (LedgerRow row : Jdbc.queryList(conn, "SELECT version, applied_at FROM schema_version",
                        rs -> new LedgerRow(rs.getInt("version"), Jdbc.instant(rs, "applied_at")))) {
                    applied.put(row.version(), row.appliedAt());
                }
            }
        } catch (SQLException e) {
            throw new MigrationException(0, "could not read migration status", e);
        }
        List<MigrationStatus> result = new ArrayList<>();
        for (Migration m : migrations) {
            result.add(new MigrationStatus(m.version(), m.description(), applied.containsKey(m.version()),
                    applied.get(m.version())));
        }
        return result;
    }

    private record LedgerRow(int version, Instant appliedAt) {
    }
}

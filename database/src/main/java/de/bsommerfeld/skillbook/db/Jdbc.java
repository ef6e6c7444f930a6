package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.change.ColumnChanges;
import de.bsommerfeld.skillbook.core.domain.PlanStatus;
import de.bsommerfeld.skillbook.core.domain.ReferenceType;
import de.bsommerfeld.skillbook.core.error.NotFoundException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Small JDBC helpers shared by the stores: parameter binding, single-row and
 * list queries, and SET-clause assembly from {@link ColumnChanges}.
 */
public final class Jdbc {

    private static final DateTimeFormatter SQLITE_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Jdbc() {
    }

    /** Maps the current row of a result set. */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Binds positional parameters. Enums are stored by their database value,
     * booleans as 0/1 and {@link Instant}s in SQLite's datetime format.
     */
    public static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            int index = i + 1;
            Object value = params[i];
            if (value == null) {
                ps.setNull(index, Types.NULL);
            } else if (value instanceof PlanStatus status) {
                ps.setString(index, status.dbValue());
            } else if (value instanceof ReferenceType type) {
                ps.setString(index, type.dbValue());
            } else if (value instanceof Boolean flag) {
                ps.setInt(index, flag ? 1 : 0);
            } else if (value instanceof Instant instant) {
                ps.setString(index, SQLITE_DATETIME.format(instant.atOffset(ZoneOffset.UTC)));
            } else {
                ps.setObject(index, value);
            }
        }
    }

    public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    public static <T> List<T> queryList(Connection conn, String sql, RowMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        }
    }

    /** Returns the first column of the first row as a long, 0 for an empty result or SQL NULL. */
    public static long queryLong(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /** Executes an INSERT/UPDATE/DELETE and returns the affected row count. */
    public static int update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            return ps.executeUpdate();
        }
    }

    /**
     * Executes an INSERT and returns the rowid it assigned, read on the same
     * connection so concurrent writers cannot interleave.
     */
    public static long insert(Connection conn, String sql, Object... params) throws SQLException {
        update(conn, sql, params);
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * Fails with {@link NotFoundException} unless {@code table} has a row with
     * the given id. Used to report missing parents before an insert would
     * trip a foreign key.
     */
    public static void requireRow(Connection conn, String table, String entity, long id) throws SQLException {
        if (queryLong(conn, "SELECT COUNT(*) FROM " + table + " WHERE id = ?", id) == 0) {
            throw new NotFoundException(entity, id);
        }
    }

    /** Runs a parameterless statement, typically DDL. */
    public static void execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    /**
     * Builds {@code UPDATE <table> SET col = ?, ..., <extra> WHERE id = ?}
     * from the columns present in {@code changes}. Column names come from the
     * update classes' constants, never from callers.
     *
     * @param extraAssignment literal assignment appended to the SET list,
     *                        e.g. {@code updated_at = datetime('now')}, or
     *                        {@code null}
     */
    public static String updateSql(String table, ColumnChanges changes, String extraAssignment) {
        StringJoiner set = new StringJoiner(", ");
        for (String column : changes.values().keySet()) {
            set.add(column + " = ?");
        }
        if (extraAssignment != null) {
            set.add(extraAssignment);
        }
        return "UPDATE " + table + " SET " + set + " WHERE id = ?";
    }

    /** Parameters for {@link #updateSql}: the change values followed by the row id. */
    public static Object[] updateParams(ColumnChanges changes, long id) {
        List<Object> params = new ArrayList<>(changes.values().values());
        params.add(id);
        return params.toArray();
    }

    /**
     * Operation input for error reporting. Accepts alternating keys and
     * values; values may be {@code null}.
     */
    public static Map<String, Object> context(Object... keysAndValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            context.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return context;
    }

    /** Parses SQLite's {@code datetime('now')} text as UTC; {@code null} stays {@code null}. */
    public static Instant instant(ResultSet rs, String column) throws SQLException {
        String text = rs.getString(column);
        if (text == null) {
            return null;
        }
        return LocalDateTime.parse(text, SQLITE_DATETIME).toInstant(ZoneOffset.UTC);
    }

    /** Reads a nullable INTEGER column. */
    public static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /** Reads a nullable INTEGER id column. */
    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}

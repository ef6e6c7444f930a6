package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Assigns and rewrites the integer ordering key among sibling rows.
 *
 * <p>
 * New siblings go after the current maximum ({@code 0} for the first).
 * Reordering applies each requested position as-is; gaps and duplicates are
 * allowed and read back as ties in {@code position} order. Rows outside the
 * given scope are never touched.
 */
@Singleton
public class PositionManager {

    private static final Logger LOG = LoggerFactory.getLogger(PositionManager.class);

    /** A family of siblings: the table, the column naming their parent, and the sibling key. */
    public enum Scope {
        TASK_LISTS("task_lists", "plan_id", "id", true),
        TASKS("tasks", "list_id", "id", true),
        PROMPT_SKILLS("prompt_skills", "prompt_id", "skill_id", false),
        FRAGMENT_SKILLS("prompt_fragment_skills", "fragment_id", "skill_id", false),
        PLAN_SKILLS("plan_skills", "plan_id", "skill_id", false),
        PROMPT_REFERENCES("prompt_references", "source_prompt_id", "id", false);

        private final String table;
        private final String scopeColumn;
        private final String keyColumn;
        private final boolean touchesUpdatedAt;

        Scope(String table, String scopeColumn, String keyColumn, boolean touchesUpdatedAt) {
            this.table = table;
            this.scopeColumn = scopeColumn;
            this.keyColumn = keyColumn;
            this.touchesUpdatedAt = touchesUpdatedAt;
        }

        public String table() {
            return table;
        }

        String nextPositionSql() {
            return "SELECT COALESCE(MAX(position) + 1, 0) FROM " + table + " WHERE " + scopeColumn + " = ?";
        }

        String reorderSql() {
            return "UPDATE " + table + " SET position = ?"
                    + (touchesUpdatedAt ? ", updated_at = datetime('now')" : "")
                    + " WHERE " + keyColumn + " = ? AND " + scopeColumn + " = ?";
        }
    }

    private final Database database;

    @Inject
    public PositionManager(Database database) {
        this.database = database;
    }

    public int nextPosition(Scope scope, long scopeId) {
        Validator.of(scope.table).id("scopeId", scopeId).validate();
        return database.read("compute next position", Jdbc.context("scope", scope, "scopeId", scopeId),
                conn -> nextPosition(conn, scope, scopeId));
    }

    /** Variant for callers that already hold a transaction. */
    public int nextPosition(Connection conn, Scope scope, long scopeId) throws SQLException {
        return (int) Jdbc.queryLong(conn, scope.nextPositionSql(), scopeId);
    }

    /**
     * Resolves an optional caller-supplied position: {@code null} appends.
     */
    int positionOrNext(Connection conn, Scope scope, long scopeId, Integer requested) throws SQLException {
        return requested != null ? requested : nextPosition(conn, scope, scopeId);
    }

    /**
     * Applies every {@code key -> position} entry in one transaction.
     *
     * @throws NotFoundException if a key does not belong to {@code scopeId};
     *                           nothing is written in that case
     */
    public void reorder(Scope scope, long scopeId, Map<Long, Integer> positions) {
        Validator validator = Validator.of(scope.table).id("scopeId", scopeId)
                .check(!positions.isEmpty(), "positions", "must not be empty");
        for (Map.Entry<Long, Integer> entry : positions.entrySet()) {
            validator.id("id", entry.getKey())
                    .required("position", entry.getValue())
                    .min("position", entry.getValue(), 0);
        }
        validator.validate();

        database.write("reorder " + scope.table, Jdbc.context("scopeId", scopeId, "positions", positions), conn -> {
            for (Map.Entry<Long, Integer> entry : positions.entrySet()) {
                int updated = Jdbc.update(conn, scope.reorderSql(), entry.getValue(), entry.getKey(), scopeId);
                if (updated == 0) {
                    throw new NotFoundException(scope.table, entry.getKey());
                }
            }
            return null;
        });
        LOG.debug("[DB] Reordered {} row(s) in {} {}", positions.size(), scope.table, scopeId);
    }
}

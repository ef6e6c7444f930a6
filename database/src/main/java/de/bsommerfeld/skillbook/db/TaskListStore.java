package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.TaskListDraft;
import de.bsommerfeld.skillbook.core.change.TaskListUpdate;
import de.bsommerfeld.skillbook.core.domain.TaskList;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Ordered task lists within a plan. Deleting a list deletes its tasks. */
@Singleton
public class TaskListStore {

    private static final Logger LOG = LoggerFactory.getLogger(TaskListStore.class);

    static final int MAX_NAME = 255;
    static final int MAX_DESCRIPTION = 2000;

    private final Database database;
    private final PositionManager positions;

    @Inject
    public TaskListStore(Database database, PositionManager positions) {
        this.database = database;
        this.positions = positions;
    }

    /**
     * Creates a list under its plan. Without an explicit position the list is
     * appended after its siblings.
     *
     * @throws NotFoundException if the plan does not exist
     */
    public TaskList create(TaskListDraft draft) {
        Validator.of("task list")
                .id("planId", draft.planId())
                .requiredText("name", draft.name(), MAX_NAME)
                .optionalText("description", draft.description(), MAX_DESCRIPTION)
                .min("position", draft.position(), 0)
                .validate();

        TaskList list = database.write("create task list",
                Jdbc.context("planId", draft.planId(), "name", draft.name(), "position", draft.position()), conn -> {
                    Jdbc.requireRow(conn, "implementation_plans", "plan", draft.planId());
                    int position = positions.positionOrNext(conn, PositionManager.Scope.TASK_LISTS,
                            draft.planId(), draft.position());
                    long id = Jdbc.insert(conn, SqlLoader.load("insert-task-list"),
                            draft.planId(), draft.name(), draft.description(), position);
                    return fetch(conn, id);
                });
        LOG.debug("[DB] Created task list {} in plan {} at position {}", list.id(), list.planId(), list.position());
        return list;
    }

    public Optional<TaskList> getById(long id) {
        Validator.of("task list").id("id", id).validate();
        return database.read("get task list", Jdbc.context("id", id),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-task-list-by-id"), Rows::taskList, id));
    }

    /** Lists of a plan in position order. */
    public List<TaskList> listForPlan(long planId) {
        Validator.of("task list").id("planId", planId).validate();
        return database.read("list task lists", Jdbc.context("planId", planId),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-task-lists-for-plan"), Rows::taskList, planId));
    }

    public TaskList update(long id, TaskListUpdate changes) {
        Validator.of("task list")
                .id("id", id)
                .check(!changes.isEmpty(), "changes", "must set at least one field")
                .check(!changes.isSet(TaskListUpdate.NAME) || changes.get(TaskListUpdate.NAME) != null,
                        TaskListUpdate.NAME, "must not be cleared")
                .check(!changes.isSet(TaskListUpdate.POSITION) || changes.get(TaskListUpdate.POSITION) != null,
                        TaskListUpdate.POSITION, "must not be cleared")
                .nonBlankText(TaskListUpdate.NAME, changes.text(TaskListUpdate.NAME), MAX_NAME)
                .optionalText(TaskListUpdate.DESCRIPTION, changes.text(TaskListUpdate.DESCRIPTION), MAX_DESCRIPTION)
                .min(TaskListUpdate.POSITION, (Number) changes.get(TaskListUpdate.POSITION), 0)
                .validate();

        return database.write("update task list", Jdbc.context("id", id, "changes", changes.values()), conn -> {
            int updated = Jdbc.update(conn,
                    Jdbc.updateSql("task_lists", changes, "updated_at = datetime('now')"),
                    Jdbc.updateParams(changes, id));
            if (updated == 0) {
                throw new NotFoundException("task list", id);
            }
            return fetch(conn, id);
        });
    }

    /** Deletes the list and its tasks; returns the list as it was. */
    public TaskList delete(long id) {
        Validator.of("task list").id("id", id).validate();
        TaskList list = database.write("delete task list", Jdbc.context("id", id), conn -> {
            TaskList existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-task-list"), id);
            return existing;
        });
        LOG.debug("[DB] Deleted task list {} from plan {}", id, list.planId());
        return list;
    }

    /**
     * Moves lists of {@code planId} to the given positions in one transaction.
     *
     * @throws NotFoundException if an id is not a list of that plan
     */
    public void reorder(long planId, Map<Long, Integer> listPositions) {
        positions.reorder(PositionManager.Scope.TASK_LISTS, planId, listPositions);
    }

    private static TaskList fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-task-list-by-id"), Rows::taskList, id)
                .orElseThrow(() -> new NotFoundException("task list", id));
    }
}

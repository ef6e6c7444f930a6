package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.TaskDraft;
import de.bsommerfeld.skillbook.core.change.TaskUpdate;
import de.bsommerfeld.skillbook.core.domain.PlanTask;
import de.bsommerfeld.skillbook.core.domain.Task;
import de.bsommerfeld.skillbook.core.domain.TaskSummary;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Ordered tasks within a task list. */
@Singleton
public class TaskStore {

    private static final Logger LOG = LoggerFactory.getLogger(TaskStore.class);

    static final int MAX_NAME = 500;
    static final int MAX_DESCRIPTION = 2000;
    static final int MAX_ASSIGNEE = 255;

    private final Database database;
    private final PositionManager positions;

    @Inject
    public TaskStore(Database database, PositionManager positions) {
        this.database = database;
        this.positions = positions;
    }

    // =====================================================================
    // Task Operations
    // =====================================================================

    /**
     * @throws NotFoundException if the list does not exist
     */
    public Task create(TaskDraft draft) {
        Validator.of("task")
                .id("listId", draft.listId())
                .requiredText("name", draft.name(), MAX_NAME)
                .optionalText("description", draft.description(), MAX_DESCRIPTION)
                .optionalText("assignedTo", draft.assignedTo(), MAX_ASSIGNEE)
                .min("position", draft.position(), 0)
                .validate();

        Task task = database.write("create task",
                Jdbc.context("listId", draft.listId(), "name", draft.name(), "position", draft.position()), conn -> {
                    Jdbc.requireRow(conn, "task_lists", "task list", draft.listId());
                    int position = positions.positionOrNext(conn, PositionManager.Scope.TASKS,
                            draft.listId(), draft.position());
                    long id = Jdbc.insert(conn, SqlLoader.load("insert-task"),
                            draft.listId(), draft.name(), draft.description(), position, draft.assignedTo());
                    return fetch(conn, id);
                });
        LOG.debug("[DB] Created task {} in list {} at position {}", task.id(), task.listId(), task.position());
        return task;
    }

    public Optional<Task> getById(long id) {
        Validator.of("task").id("id", id).validate();
        return database.read("get task", Jdbc.context("id", id),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-task-by-id"), Rows::task, id));
    }

    public List<Task> listForList(long listId) {
        Validator.of("task").id("listId", listId).validate();
        return database.read("list tasks", Jdbc.context("listId", listId),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-tasks-for-list"), Rows::task, listId));
    }

    /** Every task of a plan, ordered by list position, then task position. */
    public List<PlanTask> listForPlan(long planId) {
        Validator.of("task").id("planId", planId).validate();
        return database.read("list tasks for plan", Jdbc.context("planId", planId),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-tasks-for-plan"), Rows::planTask, planId));
    }

    public Task update(long id, TaskUpdate changes) {
        Validator.of("task")
                .id("id", id)
                .check(!changes.isEmpty(), "changes", "must set at least one field")
                .check(!changes.isSet(TaskUpdate.NAME) || changes.get(TaskUpdate.NAME) != null,
                        TaskUpdate.NAME, "must not be cleared")
                .check(!changes.isSet(TaskUpdate.POSITION) || changes.get(TaskUpdate.POSITION) != null,
                        TaskUpdate.POSITION, "must not be cleared")
                .nonBlankText(TaskUpdate.NAME, changes.text(TaskUpdate.NAME), MAX_NAME)
                .optionalText(TaskUpdate.DESCRIPTION, changes.text(TaskUpdate.DESCRIPTION), MAX_DESCRIPTION)
                .optionalText(TaskUpdate.ASSIGNED_TO, changes.text(TaskUpdate.ASSIGNED_TO), MAX_ASSIGNEE)
                .min(TaskUpdate.POSITION, (Number) changes.get(TaskUpdate.POSITION), 0)
                .validate();

        return database.write("update task", Jdbc.context("id", id, "changes", changes.values()), conn -> {
            int updated = Jdbc.update(conn,
                    Jdbc.updateSql("tasks", changes, "updated_at = datetime('now')"),
                    Jdbc.updateParams(changes, id));
            if (updated == 0) {
                throw new NotFoundException("task", id);
            }
            return fetch(conn, id);
        });
    }

    public Task delete(long id) {
        Validator.of("task").id("id", id).validate();
        Task task = database.write("delete task", Jdbc.context("id", id), conn -> {
            Task existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-task"), id);
            return existing;
        });
        LOG.debug("[DB] Deleted task {} from list {}", id, task.listId());
        return task;
    }

    /** Marks the task done and stamps {@code completed_at}. */
    public Task complete(long id) {
        return setCompletion(id, "complete task", "complete-task");
    }

    /** Clears the completed flag and {@code completed_at}. */
    public Task uncomplete(long id) {
        return setCompletion(id, "uncomplete task", "uncomplete-task");
    }

    private Task setCompletion(long id, String operation, String sql) {
        Validator.of("task").id("id", id).validate();
        return database.write(operation, Jdbc.context("id", id), conn -> {
            if (Jdbc.update(conn, SqlLoader.load(sql), id) == 0) {
                throw new NotFoundException("task", id);
            }
            return fetch(conn, id);
        });
    }

    /**
     * Moves tasks of {@code listId} to the given positions in one transaction.
     *
     * @throws NotFoundException if an id is not a task of that list
     */
    public void reorder(long listId, Map<Long, Integer> taskPositions) {
        positions.reorder(PositionManager.Scope.TASKS, listId, taskPositions);
    }

    // =====================================================================
    // Aggregates
    // =====================================================================

    /** Task counts across all lists of a plan; all zero for an empty or unknown plan. */
    public TaskSummary summaryForPlan(long planId) {
        Validator.of("task").id("planId", planId).validate();
        return database.read("summarize tasks", Jdbc.context("planId", planId),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-task-summary-for-plan"), rs -> {
                    int total = rs.getInt("total");
                    int completed = rs.getInt("completed");
                    return new TaskSummary(total, completed, total - completed);
                }, planId).orElse(TaskSummary.empty()));
    }

    private static Task fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-task-by-id"), Rows::task, id)
                .orElseThrow(() -> new NotFoundException("task", id));
    }
}

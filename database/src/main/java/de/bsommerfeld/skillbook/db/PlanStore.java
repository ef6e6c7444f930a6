package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.PlanDraft;
import de.bsommerfeld.skillbook.core.change.PlanFilter;
import de.bsommerfeld.skillbook.core.change.PlanUpdate;
import de.bsommerfeld.skillbook.core.domain.Plan;
import de.bsommerfeld.skillbook.core.domain.PlanStatus;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.error.ValidationException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Implementation plans. Deleting a plan cascades to its task lists, their
 * tasks and its skill associations ({@link PlanSkillStore}).
 */
@Singleton
public class PlanStore {

    private static final Logger LOG = LoggerFactory.getLogger(PlanStore.class);

    static final int MAX_NAME = 255;
    static final int MAX_TITLE = 500;
    static final int MAX_SUMMARY = 1000;
    static final int MAX_DESCRIPTION = 2000;
    static final int MAX_PERSON = 255;

    private final Database database;

    @Inject
    public PlanStore(Database database) {
        this.database = database;
    }

    public Plan create(PlanDraft draft) {
        Validator.of("plan")
                .requiredText("name", draft.name(), MAX_NAME)
                .optionalText("title", draft.title(), MAX_TITLE)
                .optionalText("summary", draft.summary(), MAX_SUMMARY)
                .optionalText("description", draft.description(), MAX_DESCRIPTION)
                .optionalText("createdBy", draft.createdBy(), MAX_PERSON)
                .optionalText("assignedTo", draft.assignedTo(), MAX_PERSON)
                .validate();

        PlanStatus status = draft.status() != null ? draft.status() : PlanStatus.DRAFT;
        String content = draft.content() != null ? draft.content() : "";

        Plan plan = database.write("create plan", Jdbc.context("name", draft.name(), "status", status), conn -> {
            long id = Jdbc.insert(conn, SqlLoader.load("insert-plan"),
                    draft.name(), draft.title(), draft.summary(), draft.description(), content, status,
                    draft.createdBy(), draft.assignedTo());
            return fetch(conn, id);
        });
        LOG.debug("[DB] Created plan {} ({})", plan.id(), plan.name());
        return plan;
    }

    public Optional<Plan> getById(long id) {
        Validator.of("plan").id("id", id).validate();
        return database.read("get plan", Jdbc.context("id", id),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-plan-by-id"), Rows::plan, id));
    }

    public Optional<Plan> getByName(String name) {
        Validator.of("plan").requiredText("name", name, MAX_NAME).validate();
        return database.read("get plan by name", Jdbc.context("name", name),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-plan-by-name"), Rows::plan, name));
    }

    public List<Plan> list(PlanFilter filter) {
        return list(filter, Paging.DEFAULT_LIMIT, 0);
    }

    /** Newest first. */
    public List<Plan> list(PlanFilter filter, int limit, int offset) {
        Paging.check(Validator.of("plan list"), limit, offset)
                .optionalText("createdBy", filter.createdBy(), MAX_PERSON)
                .optionalText("assignedTo", filter.assignedTo(), MAX_PERSON)
                .validate();
        return database.read("list plans",
                Jdbc.context("status", filter.status(), "createdBy", filter.createdBy(),
                        "assignedTo", filter.assignedTo(), "limit", limit, "offset", offset),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-plans"), Rows::plan,
                        filter.status(), filter.status(),
                        filter.createdBy(), filter.createdBy(),
                        filter.assignedTo(), filter.assignedTo(),
                        limit, offset));
    }

    /**
     * Applies the set columns in one statement and stamps {@code updated_at}.
     *
     * @throws ValidationException if nothing is set or a bound is violated
     * @throws NotFoundException   if the plan does not exist
     */
    public Plan update(long id, PlanUpdate changes) {
        Validator.of("plan")
                .id("id", id)
                .check(!changes.isEmpty(), "changes", "must set at least one field")
                .check(!changes.isSet(PlanUpdate.NAME) || changes.get(PlanUpdate.NAME) != null,
                        PlanUpdate.NAME, "must not be cleared")
                .check(!changes.isSet(PlanUpdate.STATUS) || changes.get(PlanUpdate.STATUS) != null,
                        PlanUpdate.STATUS, "must not be cleared")
                .check(!changes.isSet(PlanUpdate.CONTENT) || changes.get(PlanUpdate.CONTENT) != null,
                        PlanUpdate.CONTENT, "must not be cleared")
                .nonBlankText(PlanUpdate.NAME, changes.text(PlanUpdate.NAME), MAX_NAME)
                .optionalText(PlanUpdate.TITLE, changes.text(PlanUpdate.TITLE), MAX_TITLE)
                .optionalText(PlanUpdate.SUMMARY, changes.text(PlanUpdate.SUMMARY), MAX_SUMMARY)
                .optionalText(PlanUpdate.DESCRIPTION, changes.text(PlanUpdate.DESCRIPTION), MAX_DESCRIPTION)
                .optionalText(PlanUpdate.ASSIGNED_TO, changes.text(PlanUpdate.ASSIGNED_TO), MAX_PERSON)
                .validate();

        Plan plan = database.write("update plan", Jdbc.context("id", id, "changes", changes.values()), conn -> {
            int updated = Jdbc.update(conn,
                    Jdbc.updateSql("implementation_plans", changes, "updated_at = datetime('now')"),
                    Jdbc.updateParams(changes, id));
            if (updated == 0) {
                throw new NotFoundException("plan", id);
            }
            return fetch(conn, id);
        });
        LOG.debug("[DB] Updated plan {} {}", id, changes.values().keySet());
        return plan;
    }

    /** Deletes the plan and everything it owns; returns the plan as it was. */
    public Plan delete(long id) {
        Validator.of("plan").id("id", id).validate();
        Plan plan = database.write("delete plan", Jdbc.context("id", id), conn -> {
            Plan existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-plan"), id);
            return existing;
        });
        LOG.debug("[DB] Deleted plan {} ({})", id, plan.name());
        return plan;
    }

    /** Sets status {@code completed} and stamps {@code completed_at}. */
    public Plan complete(long id) {
        return transition(id, "complete plan", "complete-plan");
    }

    /** Sets status {@code archived}; {@code completed_at} keeps its value. */
    public Plan archive(long id) {
        return transition(id, "archive plan", "archive-plan");
    }

    private Plan transition(long id, String operation, String sql) {
        Validator.of("plan").id("id", id).validate();
        Plan plan = database.write(operation, Jdbc.context("id", id), conn -> {
            if (Jdbc.update(conn, SqlLoader.load(sql), id) == 0) {
                throw new NotFoundException("plan", id);
            }
            return fetch(conn, id);
        });
        LOG.debug("[DB] Plan {} is now {}", id, plan.status());
        return plan;
    }

    private static Plan fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-plan-by-id"), Rows::plan, id)
                .orElseThrow(() -> new NotFoundException("plan", id));
    }
}

package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.SkillDraft;
import de.bsommerfeld.skillbook.core.change.SkillUpdate;
import de.bsommerfeld.skillbook.core.domain.CatalogStats;
import de.bsommerfeld.skillbook.core.domain.CategoryCount;
import de.bsommerfeld.skillbook.core.domain.Skill;
import de.bsommerfeld.skillbook.core.domain.SyncOutcome;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Skill catalog, keyed by file path. {@link #sync} is the entry point for
 * file-system imports: it compares content hashes and only rewrites rows
 * whose source changed.
 */
@Singleton
public class SkillStore {

    private static final Logger LOG = LoggerFactory.getLogger(SkillStore.class);

    static final int MAX_PATH = 1024;
    static final int MAX_CATEGORY = 255;
    static final int MAX_NAME = 255;
    static final int MAX_TITLE = 500;
    static final int MAX_DESCRIPTION = 2000;
    static final int MAX_HASH = 128;

    private final Database database;

    @Inject
    public SkillStore(Database database) {
        this.database = database;
    }

    public Skill create(SkillDraft draft) {
        validate(draft);
        Skill skill = database.write("create skill", Jdbc.context("path", draft.path(), "name", draft.name()),
                conn -> insert(conn, draft));
        LOG.debug("[DB] Created skill {} ({})", skill.id(), skill.path());
        return skill;
    }

    public Optional<Skill> getById(long id) {
        Validator.of("skill").id("id", id).validate();
        return database.read("get skill", Jdbc.context("id", id),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-skill-by-id"), Rows::skill, id));
    }

    public Optional<Skill> getByPath(String path) {
        Validator.of("skill").requiredText("path", path, MAX_PATH).validate();
        return database.read("get skill by path", Jdbc.context("path", path),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-skill-by-path"), Rows::skill, path));
    }

    /**
     * Looks a skill up by name. Names are only unique within a category; with
     * {@code category} {@code null} the first match by category wins.
     */
    public Optional<Skill> getByName(String name, String category) {
        Validator.of("skill")
                .requiredText("name", name, MAX_NAME)
                .optionalText("category", category, MAX_CATEGORY)
                .validate();
        return database.read("get skill by name", Jdbc.context("name", name, "category", category),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-skill-by-name"), Rows::skill,
                        name, category, category));
    }

    public List<Skill> list(String category) {
        return list(category, Paging.DEFAULT_LIMIT, 0);
    }

    /** Ordered by category, then name; {@code category} {@code null} lists all. */
    public List<Skill> list(String category, int limit, int offset) {
        Paging.check(Validator.of("skill list"), limit, offset)
                .optionalText("category", category, MAX_CATEGORY)
                .validate();
        return database.read("list skills",
                Jdbc.context("category", category, "limit", limit, "offset", offset),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-skills"), Rows::skill,
                        category, category, limit, offset));
    }

    public Skill update(long id, SkillUpdate changes) {
        Validator validator = Validator.of("skill")
                .id("id", id)
                .check(!changes.isEmpty(), "changes", "must set at least one field");
        for (String required : List.of(SkillUpdate.CATEGORY, SkillUpdate.NAME, SkillUpdate.CONTENT,
                SkillUpdate.FILE_HASH, SkillUpdate.SIZE_BYTES)) {
            validator.check(!changes.isSet(required) || changes.get(required) != null, required, "must not be cleared");
        }
        validator
                .nonBlankText(SkillUpdate.CATEGORY, changes.text(SkillUpdate.CATEGORY), MAX_CATEGORY)
                .nonBlankText(SkillUpdate.NAME, changes.text(SkillUpdate.NAME), MAX_NAME)
                .optionalText(SkillUpdate.TITLE, changes.text(SkillUpdate.TITLE), MAX_TITLE)
                .optionalText(SkillUpdate.DESCRIPTION, changes.text(SkillUpdate.DESCRIPTION), MAX_DESCRIPTION)
                .nonBlankText(SkillUpdate.FILE_HASH, changes.text(SkillUpdate.FILE_HASH), MAX_HASH)
                .min(SkillUpdate.SIZE_BYTES, (Number) changes.get(SkillUpdate.SIZE_BYTES), 0)
                .min(SkillUpdate.TOKEN_COUNT, (Number) changes.get(SkillUpdate.TOKEN_COUNT), 0)
                .validate();

        return database.write("update skill", Jdbc.context("id", id, "columns", changes.values().keySet()),
                conn -> update(conn, id, changes));
    }

    /** Deletes the skill and its prompt, fragment and plan associations. */
    public Skill delete(long id) {
        Validator.of("skill").id("id", id).validate();
        Skill skill = database.write("delete skill", Jdbc.context("id", id), conn -> {
            Skill existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-skill"), id);
            return existing;
        });
        LOG.debug("[DB] Deleted skill {} ({})", id, skill.path());
        return skill;
    }

    /**
     * Inserts the skill if its path is unknown, rewrites it if the stored
     * hash differs, and leaves it alone otherwise. Runs in one transaction.
     */
    public SyncOutcome<Skill> sync(SkillDraft draft) {
        validate(draft);
        SyncOutcome<Skill> outcome = database.write("sync skill",
                Jdbc.context("path", draft.path(), "fileHash", draft.fileHash()), conn -> {
                    Optional<Skill> existing = Jdbc.queryOne(conn, SqlLoader.load("select-skill-by-path"),
                            Rows::skill, draft.path());
                    if (existing.isEmpty()) {
                        return new SyncOutcome<>(SyncOutcome.Action.INSERTED, insert(conn, draft));
                    }
                    Skill current = existing.get();
                    if (current.fileHash().equals(draft.fileHash())) {
                        return new SyncOutcome<>(SyncOutcome.Action.UNCHANGED, current);
                    }
                    return new SyncOutcome<>(SyncOutcome.Action.UPDATED,
                            update(conn, current.id(), SkillUpdate.replacing(draft)));
                });
        LOG.debug("[DB] Synced skill {}: {}", draft.path(), outcome.action());
        return outcome;
    }

    // =====================================================================
    // Catalog Aggregates
    // =====================================================================

    public List<CategoryCount> categories() {
        return database.read("list skill categories", Jdbc.context(),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-skill-categories"),
                        rs -> new CategoryCount(rs.getString("category"), rs.getInt("count"))));
    }

    /** Counts and totals across skills and prompts, read in one transaction. */
    public CatalogStats stats() {
        return database.snapshot("read catalog stats", Jdbc.context(), conn -> {
            List<CategoryCount> categories = Jdbc.queryList(conn, SqlLoader.load("select-skill-categories"),
                    rs -> new CategoryCount(rs.getString("category"), rs.getInt("count")));
            return Jdbc.queryOne(conn, SqlLoader.load("select-catalog-totals"), rs -> new CatalogStats(
                    rs.getInt("skills"),
                    rs.getInt("prompts"),
                    rs.getLong("total_size_bytes"),
                    rs.getLong("total_tokens"),
                    categories)).orElseThrow();
        });
    }

    private static void validate(SkillDraft draft) {
        Validator.of("skill")
                .requiredText("path", draft.path(), MAX_PATH)
                .requiredText("category", draft.category(), MAX_CATEGORY)
                .requiredText("name", draft.name(), MAX_NAME)
                .optionalText("title", draft.title(), MAX_TITLE)
                .optionalText("description", draft.description(), MAX_DESCRIPTION)
                .required("content", draft.content())
                .requiredText("fileHash", draft.fileHash(), MAX_HASH)
                .min("sizeBytes", draft.sizeBytes(), 0)
                .min("tokenCount", draft.tokenCount(), 0)
                .validate();
    }

    private static Skill insert(Connection conn, SkillDraft draft) throws SQLException {
        long id = Jdbc.insert(conn, SqlLoader.load("insert-skill"),
                draft.path(), draft.category(), draft.name(), draft.title(), draft.description(),
                draft.content(), draft.fileHash(), draft.sizeBytes(), draft.tokenCount());
        return fetch(conn, id);
    }

    private static Skill update(Connection conn, long id, SkillUpdate changes) throws SQLException {
        int updated = Jdbc.update(conn,
                Jdbc.updateSql("skills", changes, "updated_at = datetime('now')"),
                Jdbc.updateParams(changes, id));
        if (updated == 0) {
            throw new NotFoundException("skill", id);
        }
        return fetch(conn, id);
    }

    private static Skill fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-skill-by-id"), Rows::skill, id)
                .orElseThrow(() -> new NotFoundException("skill", id));
    }
}

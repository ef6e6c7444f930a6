package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.PromptDraft;
import de.bsommerfeld.skillbook.core.change.PromptUpdate;
import de.bsommerfeld.skillbook.core.domain.PositionedSkill;
import de.bsommerfeld.skillbook.core.domain.Prompt;
import de.bsommerfeld.skillbook.core.domain.SkillLink;
import de.bsommerfeld.skillbook.core.domain.SyncOutcome;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prompt documents, keyed by name, and their ordered skill lists.
 */
@Singleton
public class PromptStore {

    private static final Logger LOG = LoggerFactory.getLogger(PromptStore.class);

    static final int MAX_PATH = 1024;
    static final int MAX_NAME = 255;
    static final int MAX_TITLE = 500;
    static final int MAX_AUTHOR = 255;
    static final int MAX_DESCRIPTION = 2000;
    static final int MAX_HASH = 128;

    private final Database database;
    private final PositionManager positions;
    private final SkillAssociations skills;

    @Inject
    public PromptStore(Database database, PositionManager positions) {
        this.database = database;
        this.positions = positions;
        this.skills = new SkillAssociations(database, positions, PositionManager.Scope.PROMPT_SKILLS, "prompt",
                "prompts");
    }

    // =====================================================================
    // Prompt Operations
    // =====================================================================

    public Prompt create(PromptDraft draft) {
        validate(draft);
        Prompt prompt = database.write("create prompt", Jdbc.context("name", draft.name(), "path", draft.path()),
                conn -> insert(conn, draft));
        LOG.debug("[DB] Created prompt {} ({})", prompt.id(), prompt.name());
        return prompt;
    }

    public Optional<Prompt> getById(long id) {
        Validator.of("prompt").id("id", id).validate();
        return database.read("get prompt", Jdbc.context("id", id),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-prompt-by-id"), Rows::prompt, id));
    }

    public Optional<Prompt> getByName(String name) {
        Validator.of("prompt").requiredText("name", name, MAX_NAME).validate();
        return database.read("get prompt by name", Jdbc.context("name", name),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-prompt-by-name"), Rows::prompt, name));
    }

    public List<Prompt> list() {
        return list(Paging.DEFAULT_LIMIT, 0);
    }

    /** Ordered by name. */
    public List<Prompt> list(int limit, int offset) {
        Paging.check(Validator.of("prompt list"), limit, offset).validate();
        return database.read("list prompts", Jdbc.context("limit", limit, "offset", offset),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-prompts"), Rows::prompt, limit, offset));
    }

    public Prompt update(long id, PromptUpdate changes) {
        Validator validator = Validator.of("prompt")
                .id("id", id)
                .check(!changes.isEmpty(), "changes", "must set at least one field");
        for (String required : List.of(PromptUpdate.PATH, PromptUpdate.NAME, PromptUpdate.CONTENT,
                PromptUpdate.FILE_HASH, PromptUpdate.SIZE_BYTES)) {
            validator.check(!changes.isSet(required) || changes.get(required) != null, required, "must not be cleared");
        }
        validator
                .nonBlankText(PromptUpdate.PATH, changes.text(PromptUpdate.PATH), MAX_PATH)
                .nonBlankText(PromptUpdate.NAME, changes.text(PromptUpdate.NAME), MAX_NAME)
                .optionalText(PromptUpdate.TITLE, changes.text(PromptUpdate.TITLE), MAX_TITLE)
                .optionalText(PromptUpdate.AUTHOR, changes.text(PromptUpdate.AUTHOR), MAX_AUTHOR)
                .optionalText(PromptUpdate.DESCRIPTION, changes.text(PromptUpdate.DESCRIPTION), MAX_DESCRIPTION)
                .nonBlankText(PromptUpdate.FILE_HASH, changes.text(PromptUpdate.FILE_HASH), MAX_HASH)
                .min(PromptUpdate.SIZE_BYTES, (Number) changes.get(PromptUpdate.SIZE_BYTES), 0)
                .min(PromptUpdate.TOKEN_COUNT, (Number) changes.get(PromptUpdate.TOKEN_COUNT), 0)
                .validate();

        return database.write("update prompt", Jdbc.context("id", id, "columns", changes.values().keySet()),
                conn -> update(conn, id, changes));
    }

    /** Deletes the prompt with its skill associations and references. */
    public Prompt delete(long id) {
        Validator.of("prompt").id("id", id).validate();
        Prompt prompt = database.write("delete prompt", Jdbc.context("id", id), conn -> {
            Prompt existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-prompt"), id);
            return existing;
        });
        LOG.debug("[DB] Deleted prompt {} ({})", id, prompt.name());
        return prompt;
    }

    /**
     * Inserts the prompt if its name is unknown, rewrites it if the stored
     * hash differs, and leaves it alone otherwise.
     */
    public SyncOutcome<Prompt> sync(PromptDraft draft) {
        validate(draft);
        SyncOutcome<Prompt> outcome = database.write("sync prompt",
                Jdbc.context("name", draft.name(), "fileHash", draft.fileHash()), conn -> {
                    Optional<Prompt> existing = Jdbc.queryOne(conn, SqlLoader.load("select-prompt-by-name"),
                            Rows::prompt, draft.name());
                    if (existing.isEmpty()) {
                        return new SyncOutcome<>(SyncOutcome.Action.INSERTED, insert(conn, draft));
                    }
                    Prompt current = existing.get();
                    if (current.fileHash().equals(draft.fileHash())) {
                        return new SyncOutcome<>(SyncOutcome.Action.UNCHANGED, current);
                    }
                    return new SyncOutcome<>(SyncOutcome.Action.UPDATED,
                            update(conn, current.id(), PromptUpdate.replacing(draft)));
                });
        LOG.debug("[DB] Synced prompt {}: {}", draft.name(), outcome.action());
        return outcome;
    }

    // =====================================================================
    // Prompt Skills
    // =====================================================================

    /**
     * @param position {@code null} appends after the prompt's existing skills
     * @throws NotFoundException if the prompt or the skill does not exist
     */
    public SkillLink associateSkill(long promptId, long skillId, Integer position) {
        return skills.associate(promptId, skillId, position);
    }

    /** Returns 1 if the skill was associated, 0 otherwise. */
    public int dissociateSkill(long promptId, long skillId) {
        return skills.dissociate(promptId, skillId);
    }

    /** Returns the number of associations removed. */
    public int dissociateAllSkills(long promptId) {
        return skills.dissociateAll(promptId);
    }

    public List<PositionedSkill> listSkills(long promptId) {
        return skills.list(promptId);
    }

    public void reorderSkills(long promptId, Map<Long, Integer> skillPositions) {
        positions.reorder(PositionManager.Scope.PROMPT_SKILLS, promptId, skillPositions);
    }

    private static void validate(PromptDraft draft) {
        Validator.of("prompt")
                .requiredText("path", draft.path(), MAX_PATH)
                .requiredText("name", draft.name(), MAX_NAME)
                .optionalText("title", draft.title(), MAX_TITLE)
                .optionalText("author", draft.author(), MAX_AUTHOR)
                .optionalText("description", draft.description(), MAX_DESCRIPTION)
                .required("content", draft.content())
                .requiredText("fileHash", draft.fileHash(), MAX_HASH)
                .min("sizeBytes", draft.sizeBytes(), 0)
                .min("tokenCount", draft.tokenCount(), 0)
                .validate();
    }

    private static Prompt insert(Connection conn, PromptDraft draft) throws SQLException {
        long id = Jdbc.insert(conn, SqlLoader.load("insert-prompt"),
                draft.path(), draft.name(), draft.title(), draft.author(), draft.description(),
                draft.content(), draft.fileHash(), draft.sizeBytes(), draft.tokenCount());
        return fetch(conn, id);
    }

    private static Prompt update(Connection conn, long id, PromptUpdate changes) throws SQLException {
        int updated = Jdbc.update(conn,
                Jdbc.updateSql("prompts", changes, "updated_at = datetime('now')"),
                Jdbc.updateParams(changes, id));
        if (updated == 0) {
            throw new NotFoundException("prompt", id);
        }
        return fetch(conn, id);
    }

    private static Prompt fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-prompt-by-id"), Rows::prompt, id)
                .orElseThrow(() -> new NotFoundException("prompt", id));
    }
}

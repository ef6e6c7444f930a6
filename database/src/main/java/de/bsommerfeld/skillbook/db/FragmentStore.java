package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.change.FragmentDraft;
import de.bsommerfeld.skillbook.core.change.FragmentUpdate;
import de.bsommerfeld.skillbook.core.domain.PositionedSkill;
import de.bsommerfeld.skillbook.core.domain.PromptFragment;
import de.bsommerfeld.skillbook.core.domain.SkillLink;
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
 * Named, reusable groups of skills that prompts can reference.
 */
@Singleton
public class FragmentStore {

    private static final Logger LOG = LoggerFactory.getLogger(FragmentStore.class);

    static final int MAX_NAME = 255;
    static final int MAX_TITLE = 500;
    static final int MAX_DESCRIPTION = 2000;

    private final Database database;
    private final PositionManager positions;
    private final SkillAssociations skills;

    @Inject
    public FragmentStore(Database database, PositionManager positions) {
        this.database = database;
        this.positions = positions;
        this.skills = new SkillAssociations(database, positions, PositionManager.Scope.FRAGMENT_SKILLS, "fragment",
                "prompt_fragments");
    }

    public PromptFragment create(FragmentDraft draft) {
        Validator.of("fragment")
                .requiredText("name", draft.name(), MAX_NAME)
                .requiredText("title", draft.title(), MAX_TITLE)
                .optionalText("description", draft.description(), MAX_DESCRIPTION)
                .validate();
        PromptFragment fragment = database.write("create fragment", Jdbc.context("name", draft.name()), conn -> {
            long id = Jdbc.insert(conn, SqlLoader.load("insert-fragment"),
                    draft.name(), draft.title(), draft.description());
            return fetch(conn, id);
        });
        LOG.debug("[DB] Created fragment {} ({})", fragment.id(), fragment.name());
        return fragment;
    }

    public Optional<PromptFragment> getById(long id) {
        Validator.of("fragment").id("id", id).validate();
        return database.read("get fragment", Jdbc.context("id", id),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-fragment-by-id"), Rows::fragment, id));
    }

    public Optional<PromptFragment> getByName(String name) {
        Validator.of("fragment").requiredText("name", name, MAX_NAME).validate();
        return database.read("get fragment by name", Jdbc.context("name", name),
                conn -> Jdbc.queryOne(conn, SqlLoader.load("select-fragment-by-name"), Rows::fragment, name));
    }

    public List<PromptFragment> list() {
        return list(Paging.DEFAULT_LIMIT, 0);
    }

    public List<PromptFragment> list(int limit, int offset) {
        Paging.check(Validator.of("fragment list"), limit, offset).validate();
        return database.read("list fragments", Jdbc.context("limit", limit, "offset", offset),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-fragments"), Rows::fragment, limit, offset));
    }

    public PromptFragment update(long id, FragmentUpdate changes) {
        Validator.of("fragment")
                .id("id", id)
                .check(!changes.isEmpty(), "changes", "must set at least one field")
                .check(!changes.isSet(FragmentUpdate.NAME) || changes.get(FragmentUpdate.NAME) != null,
                        FragmentUpdate.NAME, "must not be cleared")
                .check(!changes.isSet(FragmentUpdate.TITLE) || changes.get(FragmentUpdate.TITLE) != null,
                        FragmentUpdate.TITLE, "must not be cleared")
                .nonBlankText(FragmentUpdate.NAME, changes.text(FragmentUpdate.NAME), MAX_NAME)
                .nonBlankText(FragmentUpdate.TITLE, changes.text(FragmentUpdate.TITLE), MAX_TITLE)
                .optionalText(FragmentUpdate.DESCRIPTION, changes.text(FragmentUpdate.DESCRIPTION), MAX_DESCRIPTION)
                .validate();

        return database.write("update fragment", Jdbc.context("id", id, "changes", changes.values()), conn -> {
            int updated = Jdbc.update(conn,
                    Jdbc.updateSql("prompt_fragments", changes, "updated_at = datetime('now')"),
                    Jdbc.updateParams(changes, id));
            if (updated == 0) {
                throw new NotFoundException("fragment", id);
            }
            return fetch(conn, id);
        });
    }

    /** Deletes the fragment, its skill list and every reference to it. */
    public PromptFragment delete(long id) {
        Validator.of("fragment").id("id", id).validate();
        PromptFragment fragment = database.write("delete fragment", Jdbc.context("id", id), conn -> {
            PromptFragment existing = fetch(conn, id);
            Jdbc.update(conn, SqlLoader.load("delete-fragment"), id);
            return existing;
        });
        LOG.debug("[DB] Deleted fragment {} ({})", id, fragment.name());
        return fragment;
    }

    // =====================================================================
    // Fragment Skills
    // =====================================================================

    public SkillLink addSkill(long fragmentId, long skillId, Integer position) {
        return skills.associate(fragmentId, skillId, position);
    }

    public int removeSkill(long fragmentId, long skillId) {
        return skills.dissociate(fragmentId, skillId);
    }

    public List<PositionedSkill> listSkills(long fragmentId) {
        return skills.list(fragmentId);
    }

    public void reorderSkills(long fragmentId, Map<Long, Integer> skillPositions) {
        positions.reorder(PositionManager.Scope.FRAGMENT_SKILLS, fragmentId, skillPositions);
    }

    /** Fragments that include the skill, by name. */
    public List<PromptFragment> fragmentsContainingSkill(long skillId) {
        Validator.of("fragment").id("skillId", skillId).validate();
        return database.read("list fragments for skill", Jdbc.context("skillId", skillId),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-fragments-for-skill"), Rows::fragment, skillId));
    }

    private static PromptFragment fetch(Connection conn, long id) throws SQLException {
        return Jdbc.queryOne(conn, SqlLoader.load("select-fragment-by-id"), Rows::fragment, id)
                .orElseThrow(() -> new NotFoundException("fragment", id));
    }
}

package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.domain.PositionedSkill;
import de.bsommerfeld.skillbook.core.domain.SkillLink;
import de.bsommerfeld.skillbook.core.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered skill junction shared by prompts, fragments and plans. Each owner
 * kind has its own table and its own set of {@code *-<owner>-skill*.sql}
 * statements; the behavior is identical.
 */
final class SkillAssociations {

    private static final Logger LOG = LoggerFactory.getLogger(SkillAssociations.class);

    private final Database database;
    private final PositionManager positions;
    private final PositionManager.Scope scope;
    private final String owner;
    private final String ownerTable;

    /**
     * @param owner      entity name used in SQL file names and errors, e.g.
     *                   {@code prompt}
     * @param ownerTable table the owner id must exist in
     */
    SkillAssociations(Database database, PositionManager positions, PositionManager.Scope scope, String owner,
            String ownerTable) {
        this.database = database;
        this.positions = positions;
        this.scope = scope;
        this.owner = owner;
        this.ownerTable = ownerTable;
    }

    SkillLink associate(long ownerId, long skillId, Integer position) {
        Validator.of(owner + " skill")
                .id(owner + "Id", ownerId)
                .id("skillId", skillId)
                .min("position", position, 0)
                .validate();

        SkillLink link = database.write("associate skill with " + owner,
                Jdbc.context(owner + "Id", ownerId, "skillId", skillId, "position", position), conn -> {
                    Jdbc.requireRow(conn, ownerTable, owner, ownerId);
                    Jdbc.requireRow(conn, "skills", "skill", skillId);
                    int pos = positions.positionOrNext(conn, scope, ownerId, position);
                    Jdbc.update(conn, SqlLoader.load("insert-" + owner + "-skill"), ownerId, skillId, pos);
                    return Jdbc.queryOne(conn, SqlLoader.load("select-" + owner + "-skill-link"), Rows::skillLink,
                            ownerId, skillId).orElseThrow();
                });
        LOG.debug("[DB] Associated skill {} with {} {} at position {}", skillId, owner, ownerId, link.position());
        return link;
    }

    /** Returns the number of rows removed, 0 if the pair was not associated. */
    int dissociate(long ownerId, long skillId) {
        Validator.of(owner + " skill").id(owner + "Id", ownerId).id("skillId", skillId).validate();
        return database.write("dissociate skill from " + owner,
                Jdbc.context(owner + "Id", ownerId, "skillId", skillId),
                conn -> Jdbc.update(conn, SqlLoader.load("delete-" + owner + "-skill"), ownerId, skillId));
    }

    int dissociateAll(long ownerId) {
        Validator.of(owner + " skill").id(owner + "Id", ownerId).validate();
        return database.write("dissociate all skills from " + owner, Jdbc.context(owner + "Id", ownerId),
                conn -> Jdbc.update(conn, SqlLoader.load("delete-all-" + owner + "-skills"), ownerId));
    }

    List<PositionedSkill> list(long ownerId) {
        Validator.of(owner + " skill").id(owner + "Id", ownerId).validate();
        return database.read("list skills for " + owner, Jdbc.context(owner + "Id", ownerId),
                conn -> Jdbc.queryList(conn, SqlLoader.load("select-" + owner + "-skills"), Rows::positionedSkill,
                        ownerId));
    }
}

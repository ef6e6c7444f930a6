package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.core.domain.PositionedSkill;
import de.bsommerfeld.skillbook.core.domain.SkillLink;

import java.util.List;
import java.util.Map;

/** Skills attached to an implementation plan, in position order. */
@Singleton
public class PlanSkillStore {

    private final SkillAssociations associations;
    private final PositionManager positions;

    @Inject
    public PlanSkillStore(Database database, PositionManager positions) {
        this.associations = new SkillAssociations(database, positions, PositionManager.Scope.PLAN_SKILLS, "plan",
                "implementation_plans");
        this.positions = positions;
    }

    /**
     * @param position {@code null} appends after the plan's existing skills
     * @throws de.bsommerfeld.skillbook.core.error.NotFoundException if the
     *         plan or the skill does not exist
     */
    public SkillLink associate(long planId, long skillId, Integer position) {
        return associations.associate(planId, skillId, position);
    }

    /** Returns 1 if the skill was attached, 0 otherwise. */
    public int dissociate(long planId, long skillId) {
        return associations.dissociate(planId, skillId);
    }

    public List<PositionedSkill> listSkills(long planId) {
        return associations.list(planId);
    }

    public void reorder(long planId, Map<Long, Integer> skillPositions) {
        positions.reorder(PositionManager.Scope.PLAN_SKILLS, planId, skillPositions);
    }
}

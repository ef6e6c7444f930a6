package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.change.PlanDraft;
import de.bsommerfeld.skillbook.core.change.TaskListDraft;
import de.bsommerfeld.skillbook.core.domain.Plan;
import de.bsommerfeld.skillbook.core.domain.TaskList;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PositionManagerTest {

    @TempDir
    Path tempDir;

    private PositionManager positions;
    private PlanStore plans;
    private TaskListStore lists;

    @BeforeEach
    void setUp() {
        Database db = TestDatabases.migrated(tempDir);
        positions = new PositionManager(db);
        plans = new PlanStore(db);
        lists = new TaskListStore(db, positions);
    }

    @Test
    void nextPosition_shouldStartAtZero() {
        Plan plan = plans.create(PlanDraft.named("p"));

        assertEquals(0, positions.nextPosition(PositionManager.Scope.TASK_LISTS, plan.id()));
    }

    @Test
    void nextPosition_shouldFollowMaximumNotCount() {
        Plan plan = plans.create(PlanDraft.named("p"));
        lists.create(new TaskListDraft(plan.id(), "a", null, 4));
        lists.create(new TaskListDraft(plan.id(), "b", null, 1));

        assertEquals(5, positions.nextPosition(PositionManager.Scope.TASK_LISTS, plan.id()));
    }

    @Test
    void nextPosition_shouldIgnoreOtherScopes() {
        Plan first = plans.create(PlanDraft.named("first"));
        Plan second = plans.create(PlanDraft.named("second"));
        lists.create(new TaskListDraft(first.id(), "a", null, 9));

        assertEquals(0, positions.nextPosition(PositionManager.Scope.TASK_LISTS, second.id()));
    }

    @Test
    void reorder_shouldAllowDuplicatePositions() {
        Plan plan = plans.create(PlanDraft.named("p"));
        TaskList a = lists.create(new TaskListDraft(plan.id(), "a", null, null));
        TaskList b = lists.create(new TaskListDraft(plan.id(), "b", null, null));

        positions.reorder(PositionManager.Scope.TASK_LISTS, plan.id(), Map.of(a.id(), 3, b.id(), 3));

        assertEquals(List.of(3, 3), lists.listForPlan(plan.id()).stream().map(TaskList::position).toList());
    }

    @Test
    void reorder_shouldRollBackWhenIdBelongsToAnotherScope() {
        Plan first = plans.create(PlanDraft.named("first"));
        Plan second = plans.create(PlanDraft.named("second"));
        TaskList mine = lists.create(new TaskListDraft(first.id(), "mine", null, null));
        TaskList foreign = lists.create(new TaskListDraft(second.id(), "foreign", null, null));

        assertThrows(NotFoundException.class, () -> positions.reorder(PositionManager.Scope.TASK_LISTS,
                first.id(), Map.of(mine.id(), 8, foreign.id(), 9)));

        assertEquals(0, lists.getById(mine.id()).orElseThrow().position());
        assertEquals(0, lists.getById(foreign.id()).orElseThrow().position());
    }

    @Test
    void reorder_shouldRejectEmptyAndNegativeInput() {
        assertThrows(ValidationException.class,
                () -> positions.reorder(PositionManager.Scope.TASKS, 1, Map.of()));
        ValidationException e = assertThrows(ValidationException.class,
                () -> positions.reorder(PositionManager.Scope.TASKS, 1, Map.of(1L, -2)));
        assertTrue(e.hasErrorFor("position"));
    }
}

package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.change.PlanDraft;
import de.bsommerfeld.skillbook.core.change.TaskDraft;
import de.bsommerfeld.skillbook.core.change.TaskListDraft;
import de.bsommerfeld.skillbook.core.change.TaskUpdate;
import de.bsommerfeld.skillbook.core.domain.Plan;
import de.bsommerfeld.skillbook.core.domain.PlanTask;
import de.bsommerfeld.skillbook.core.domain.Task;
import de.bsommerfeld.skillbook.core.domain.TaskList;
import de.bsommerfeld.skillbook.core.domain.TaskSummary;
import de.bsommerfeld.skillbook.core.error.NotFoundException;
import de.bsommerfeld.skillbook.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskStoreTest {

    @TempDir
    Path tempDir;

    private TaskListStore lists;
    private TaskStore tasks;
    private Plan plan;
    private TaskList list;

    @BeforeEach
    void setUp() {
        Database db = TestDatabases.migrated(tempDir);
        PositionManager positions = new PositionManager(db);
        lists = new TaskListStore(db, positions);
        tasks = new TaskStore(db, positions);
        plan = new PlanStore(db).create(PlanDraft.named("P1"));
        list = lists.create(TaskListDraft.of(plan.id(), "Phase 1"));
    }

    @Test
    void create_shouldRoundTripAndAppend() {
        Task first = tasks.create(TaskDraft.of(list.id(), "Write schema")
                .withDescription("DDL for plans")
                .assignedTo("alice"));
        Task second = tasks.create(TaskDraft.of(list.id(), "Write stores"));

        Task loaded = tasks.getById(first.id()).orElseThrow();
        assertEquals(first, loaded);
        assertEquals("Write schema", loaded.name());
        assertEquals("DDL for plans", loaded.description());
        assertEquals("alice", loaded.assignedTo());
        assertFalse(loaded.completed());
        assertNull(loaded.completedAt());
        assertEquals(0, first.position());
        assertEquals(1, second.position());
    }

    @Test
    void create_shouldThrowNotFoundForUnknownList() {
        assertThrows(NotFoundException.class, () -> tasks.create(TaskDraft.of(404, "x")));
    }

    @Test
    void create_shouldRejectBlankName() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> tasks.create(TaskDraft.of(list.id(), "")));
        assertTrue(e.hasErrorFor("name"));
    }

    @Test
    void complete_shouldSetFlagAndTimestamp() {
        Task task = tasks.create(TaskDraft.of(list.id(), "t"));

        Task completed = tasks.complete(task.id());

        assertTrue(completed.completed());
        assertNotNull(completed.completedAt());
    }

    @Test
    void uncomplete_shouldClearFlagAndTimestamp() {
        Task task = tasks.create(TaskDraft.of(list.id(), "t"));
        tasks.complete(task.id());

        Task reopened = tasks.uncomplete(task.id());

        assertFalse(reopened.completed());
        assertNull(reopened.completedAt());
    }

    @Test
    void complete_shouldThrowNotFoundForUnknownTask() {
        assertThrows(NotFoundException.class, () -> tasks.complete(77));
    }

    @Test
    void update_shouldApplyOnlySetColumns() {
        Task task = tasks.create(TaskDraft.of(list.id(), "t").withDescription("keep"));

        Task updated = tasks.update(task.id(), TaskUpdate.builder().name("renamed").assignedTo("bob").build());

        assertEquals("renamed", updated.name());
        assertEquals("keep", updated.description());
        assertEquals("bob", updated.assignedTo());
    }

    @Test
    void update_shouldRejectBlankName() {
        Task task = tasks.create(TaskDraft.of(list.id(), "t"));

        ValidationException e = assertThrows(ValidationException.class,
                () -> tasks.update(task.id(), TaskUpdate.builder().name("").build()));

        assertTrue(e.hasErrorFor(TaskUpdate.NAME));
        assertEquals("t", tasks.getById(task.id()).orElseThrow().name());
    }

    @Test
    void update_shouldRejectEmptyChanges() {
        Task task = tasks.create(TaskDraft.of(list.id(), "t"));

        assertThrows(ValidationException.class, () -> tasks.update(task.id(), TaskUpdate.builder().build()));
    }

    @Test
    void delete_shouldReturnDeletedRow() {
        Task task = tasks.create(TaskDraft.of(list.id(), "t"));

        assertEquals(task, tasks.delete(task.id()));
        assertTrue(tasks.listForList(list.id()).isEmpty());
        assertThrows(NotFoundException.class, () -> tasks.delete(task.id()));
    }

    @Test
    void reorder_shouldApplyNewPositions() {
        Task a = tasks.create(TaskDraft.of(list.id(), "a"));
        Task b = tasks.create(TaskDraft.of(list.id(), "b"));

        tasks.reorder(list.id(), Map.of(a.id(), 1, b.id(), 0));

        assertEquals(List.of("b", "a"), tasks.listForList(list.id()).stream().map(Task::name).toList());
    }

    @Test
    void listForPlan_shouldOrderByListThenTaskPosition() {
        TaskList second = lists.create(TaskListDraft.of(plan.id(), "Phase 2"));
        tasks.create(TaskDraft.of(second.id(), "2a"));
        tasks.create(TaskDraft.of(list.id(), "1b").atPosition(1));
        tasks.create(TaskDraft.of(list.id(), "1a").atPosition(0));

        List<PlanTask> all = tasks.listForPlan(plan.id());

        assertEquals(List.of("1a", "1b", "2a"), all.stream().map(t -> t.task().name()).toList());
        assertEquals("Phase 1", all.get(0).listName());
        assertEquals(1, all.get(2).listPosition());
    }

    @Test
    void summaryForPlan_shouldCountCompletedAndPending() {
        Task a = tasks.create(TaskDraft.of(list.id(), "a"));
        tasks.create(TaskDraft.of(list.id(), "b"));
        tasks.create(TaskDraft.of(list.id(), "c"));
        tasks.complete(a.id());

        assertEquals(new TaskSummary(3, 1, 2), tasks.summaryForPlan(plan.id()));
    }

    @Test
    void summaryForPlan_shouldBeEmptyForPlanWithoutTasks() {
        assertEquals(TaskSummary.empty(), tasks.summaryForPlan(123));
    }
}

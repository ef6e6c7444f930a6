package de.bsommerfeld.skillbook.core.change;

/**
 * Input for creating a task list. A {@code null} position appends the list
 * after its current siblings.
 */
public record TaskListDraft(long planId, String name, String description, Integer position) {

    public static TaskListDraft of(long planId, String name) {
        return new TaskListDraft(planId, name, null, null);
    }

    public TaskListDraft withDescription(String description) {
        return new TaskListDraft(planId, name, description, position);
    }

    public TaskListDraft atPosition(int position) {
        return new TaskListDraft(planId, name, description, position);
    }
}

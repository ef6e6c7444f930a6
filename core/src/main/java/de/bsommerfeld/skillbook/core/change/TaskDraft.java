package de.bsommerfeld.skillbook.core.change;

/**
 * Input for creating a task. A {@code null} position appends the task after
 * its current siblings.
 */
public record TaskDraft(long listId, String name, String description, Integer position, String assignedTo) {

    public static TaskDraft of(long listId, String name) {
        return new TaskDraft(listId, name, null, null, null);
    }

    public TaskDraft withDescription(String description) {
        return new TaskDraft(listId, name, description, position, assignedTo);
    }

    public TaskDraft atPosition(int position) {
        return new TaskDraft(listId, name, description, position, assignedTo);
    }

    public TaskDraft assignedTo(String assignee) {
        return new TaskDraft(listId, name, description, position, assignee);
    }
}

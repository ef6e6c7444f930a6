package de.bsommerfeld.skillbook.core.change;

/**
 * Partial update of a task. Completion is not part of it: the store's
 * {@code complete}/{@code uncomplete} keep the flag and its timestamp in step.
 */
public final class TaskUpdate extends ColumnChanges {

    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String POSITION = "position";
    public static final String ASSIGNED_TO = "assigned_to";

    private TaskUpdate(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends ColumnChanges.Builder<Builder> {

        private Builder() {
        }

        public Builder name(String name) {
            return set(NAME, name);
        }

        public Builder description(String description) {
            return set(DESCRIPTION, description);
        }

        public Builder position(int position) {
            return set(POSITION, position);
        }

        public Builder assignedTo(String assignedTo) {
            return set(ASSIGNED_TO, assignedTo);
        }

        public TaskUpdate build() {
            return new TaskUpdate(this);
        }
    }
}

package de.bsommerfeld.skillbook.core.change;

public final class TaskListUpdate extends ColumnChanges {

    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String POSITION = "position";

    private TaskListUpdate(Builder builder) {
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

        public TaskListUpdate build() {
            return new TaskListUpdate(this);
        }
    }
}

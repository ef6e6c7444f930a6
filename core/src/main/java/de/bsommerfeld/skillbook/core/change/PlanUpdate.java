package de.bsommerfeld.skillbook.core.change;

import de.bsommerfeld.skillbook.core.domain.PlanStatus;

/**
 * Partial update of a plan. {@code created_by} and the timestamps are not
 * updatable; use the store's {@code complete}/{@code archive} to stamp
 * {@code completed_at}.
 */
public final class PlanUpdate extends ColumnChanges {

    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String SUMMARY = "summary";
    public static final String DESCRIPTION = "description";
    public static final String CONTENT = "content";
    public static final String STATUS = "status";
    public static final String ASSIGNED_TO = "assigned_to";

    private PlanUpdate(Builder builder) {
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

        public Builder title(String title) {
            return set(TITLE, title);
        }

        public Builder summary(String summary) {
            return set(SUMMARY, summary);
        }

        public Builder description(String description) {
            return set(DESCRIPTION, description);
        }

        public Builder content(String content) {
            return set(CONTENT, content);
        }

        public Builder status(PlanStatus status) {
            return set(STATUS, status);
        }

        public Builder assignedTo(String assignedTo) {
            return set(ASSIGNED_TO, assignedTo);
        }

        public PlanUpdate build() {
            return new PlanUpdate(this);
        }
    }
}

package de.bsommerfeld.skillbook.core.change;

import de.bsommerfeld.skillbook.core.domain.PlanStatus;

/**
 * Input for creating a plan. Only {@code name} is required; {@code status}
 * defaults to {@link PlanStatus#DRAFT} and {@code content} to the empty
 * string.
 */
public record PlanDraft(
        String name,
        String title,
        String summary,
        String description,
        String content,
        PlanStatus status,
        String createdBy,
        String assignedTo) {

    public static PlanDraft named(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;
        private String title;
        private String summary;
        private String description;
        private String content;
        private PlanStatus status;
        private String createdBy;
        private String assignedTo;

        private Builder(String name) {
            this.name = name;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder status(PlanStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public PlanDraft build() {
            return new PlanDraft(name, title, summary, description, content, status, createdBy, assignedTo);
        }
    }
}

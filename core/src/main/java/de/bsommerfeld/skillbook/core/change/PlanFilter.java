package de.bsommerfeld.skillbook.core.change;

import de.bsommerfeld.skillbook.core.domain.PlanStatus;

/** Equality filters for listing plans; {@code null} components match anything. */
public record PlanFilter(PlanStatus status, String createdBy, String assignedTo) {

    public static PlanFilter all() {
        return new PlanFilter(null, null, null);
    }

    public static PlanFilter byStatus(PlanStatus status) {
        return new PlanFilter(status, null, null);
    }

    public PlanFilter withCreatedBy(String createdBy) {
        return new PlanFilter(status, createdBy, assignedTo);
    }

    public PlanFilter withAssignedTo(String assignedTo) {
        return new PlanFilter(status, createdBy, assignedTo);
    }
}

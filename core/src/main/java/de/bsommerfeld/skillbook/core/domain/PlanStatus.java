package de.bsommerfeld.skillbook.core.domain;

import de.bsommerfeld.skillbook.core.error.ValidationException;

/**
 * Lifecycle states of an implementation plan. Any state may be set
 * directly through an update; only {@code complete} and {@code archive}
 * force a particular state.
 */
public enum PlanStatus {

    DRAFT("draft"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    ARCHIVED("archived"),
    CANCELLED("cancelled");

    private final String dbValue;

    PlanStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    /** The value stored in {@code implementation_plans.status}. */
    public String dbValue() {
        return dbValue;
    }

    /**
     * Parses a stored or user-supplied status value.
     *
     * @throws ValidationException if the value is not one of the known states
     */
    public static PlanStatus parse(String value) {
        for (PlanStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new ValidationException("plan", "status",
                "must be one of draft, in-progress, completed, archived, cancelled (was '" + value + "')");
    }

    @Override
    public String toString() {
        return dbValue;
    }
}

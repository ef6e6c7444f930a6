package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Stored state of an implementation plan. Timestamps are UTC with second
 * precision, as recorded by SQLite's {@code datetime('now')}.
 *
 * @param id          auto-assigned identifier
 * @param name        globally unique plan name
 * @param title       optional display title
 * @param summary     short searchable summary
 * @param description longer description
 * @param content     free-form body, never {@code null} (defaults to empty)
 * @param status      current lifecycle state
 * @param createdBy   creator identifier, may be {@code null}
 * @param assignedTo  assignee identifier, may be {@code null}
 * @param createdAt   creation time
 * @param updatedAt   time of the last update, complete or archive
 * @param completedAt set by {@code complete}, otherwise {@code null}
 */
public record Plan(
        long id,
        String name,
        String title,
        String summary,
        String description,
        String content,
        PlanStatus status,
        String createdBy,
        String assignedTo,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt) {
}

package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Single unit of work inside a task list. {@code completedAt} is non-null
 * exactly when the task was marked complete through the store.
 */
public record Task(
        long id,
        long listId,
        String name,
        String description,
        boolean completed,
        Instant completedAt,
        int position,
        String assignedTo,
        Instant createdAt,
        Instant updatedAt) {
}

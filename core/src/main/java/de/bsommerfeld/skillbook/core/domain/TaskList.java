package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Named, ordered group of tasks owned by one plan. Deleted together with
 * its plan.
 */
public record TaskList(
        long id,
        long planId,
        String name,
        String description,
        int position,
        Instant createdAt,
        Instant updatedAt) {
}

package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/** Named, reusable prompt piece. Names are unique. */
public record PromptFragment(
        long id,
        String name,
        String title,
        String description,
        Instant createdAt,
        Instant updatedAt) {
}

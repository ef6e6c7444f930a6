package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Composed prompt document. Same shape as {@link Skill} minus the category,
 * plus an author.
 */
public record Prompt(
        long id,
        String path,
        String name,
        String title,
        String author,
        String description,
        String content,
        String fileHash,
        long sizeBytes,
        Integer tokenCount,
        Instant createdAt,
        Instant updatedAt) {
}

package de.bsommerfeld.skillbook.core.domain;

import java.time.Instant;

/**
 * Reusable documentation unit, addressed by its source file path. The file
 * hash drives change detection when skills are re-synced.
 *
 * @param tokenCount rough token estimate, {@code null} if never computed
 */
public record Skill(
        long id,
        String path,
        String category,
        String name,
        String title,
        String description,
        String content,
        String fileHash,
        long sizeBytes,
        Integer tokenCount,
        Instant createdAt,
        Instant updatedAt) {
}

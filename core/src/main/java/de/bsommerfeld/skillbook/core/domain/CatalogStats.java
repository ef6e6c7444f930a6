package de.bsommerfeld.skillbook.core.domain;

import java.util.List;

/**
 * Aggregate figures over the skill and prompt catalog.
 *
 * @param totalSizeBytes summed {@code size_bytes} of skills and prompts
 * @param totalTokens    summed token estimates, ignoring rows without one
 */
public record CatalogStats(
        int skills,
        int prompts,
        long totalSizeBytes,
        long totalTokens,
        List<CategoryCount> categories) {

    public CatalogStats {
        categories = List.copyOf(categories);
    }
}

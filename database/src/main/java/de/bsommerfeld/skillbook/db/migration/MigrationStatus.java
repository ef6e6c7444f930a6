package de.bsommerfeld.skillbook.db.migration;

import java.time.Instant;

/** Applied state of one migration unit; {@code appliedAt} is null while pending. */
public record MigrationStatus(int version, String description, boolean applied, Instant appliedAt) {
}

package de.bsommerfeld.skillbook.db.migration;

import java.util.List;

/**
 * Outcome of a migrate or rollback run.
 *
 * @param touched versions applied (migrate) or reverted (rollback), in
 *                execution order
 */
public record MigrationReport(int fromVersion, int toVersion, List<Integer> touched) {

    public MigrationReport {
        touched = List.copyOf(touched);
    }

    public boolean upToDate() {
        return touched.isEmpty();
    }
}

package de.bsommerfeld.skillbook.db.migration;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.db.Database;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the {@code db/migration} scripts through Flyway, tracked in
 * {@code flyway_schema_history}. For deployments that manage schema changes
 * as plain files; {@link SchemaMigrator} remains the mechanism the store
 * initializes with. Both produce the same tables, indexes and triggers.
 */
@Singleton
public class FlywayMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(FlywayMigrator.class);

    public static final String LOCATION = "classpath:db/migration";

    private final Flyway flyway;

    @Inject
    public FlywayMigrator(Database database) {
        this.flyway = Flyway.configure()
                .dataSource(database.getUrl(), "", "")
                .locations(LOCATION)
                .load();
    }

    /** Applies all pending scripts and returns how many ran. */
    public int migrate() {
        MigrateResult result = flyway.migrate();
        if (result.migrationsExecuted == 0) {
            LOG.info("[DB] Flyway schema is up to date");
        } else {
            LOG.info("[DB] Flyway applied {} migration(s), schema at v{}", result.migrationsExecuted,
                    result.targetSchemaVersion);
        }
        return result.migrationsExecuted;
    }

    /** Versions present on the classpath but not yet applied. */
    public List<Integer> pending() {
        List<Integer> versions = new ArrayList<>();
        for (MigrationInfo info : flyway.info().pending()) {
            versions.add(toInt(info.getVersion()));
        }
        return versions;
    }

    /** Highest applied version, 0 before the first run. */
    public int currentVersion() {
        MigrationInfo current = flyway.info().current();
        return current == null ? 0 : toInt(current.getVersion());
    }

    public List<MigrationStatus> info() {
        List<MigrationStatus> statuses = new ArrayList<>();
        for (MigrationInfo info : flyway.info().all()) {
            statuses.add(new MigrationStatus(
                    toInt(info.getVersion()),
                    info.getDescription(),
                    info.getState().isApplied(),
                    info.getInstalledOn() == null ? null : info.getInstalledOn().toInstant()));
        }
        return statuses;
    }

    private static int toInt(MigrationVersion version) {
        return Integer.parseInt(version.getVersion());
    }
}

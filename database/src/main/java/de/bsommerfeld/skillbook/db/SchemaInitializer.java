package de.bsommerfeld.skillbook.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.skillbook.db.migration.MigrationException;
import de.bsommerfeld.skillbook.db.migration.MigrationReport;
import de.bsommerfeld.skillbook.db.migration.SchemaMigrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the schema up to date when the injector is created. Bound as an
 * eager singleton, so a failed migration aborts injector creation and no
 * store ever runs against a mismatched schema.
 */
@Singleton
public class SchemaInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

    private final MigrationReport report;

    @Inject
    public SchemaInitializer(SchemaMigrator migrator) {
        try {
            this.report = migrator.migrate();
        } catch (MigrationException e) {
            LOG.error("[DB] Schema migration failed at v{}, refusing to start", e.getVersion(), e);
            throw e;
        }
    }

    public MigrationReport getReport() {
        return report;
    }
}

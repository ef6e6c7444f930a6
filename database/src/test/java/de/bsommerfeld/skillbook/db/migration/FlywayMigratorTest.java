package de.bsommerfeld.skillbook.db.migration;

import de.bsommerfeld.skillbook.core.config.StoreConfig;
import de.bsommerfeld.skillbook.db.Database;
import de.bsommerfeld.skillbook.db.SchemaSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The Flyway path over the same resource scripts must land on the schema
 * {@link SchemaMigrator} builds.
 */
class FlywayMigratorTest {

    @TempDir
    Path tempDir;

    @Test
    void migrate_shouldApplyEveryScript() {
        FlywayMigrator flyway = new FlywayMigrator(database("flyway.db"));

        assertEquals(List.of(1, 2, 3, 4), flyway.pending());
        assertEquals(4, flyway.migrate());
        assertEquals(4, flyway.currentVersion());
        assertTrue(flyway.pending().isEmpty());
    }

    @Test
    void migrate_shouldBeNoOpWhenUpToDate() {
        FlywayMigrator flyway = new FlywayMigrator(database("flyway.db"));
        flyway.migrate();

        assertEquals(0, flyway.migrate());
    }

    @Test
    void migrate_shouldProduceSameSchemaAsSchemaMigrator() {
        Database viaFlyway = database("flyway.db");
        Database viaMigrator = database("migrator.db");

        new FlywayMigrator(viaFlyway).migrate();
        new SchemaMigrator(viaMigrator).migrate();

        assertTrue(SchemaSnapshot.hasTable(viaFlyway, "flyway_schema_history"));
        assertTrue(SchemaSnapshot.hasTable(viaMigrator, "schema_version"));
        assertEquals(SchemaSnapshot.of(viaMigrator), SchemaSnapshot.of(viaFlyway));
    }

    @Test
    void info_shouldDescribeEachScript() {
        FlywayMigrator flyway = new FlywayMigrator(database("flyway.db"));
        flyway.migrate();

        List<MigrationStatus> info = flyway.info();

        assertEquals(4, info.size());
        assertTrue(info.stream().allMatch(MigrationStatus::applied));
        assertEquals("initial schema", info.get(0).description());
    }

    private Database database(String file) {
        return new Database(new StoreConfig(tempDir.resolve(file)));
    }
}

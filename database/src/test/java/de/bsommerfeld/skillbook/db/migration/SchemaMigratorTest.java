package de.bsommerfeld.skillbook.db.migration;

import de.bsommerfeld.skillbook.db.Database;
import de.bsommerfeld.skillbook.db.Jdbc;
import de.bsommerfeld.skillbook.db.SchemaSnapshot;
import de.bsommerfeld.skillbook.db.TestDatabases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Forward migration, rollback and reset against a real temporary SQLite
 * file.
 */
class SchemaMigratorTest {

    @TempDir
    Path tempDir;

    private Database db;
    private SchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        db = TestDatabases.empty(tempDir);
        migrator = new SchemaMigrator(db);
    }

    // -- Forward --

    @Test
    void currentVersion_shouldBeZeroWithoutLedger() {
        assertEquals(0, migrator.currentVersion());
        assertFalse(SchemaSnapshot.hasTable(db, "schema_version"));
    }

    @Test
    void migrate_shouldApplyAllUnitsInOrder() {
        MigrationReport report = migrator.migrate();

        assertEquals(0, report.fromVersion());
        assertEquals(4, report.toVersion());
        assertEquals(List.of(1, 2, 3, 4), report.touched());
        assertEquals(4, migrator.currentVersion());
        for (String table : List.of("skills", "prompts", "prompt_skills", "skills_fts", "prompts_fts",
                "implementation_plans", "task_lists", "tasks", "implementation_plans_fts",
                "prompt_fragments", "prompt_fragment_skills", "prompt_references", "plan_skills")) {
            assertTrue(SchemaSnapshot.hasTable(db, table), table);
        }
    }

    @Test
    void migrate_shouldBeNoOpWhenUpToDate() {
        migrator.migrate();
        Set<String> before = SchemaSnapshot.of(db);

        MigrationReport second = migrator.migrate();

        assertTrue(second.upToDate());
        assertEquals(4, second.fromVersion());
        assertEquals(4, second.toVersion());
        assertEquals(before, SchemaSnapshot.of(db));
        assertEquals(4L, ledgerRows());
    }

    @Test
    void migrate_shouldOnlyApplyNewerUnits() {
        new SchemaMigrator(db, Migrations.defaults().subList(0, 2)).migrate();
        assertEquals(2, migrator.currentVersion());

        MigrationReport report = migrator.migrate();

        assertEquals(List.of(3, 4), report.touched());
    }

    @Test
    void migrate_shouldRollBackFailingUnitAndKeepEarlierOnes() {
        List<Migration> units = new ArrayList<>(Migrations.defaults());
        units.add(new Migration(5, "broken",
                List.of("CREATE TABLE half_done (id INTEGER PRIMARY KEY)", "THIS IS NOT SQL"),
                List.of()));
        SchemaMigrator failing = new SchemaMigrator(db, units);

        MigrationException e = assertThrows(MigrationException.class, failing::migrate);

        assertEquals(5, e.getVersion());
        assertNotNull(e.getCause());
        assertEquals(4, failing.currentVersion());
        assertFalse(SchemaSnapshot.hasTable(db, "half_done"));
    }

    @Test
    void constructor_shouldRejectDuplicateVersions() {
        List<Migration> units = List.of(
                new Migration(1, "a", List.of("SELECT 1"), List.of()),
                new Migration(1, "b", List.of("SELECT 1"), List.of()));

        assertThrows(MigrationException.class, () -> new SchemaMigrator(db, units));
    }

    @Test
    void constructor_shouldRejectNonPositiveVersions() {
        List<Migration> units = List.of(new Migration(0, "zero", List.of("SELECT 1"), List.of()));

        assertThrows(MigrationException.class, () -> new SchemaMigrator(db, units));
    }

    // -- Rollback --

    @Test
    void rollback_shouldRevertNewestUnit() {
        migrator.migrate();

        MigrationReport report = migrator.rollback();

        assertEquals(List.of(4), report.touched());
        assertEquals(3, migrator.currentVersion());
        assertFalse(SchemaSnapshot.hasTable(db, "plan_skills"));
        assertTrue(SchemaSnapshot.hasTable(db, "prompt_fragments"));
    }

    @Test
    void rollback_shouldRevertSeveralUnitsNewestFirst() {
        migrator.migrate();

        MigrationReport report = migrator.rollback(3);

        assertEquals(List.of(4, 3, 2), report.touched());
        assertEquals(1, report.toVersion());
        assertFalse(SchemaSnapshot.hasTable(db, "implementation_plans"));
        assertFalse(SchemaSnapshot.hasTable(db, "implementation_plans_fts"));
        assertTrue(SchemaSnapshot.hasTable(db, "skills"));
    }

    @Test
    void rollback_shouldStopAtVersionZero() {
        migrator.migrate();

        MigrationReport report = migrator.rollback(10);

        assertEquals(4, report.touched().size());
        assertEquals(0, migrator.currentVersion());
        assertFalse(SchemaSnapshot.hasTable(db, "skills"));
    }

    @Test
    void rollbackThenMigrate_shouldRestoreSameSchema() {
        migrator.migrate();
        Set<String> full = SchemaSnapshot.of(db);

        migrator.rollback(2);
        migrator.migrate();

        assertEquals(full, SchemaSnapshot.of(db));
    }

    // -- Reset --

    @Test
    void reset_shouldDropDataAndReapply() {
        migrator.migrate();
        db.write("seed", Jdbc.context(), conn -> Jdbc.insert(conn,
                "INSERT INTO skills (path, category, name, content, file_hash, size_bytes) "
                        + "VALUES ('a.md', 'c', 'a', 'body', 'h', 4)"));

        MigrationReport report = migrator.reset();

        assertEquals(List.of(1, 2, 3, 4), report.touched());
        assertEquals(4, migrator.currentVersion());
        assertEquals(0L, (long) db.read("count", Jdbc.context(),
                conn -> Jdbc.queryLong(conn, "SELECT COUNT(*) FROM skills")));
    }

    @Test
    void reset_shouldTolerateMissingObjectsOnPartialSchema() {
        new SchemaMigrator(db, Migrations.defaults().subList(0, 1)).migrate();

        MigrationReport report = migrator.reset();

        assertEquals(4, report.toVersion());
        assertTrue(SchemaSnapshot.hasTable(db, "plan_skills"));
    }

    // -- Status --

    @Test
    void status_shouldReportAppliedAndPendingUnits() {
        new SchemaMigrator(db, Migrations.defaults().subList(0, 3)).migrate();

        List<MigrationStatus> status = migrator.status();

        assertEquals(4, status.size());
        assertTrue(status.get(0).applied());
        assertNotNull(status.get(0).appliedAt());
        assertEquals("initial schema", status.get(0).description());
        assertFalse(status.get(3).applied());
        assertNull(status.get(3).appliedAt());
    }

    private long ledgerRows() {
        return db.read("count", Jdbc.context(), conn -> Jdbc.queryLong(conn, "SELECT COUNT(*) FROM schema_version"));
    }
}

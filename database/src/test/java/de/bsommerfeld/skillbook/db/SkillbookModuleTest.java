package de.bsommerfeld.skillbook.db;

import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Provides;
import de.bsommerfeld.skillbook.core.change.PlanDraft;
import de.bsommerfeld.skillbook.core.config.StoreConfig;
import de.bsommerfeld.skillbook.db.migration.Migration;
import de.bsommerfeld.skillbook.db.migration.MigrationException;
import de.bsommerfeld.skillbook.db.migration.Migrations;
import de.bsommerfeld.skillbook.db.migration.SchemaMigrator;
import de.bsommerfeld.skillbook.db.search.FullTextSearch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Injector creation against a temporary database file.
 */
class SkillbookModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void createInjector_shouldMigrateSchemaEagerly() {
        Injector injector = Guice.createInjector(new SkillbookModule(new StoreConfig(tempDir.resolve("app.db"))));

        SchemaInitializer initializer = injector.getInstance(SchemaInitializer.class);
        int latest = Migrations.defaults().get(Migrations.defaults().size() - 1).version();
        assertEquals(0, initializer.getReport().fromVersion());
        assertEquals(latest, initializer.getReport().toVersion());
        assertEquals(latest, injector.getInstance(SchemaMigrator.class).currentVersion());
    }

    @Test
    void createInjector_shouldShareSingletons() {
        Injector injector = Guice.createInjector(new SkillbookModule(new StoreConfig(tempDir.resolve("app.db"))));

        assertSame(injector.getInstance(Database.class), injector.getInstance(Database.class));
        assertSame(injector.getInstance(PositionManager.class), injector.getInstance(PositionManager.class));
    }

    @Test
    void injectedStores_shouldWorkAgainstMigratedSchema() {
        Injector injector = Guice.createInjector(new SkillbookModule(new StoreConfig(tempDir.resolve("app.db"))));

        injector.getInstance(PlanStore.class).create(PlanDraft.builder("wiring").content("guice wiring").build());

        assertEquals(1, injector.getInstance(FullTextSearch.class).searchPlans("wiring").size());
    }

    @Test
    void reopening_shouldFindSchemaUpToDate() {
        StoreConfig config = new StoreConfig(tempDir.resolve("app.db"));
        Guice.createInjector(new SkillbookModule(config));

        Injector second = Guice.createInjector(new SkillbookModule(config));

        assertTrue(second.getInstance(SchemaInitializer.class).getReport().upToDate());
    }

    @Test
    void createInjector_shouldFailWhenMigrationFails() {
        AbstractModule broken = new AbstractModule() {
            @Provides
            SchemaMigrator migrator(Database database) {
                return new SchemaMigrator(database,
                        List.of(new Migration(1, "broken", List.of("CREATE TABLE oops ("), List.of())));
            }
        };

        CreationException e = assertThrows(CreationException.class,
                () -> Guice.createInjector(new SkillbookModule(new StoreConfig(tempDir.resolve("app.db"))), broken));
        assertInstanceOf(MigrationException.class, e.getCause());
    }
}

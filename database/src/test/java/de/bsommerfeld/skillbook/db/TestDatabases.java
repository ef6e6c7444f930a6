package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.config.StoreConfig;
import de.bsommerfeld.skillbook.db.migration.SchemaMigrator;

import java.nio.file.Path;

/** Fresh SQLite files for integration tests. */
public final class TestDatabases {

    private TestDatabases() {
    }

    /** A database file under {@code dir} with no schema yet. */
    public static Database empty(Path dir) {
        return new Database(new StoreConfig(dir.resolve("test.db")));
    }

    /** A database file under {@code dir} migrated to the latest version. */
    public static Database migrated(Path dir) {
        Database database = empty(dir);
        new SchemaMigrator(database).migrate();
        return database;
    }
}

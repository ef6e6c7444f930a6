package de.bsommerfeld.skillbook.core.config;

import de.bsommerfeld.skillbook.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Settings the persistence core needs from its host: where the database file
 * lives, how long a connection waits on a locked database, and the default
 * size of search result pages.
 *
 * <p>
 * {@link #resolve()} reads system properties first, then environment
 * variables, then falls back to defaults:
 * <ul>
 * <li>{@code skillbook.db.path} / {@code SKILLBOOK_DB_PATH}: database
 * file (default {@code <app data dir>/skillbook.db})</li>
 * <li>{@code skillbook.db.busy-timeout-ms} /
 * {@code SKILLBOOK_DB_BUSY_TIMEOUT_MS}: SQLite busy timeout</li>
 * <li>{@code skillbook.search.max-results} /
 * {@code SKILLBOOK_SEARCH_MAX_RESULTS}: default search page size</li>
 * </ul>
 */
public class StoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    public static final String APP_NAME = "skillbook";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_SEARCH_MAX_RESULTS = 50;

    private Path databasePath;
    private int busyTimeoutMillis = DEFAULT_BUSY_TIMEOUT_MS;
    private int searchMaxResults = DEFAULT_SEARCH_MAX_RESULTS;

    public StoreConfig(Path databasePath) {
        this.databasePath = databasePath.toAbsolutePath();
    }

    /**
     * Builds a configuration from system properties and environment
     * variables. Unparseable numeric values are logged and replaced by their
     * defaults.
     */
    public static StoreConfig resolve() {
        String path = lookup("skillbook.db.path", "SKILLBOOK_DB_PATH");
        StoreConfig config = new StoreConfig(path != null
                ? StorageUtils.expandHome(path)
                : StorageUtils.getAppDataDir(APP_NAME).resolve(APP_NAME + ".db"));

        config.setBusyTimeoutMillis(intValue("skillbook.db.busy-timeout-ms",
                "SKILLBOOK_DB_BUSY_TIMEOUT_MS", DEFAULT_BUSY_TIMEOUT_MS));
        config.setSearchMaxResults(intValue("skillbook.search.max-results",
                "SKILLBOOK_SEARCH_MAX_RESULTS", DEFAULT_SEARCH_MAX_RESULTS));
        return config;
    }

    private static String lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(String property, String env, int fallback) {
        String raw = lookup(property, env);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric value '{}' for {}. Using {}.", raw, property, fallback);
            return fallback;
        }
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(Path databasePath) {
        this.databasePath = databasePath.toAbsolutePath();
    }

    /** JDBC URL of the configured database file. */
    public String getJdbcUrl() {
        return "jdbc:sqlite:" + databasePath;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = Math.max(0, busyTimeoutMillis);
    }

    public int getSearchMaxResults() {
        return searchMaxResults;
    }

    public void setSearchMaxResults(int searchMaxResults) {
        this.searchMaxResults = Math.max(1, Math.min(1000, searchMaxResults));
    }
}

package de.bsommerfeld.skillbook.db.migration;

import de.bsommerfeld.skillbook.core.error.StoreException;

import java.sql.SQLException;

/**
 * A migration unit could not be applied or reverted, or the unit list itself
 * is malformed. The failing unit's transaction has been rolled back, so the
 * schema is left at the last fully applied version.
 */
public class MigrationException extends StoreException {

    private final int version;

    public MigrationException(String message) {
        super(message);
        this.version = 0;
    }

    public MigrationException(int version, String message, SQLException cause) {
        super("Migration v" + version + " failed: " + message + ": " + cause.getMessage(), cause);
        this.version = version;
    }

    /** Version of the failing unit, 0 if the failure is not tied to one. */
    public int getVersion() {
        return version;
    }
}

package de.bsommerfeld.skillbook.core.error;

import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps an {@link SQLException} raised while executing a store operation,
 * such as a constraint violation or a malformed full-text query. Carries the
 * operation name and the input it was called with.
 */
public class DatabaseException extends StoreException {

    private final String operation;
    private final Map<String, Object> input;

    public DatabaseException(String operation, Map<String, ?> input, SQLException cause) {
        super("Failed to " + operation + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}

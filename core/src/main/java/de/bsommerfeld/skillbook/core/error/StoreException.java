package de.bsommerfeld.skillbook.core.error;

/**
 * Root of every failure the persistence core reports to its callers. All
 * subclasses are unchecked; the store never retries and never swallows them.
 */
public abstract class StoreException extends RuntimeException {

    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.bsommerfeld.skillbook.core.error;

/**
 * An update, delete, complete, archive or association targeted an
 * identifier that does not exist.
 */
public class NotFoundException extends StoreException {

    private final String entity;
    private final Object key;

    public NotFoundException(String entity, Object key) {
        super(entity + " not found: " + key);
        this.entity = entity;
        this.key = key;
    }

    public String getEntity() {
        return entity;
    }

    /** The id (or name) that was looked up. */
    public Object getKey() {
        return key;
    }
}

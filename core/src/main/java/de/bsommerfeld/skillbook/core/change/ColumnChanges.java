package de.bsommerfeld.skillbook.core.change;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of one row. Subclasses expose a builder whose setters each
 * write one fixed column name, so the SET clause built from
 * {@link #values()} only ever contains column names declared in code.
 *
 * <p>
 * A column that was set to {@code null} is present in {@link #values()}
 * (it clears the column); a column that was never set is absent.
 */
public abstract class ColumnChanges {

    private final Map<String, Object> values;

    protected ColumnChanges(Builder<?> builder) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(builder.values));
    }

    /** Column name to new value, in the order the setters were called. */
    public Map<String, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean isSet(String column) {
        return values.containsKey(column);
    }

    /** The new value for {@code column}, or {@code null} if unset or cleared. */
    public Object get(String column) {
        return values.get(column);
    }

    /** String-typed convenience for text columns. */
    public String text(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values;
    }

    protected abstract static class Builder<B extends Builder<B>> {

        private final Map<String, Object> values = new LinkedHashMap<>();

        @SuppressWarnings("unchecked")
        protected B set(String column, Object value) {
            values.put(column, value);
            return (B) this;
        }
    }
}

package de.bsommerfeld.skillbook.core.domain;

import de.bsommerfeld.skillbook.core.error.ValidationException;

/**
 * What a {@link PromptReference} points at. Exactly one target column is
 * populated per type.
 */
public enum ReferenceType {

    PROMPT("prompt"),
    FRAGMENT("fragment");

    private final String dbValue;

    ReferenceType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ReferenceType parse(String value) {
        for (ReferenceType type : values()) {
            if (type.dbValue.equals(value)) {
                return type;
            }
        }
        throw new ValidationException("prompt reference", "reference_type",
                "must be one of prompt, fragment (was '" + value + "')");
    }

    @Override
    public String toString() {
        return dbValue;
    }
}

package de.bsommerfeld.skillbook.core.validation;

import de.bsommerfeld.skillbook.core.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects field-keyed validation errors for one input and raises them all
 * at once. Checks skip {@code null} values unless they are explicitly
 * required, so optional fields only need bounds.
 *
 * <pre>
 * Validator.of("plan")
 *         .requiredText("name", draft.name(), 255)
 *         .optionalText("title", draft.title(), 500)
 *         .validate();
 * </pre>
 */
public final class Validator {

    private final String subject;
    private final Map<String, List<String>> errors = new LinkedHashMap<>();

    private Validator(String subject) {
        this.subject = subject;
    }

    public static Validator of(String subject) {
        return new Validator(subject);
    }

    public Validator required(String field, Object value) {
        if (value == null) {
            error(field, "is required");
        }
        return this;
    }

    /** Non-null, non-blank, at most {@code maxLength} characters. */
    public Validator requiredText(String field, String value, int maxLength) {
        if (value == null) {
            return error(field, "is required");
        }
        if (value.isBlank()) {
            return error(field, "must not be blank");
        }
        return optionalText(field, value, maxLength);
    }

    public Validator optionalText(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            error(field, "must be at most " + maxLength + " characters");
        }
        return this;
    }

    /**
     * For fields an update may leave unset: {@code null} passes, but a given
     * value must be non-blank and at most {@code maxLength} characters.
     */
    public Validator nonBlankText(String field, String value, int maxLength) {
        if (value != null && value.isBlank()) {
            return error(field, "must not be blank");
        }
        return optionalText(field, value, maxLength);
    }

    public Validator id(String field, Long value) {
        if (value == null) {
            return error(field, "is required");
        }
        return id(field, value.longValue());
    }

    public Validator id(String field, long value) {
        if (value < 1) {
            error(field, "must be a positive id");
        }
        return this;
    }

    /** Inclusive range check; {@code null} passes. */
    public Validator range(String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            error(field, "must be between " + min + " and " + max);
        }
        return this;
    }

    public Validator min(String field, Number value, long min) {
        if (value != null && value.longValue() < min) {
            error(field, "must be at least " + min);
        }
        return this;
    }

    public Validator check(boolean condition, String field, String message) {
        if (!condition) {
            error(field, message);
        }
        return this;
    }

    public Validator error(String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
        return this;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * @throws ValidationException if any check failed
     */
    public void validate() {
        if (!errors.isEmpty()) {
            throw new ValidationException(subject, errors);
        }
    }
}

package de.bsommerfeld.skillbook.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejected input. Raised before any database access, so a caller that sees
 * this exception knows nothing was written.
 *
 * <p>
 * {@link #getFieldErrors()} maps each offending field to the messages it
 * produced, in the order the fields were checked.
 */
public class ValidationException extends StoreException {

    private final String subject;
    private final Map<String, List<String>> fieldErrors;

    public ValidationException(String subject, Map<String, List<String>> fieldErrors) {
        super(describe(subject, fieldErrors));
        this.subject = subject;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.fieldErrors = Collections.unmodifiableMap(copy);
    }

    /** Single-field shorthand. */
    public ValidationException(String subject, String field, String message) {
        this(subject, Map.of(field, List.of(message)));
    }

    /** Entity kind or operation the rejected input was meant for. */
    public String getSubject() {
        return subject;
    }

    public Map<String, List<String>> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasErrorFor(String field) {
        return fieldErrors.containsKey(field);
    }

    private static String describe(String subject, Map<String, List<String>> fieldErrors) {
        StringBuilder sb = new StringBuilder("Invalid ").append(subject).append(": ");
        boolean first = true;
        for (Map.Entry<String, List<String>> e : fieldErrors.entrySet()) {
            if (!first) {
                sb.append("; ");
            }
            sb.append(e.getKey()).append(' ').append(String.join(", ", e.getValue()));
            first = false;
        }
        return sb.toString();
    }
}

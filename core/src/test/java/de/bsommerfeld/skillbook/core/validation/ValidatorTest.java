package de.bsommerfeld.skillbook.core.validation;

import de.bsommerfeld.skillbook.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    @Test
    void validate_shouldPassWhenNoCheckFails() {
        assertDoesNotThrow(() -> Validator.of("plan")
                .requiredText("name", "p", 10)
                .optionalText("title", null, 10)
                .id("id", 1L)
                .range("limit", null, 1, 5)
                .validate());
    }

    @Test
    void validate_shouldCollectEveryFailure() {
        ValidationException e = assertThrows(ValidationException.class, () -> Validator.of("plan")
                .requiredText("name", " ", 10)
                .optionalText("title", "x".repeat(11), 10)
                .id("id", 0)
                .min("position", -1, 0)
                .validate());

        assertEquals("plan", e.getSubject());
        assertEquals(List.of("name", "title", "id", "position"), List.copyOf(e.getFieldErrors().keySet()));
        assertEquals(List.of("must not be blank"), e.getFieldErrors().get("name"));
        assertTrue(e.getMessage().startsWith("Invalid plan: name must not be blank"));
    }

    @Test
    void requiredText_shouldDistinguishMissingFromBlank() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> Validator.of("skill").requiredText("path", null, 5).validate());

        assertEquals(List.of("is required"), e.getFieldErrors().get("path"));
    }

    @Test
    void nonBlankText_shouldRejectBlankButAllowNull() {
        assertTrue(Validator.of("plan").nonBlankText("name", null, 10).isValid());
        assertTrue(Validator.of("plan").nonBlankText("name", "P1", 10).isValid());

        ValidationException e = assertThrows(ValidationException.class,
                () -> Validator.of("plan").nonBlankText("name", " \t", 10).validate());

        assertEquals(List.of("must not be blank"), e.getFieldErrors().get("name"));
        assertFalse(Validator.of("plan").nonBlankText("name", "x".repeat(11), 10).isValid());
    }

    @Test
    void id_shouldRequireBoxedValue() {
        Validator validator = Validator.of("reference").id("targetId", (Long) null);

        assertFalse(validator.isValid());
    }

    @Test
    void range_shouldBeInclusive() {
        assertTrue(Validator.of("search").range("maxResults", 1, 1, 1000).range("n", 1000, 1, 1000).isValid());
        assertFalse(Validator.of("search").range("maxResults", 1001, 1, 1000).isValid());
    }

    @Test
    void error_shouldAppendMessagesPerField() {
        ValidationException e = assertThrows(ValidationException.class, () -> Validator.of("x")
                .error("f", "first")
                .check(false, "f", "second")
                .validate());

        assertEquals(List.of("first", "second"), e.getFieldErrors().get("f"));
        assertTrue(e.hasErrorFor("f"));
        assertFalse(e.hasErrorFor("g"));
    }
}

package de.bsommerfeld.skillbook.core.domain;

import de.bsommerfeld.skillbook.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanStatusTest {

    @Test
    void parse_shouldMapStoredValues() {
        assertEquals(PlanStatus.IN_PROGRESS, PlanStatus.parse("in-progress"));
        assertEquals(PlanStatus.CANCELLED, PlanStatus.parse("cancelled"));
    }

    @Test
    void parse_shouldRejectUnknownValue() {
        ValidationException e = assertThrows(ValidationException.class, () -> PlanStatus.parse("IN_PROGRESS"));
        assertTrue(e.hasErrorFor("status"));
    }

    @Test
    void toString_shouldMatchDbValue() {
        for (PlanStatus status : PlanStatus.values()) {
            assertEquals(status.dbValue(), status.toString());
            assertSame(status, PlanStatus.parse(status.dbValue()));
        }
    }

    @Test
    void referenceType_shouldParseBothKinds() {
        assertEquals(ReferenceType.PROMPT, ReferenceType.parse("prompt"));
        assertEquals(ReferenceType.FRAGMENT, ReferenceType.parse("fragment"));
        assertThrows(ValidationException.class, () -> ReferenceType.parse("skill"));
    }
}

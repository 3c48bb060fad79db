package ru.aritmos.formbroker.context;

import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.core.ValidationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextIdsTest {

    private static final String SESSION = "550e8400-e29b-41d4-a716-446655440000";

    @Test
    void parsesValidContextId() {
        ContextRef ref = ContextIds.validate("contact-form:" + SESSION, "contact-form");

        assertEquals("contact-form", ref.formId());
        assertEquals(SESSION, ref.sessionId());
        assertEquals("contact-form:" + SESSION, ref.contextId());
    }

    @Test
    void rejectsNonUuidSession() {
        ValidationException e = assertThrows(ValidationException.class, () -> ContextIds.parse("form:not-a-uuid"));
        assertEquals(ContextIds.INVALID_CONTEXT_ID, e.code());
        assertEquals(400, e.httpStatus());
    }

    @Test
    void rejectsMalformedShapes() {
        assertThrows(ValidationException.class, () -> ContextIds.parse(null));
        assertThrows(ValidationException.class, () -> ContextIds.parse("  "));
        assertThrows(ValidationException.class, () -> ContextIds.parse(SESSION));
        assertThrows(ValidationException.class, () -> ContextIds.parse(":" + SESSION));
        assertThrows(ValidationException.class, () -> ContextIds.parse("a:b:" + SESSION));
    }

    @Test
    void rejectsForeignFormId() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> ContextIds.validate("other-form:" + SESSION, "contact-form"));
        assertEquals(ContextIds.FORM_ID_MISMATCH, e.code(), "TEST_EXPECTED: formId из маршрута не совпал");
    }

    @Test
    void acceptsOnlyVersionFourUuids() {
        assertTrue(ContextIds.isUuidV4(ContextIds.newSessionId()));
        assertTrue(ContextIds.isUuidV4(SESSION.toUpperCase()));
        assertFalse(ContextIds.isUuidV4("550e8400-e29b-11d4-a716-446655440000"), "TEST_EXPECTED: версия 1 отклоняется");
        assertFalse(ContextIds.isUuidV4("550e8400-e29b-41d4-c716-446655440000"), "TEST_EXPECTED: неверный вариант");
        assertThrows(ValidationException.class, () -> ContextIds.requireSessionId("abc"));
    }
}

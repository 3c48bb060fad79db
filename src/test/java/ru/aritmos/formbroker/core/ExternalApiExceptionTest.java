package ru.aritmos.formbroker.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExternalApiExceptionTest {

    @Test
    void classifiesByCodeStatusAndOperation() {
        assertEquals(ExternalApiException.Kind.AUTH,
                ExternalApiException.classifyKind(ExternalApiException.Operation.QUERY, "INVALID_SESSION_ID", 401));
        assertEquals(ExternalApiException.Kind.PERMISSION,
                ExternalApiException.classifyKind(ExternalApiException.Operation.CREATE, "INSUFFICIENT_ACCESS", 400));
        assertEquals(ExternalApiException.Kind.CONNECTION,
                ExternalApiException.classifyKind(ExternalApiException.Operation.DESCRIBE, null, 503));
        assertEquals(ExternalApiException.Kind.QUERY,
                ExternalApiException.classifyKind(ExternalApiException.Operation.QUERY, "MALFORMED_QUERY", 400));
        assertEquals(ExternalApiException.Kind.CREATE,
                ExternalApiException.classifyKind(ExternalApiException.Operation.CREATE, "REQUIRED_FIELD_MISSING", 400));
        assertEquals(ExternalApiException.Kind.GENERIC,
                ExternalApiException.classifyKind(ExternalApiException.Operation.DESCRIBE, "NOT_FOUND", 404));
    }

    @Test
    void carriesExternalDetailsInContext() {
        ExternalApiException e = ExternalApiException.classify(ExternalApiException.Operation.CREATE, "REQUIRED_FIELD_MISSING", 400,
                "Required fields are missing: [LastName]", Map.of("objectType", "Lead"));

        assertEquals("EXTERNAL_CREATE", e.code());
        assertEquals(502, e.httpStatus());
        assertFalse(e.retryable());
        assertEquals("Lead", e.context().get("objectType"));
        assertEquals("REQUIRED_FIELD_MISSING", e.context().get("externalCode"));
        assertEquals(400, e.context().get("externalStatus"));
        assertTrue(e.getMessage().contains("CREATE"));
    }

    @Test
    void connectionKindIsRetryableServiceUnavailable() {
        ExternalApiException e = ExternalApiException.classify(ExternalApiException.Operation.QUERY, null, 504, "", Map.of());

        assertEquals(503, e.httpStatus());
        assertTrue(e.retryable());
        assertTrue(e.getMessage().endsWith("HTTP 504"));
    }
}

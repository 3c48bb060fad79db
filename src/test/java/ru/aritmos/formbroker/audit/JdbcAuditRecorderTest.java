package ru.aritmos.formbroker.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.MutableClock;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.recordstore.RecordStoreModels;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcAuditRecorderTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-10T10:00:00Z"));
    private final FormBrokerProperties props = new FormBrokerProperties();
    private JdbcAuditRecorder recorder;

    @BeforeEach
    void setUp() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:audit-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        Flyway.configure().dataSource(ds).load().migrate();
        props.getAudit().setMaxBodyLength(200);
        recorder = new JdbcAuditRecorder(ds, new ObjectMapper(), props, clock);
    }

    private static AuditModels.SubmissionAudit submission(String formId, String contextId, List<RecordStoreModels.RecordRef> records,
                                                          List<String> relationships, boolean success) {
        return new AuditModels.SubmissionAudit(formId, contextId, success ? "a0S1" : null, records, relationships,
                Map.of("email", "a@b.c"), null, success, false, success ? null : "boom", null, 42L);
    }

    @Test
    void recordsAndQueriesSubmissions() {
        recorder.recordSubmission(submission("contact", "contact:1", List.of(), List.of(), true));
        clock.advance(Duration.ofSeconds(1));
        recorder.recordSubmission(submission("test-drive", "test-drive:2", List.of(), List.of(), false));

        List<AuditModels.SubmissionLogRow> recent = recorder.recentSubmissions(10);
        assertEquals(2, recent.size());
        assertEquals("test-drive", recent.get(0).formId(), "TEST_EXPECTED: новые записи первыми");
        assertFalse(recent.get(0).success());
        assertEquals("boom", recent.get(0).errorMessage());
        assertEquals("{\"email\":\"a@b.c\"}", recent.get(1).formData());

        assertEquals(1, recorder.submissionsByForm("contact", 10).size());
        assertEquals(1, recorder.submissionsByContext("test-drive:2", 10).size());
        assertEquals(1, recorder.recentSubmissions(1).size(), "TEST_EXPECTED: limit соблюдается");
    }

    @Test
    void findsSubmissionsWithUnlinkedBusinessRecords() {
        List<RecordStoreModels.RecordRef> lead = List.of(new RecordStoreModels.RecordRef("00Q1", "Lead"));
        recorder.recordSubmission(submission("f", "f:linked", lead, List.of("a0R1"), true));
        recorder.recordSubmission(submission("f", "f:unlinked", lead, List.of(), true));
        recorder.recordSubmission(submission("f", "f:plain", List.of(), List.of(), true));

        List<AuditModels.SubmissionLogRow> failed = recorder.failedRelationships(50);

        assertEquals(1, failed.size());
        assertEquals("f:unlinked", failed.get(0).contextId());
        assertTrue(failed.get(0).businessRecordIds().contains("00Q1"));
    }

    @Test
    void errorsIncludeFailedStatusesAndMessages() {
        recorder.recordApiCall(new AuditModels.ApiCallAudit("GET", "/forms/f", 200, 5, null, Map.of("formId", "f"), null, null, "f", "agent", "127.0.0.1"));
        recorder.recordApiCall(new AuditModels.ApiCallAudit("POST", "/forms/f/submit", 503, 7, Map.of("access_token", "secret"), null,
                "Нет подключения к CRM", "f:1", "f", null, null));
        recorder.recordApiCall(new AuditModels.ApiCallAudit("POST", "/sessions", 200, 3, "x".repeat(1000), null,
                "warning text", null, null, null, null));

        List<AuditModels.ApiLogRow> errors = recorder.errors(50);

        assertEquals(2, errors.size());
        AuditModels.ApiLogRow failed = errors.stream().filter(e -> e.statusCode() == 503).findFirst().orElseThrow();
        assertFalse(failed.requestBody().contains("secret"), "TEST_EXPECTED: чувствительные данные маскируются");
        AuditModels.ApiLogRow large = errors.stream().filter(e -> e.statusCode() == 200).findFirst().orElseThrow();
        assertEquals(200, large.requestBody().length(), "TEST_EXPECTED: тело обрезано");
    }

    @Test
    void sweepRemovesExpiredRows() {
        recorder.recordSubmission(submission("f", "f:old", List.of(), List.of(), true));
        recorder.recordApiCall(new AuditModels.ApiCallAudit("GET", "/forms/f", 500, 1, null, null, "x", null, "f", null, null));
        clock.advance(Duration.ofHours(23));
        recorder.recordSubmission(submission("f", "f:new", List.of(), List.of(), true));
        clock.advance(Duration.ofHours(2));

        assertEquals(2, recorder.sweep());
        assertEquals(1, recorder.recentSubmissions(10).size());
        assertTrue(recorder.errors(10).isEmpty());
    }

    @Test
    void disabledRecorderWritesNothing() {
        props.getAudit().setEnabled(false);
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:audit-off-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        Flyway.configure().dataSource(ds).load().migrate();
        JdbcAuditRecorder off = new JdbcAuditRecorder(ds, new ObjectMapper(), props, clock);

        off.recordSubmission(submission("f", "f:1", List.of(), List.of(), true));

        assertTrue(off.recentSubmissions(10).isEmpty());
    }
}

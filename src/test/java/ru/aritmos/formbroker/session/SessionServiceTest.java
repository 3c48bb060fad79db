package ru.aritmos.formbroker.session;

import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.MutableClock;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.context.ContextIds;
import ru.aritmos.formbroker.core.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionServiceTest {

    private static final String SESSION = "550e8400-e29b-41d4-a716-446655440000";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-10T10:00:00Z"));
    private final SessionService service = new SessionService(new InMemorySessionStore(), new FormBrokerProperties(), clock);

    @Test
    void createsSessionWithFixedExpiry() {
        FormSession s = service.create("contact-form", null);

        assertTrue(ContextIds.isUuidV4(s.sessionId()));
        assertEquals("contact-form:" + s.sessionId(), s.contextId());
        assertEquals(clock.instant().plus(Duration.ofHours(24)), s.expiresAt());
    }

    @Test
    void activityDoesNotExtendLifetime() {
        FormSession s = service.create("contact-form", SESSION);
        clock.advance(Duration.ofHours(20));
        FormSession read = service.get(SESSION).orElseThrow();

        assertEquals(clock.instant(), read.lastActivity(), "TEST_EXPECTED: lastActivity обновлён");
        assertEquals(s.expiresAt(), read.expiresAt(), "TEST_EXPECTED: срок жизни не продлевается");

        clock.advance(Duration.ofHours(5));
        assertTrue(service.get(SESSION).isEmpty(), "TEST_EXPECTED: истёкшая сессия не возвращается");
        assertFalse(service.delete(SESSION), "TEST_EXPECTED: истёкшая сессия удалена при чтении");
    }

    @Test
    void sessionIsReachableUntilExactlyTtlAndGoneRightAfter() {
        FormSession s = service.create("contact-form", SESSION);

        clock.advance(Duration.ofHours(24));
        assertEquals(s.createdAt().plus(Duration.ofHours(24)), clock.instant());
        assertTrue(service.get(SESSION).isPresent(), "TEST_EXPECTED: сессия доступна ровно в момент истечения");

        clock.advance(Duration.ofMillis(1));
        assertTrue(service.get(SESSION).isEmpty(), "TEST_EXPECTED: сессия недоступна сразу после истечения");
    }

    @Test
    void concurrentCreateForDifferentFormsKeepsSingleOwner() throws Exception {
        CyclicBarrier bothChecked = new CyclicBarrier(2);
        InMemorySessionStore store = new InMemorySessionStore() {
            @Override
            public FormSession putIfAbsent(FormSession session, Instant now) {
                try {
                    bothChecked.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
                return super.putIfAbsent(session, now);
            }
        };
        SessionService racing = new SessionService(store, new FormBrokerProperties(), clock);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<FormSession> a = pool.submit(() -> racing.create("form-a", SESSION));
            Future<FormSession> b = pool.submit(() -> racing.create("form-b", SESSION));

            List<String> owners = new ArrayList<>();
            int rejected = 0;
            for (Future<FormSession> f : List.of(a, b)) {
                try {
                    owners.add(f.get(10, TimeUnit.SECONDS).formId());
                } catch (ExecutionException e) {
                    ValidationException v = assertInstanceOf(ValidationException.class, e.getCause());
                    assertEquals(ContextIds.FORM_ID_MISMATCH, v.code());
                    rejected++;
                }
            }

            assertEquals(1, owners.size(), "TEST_EXPECTED: только один вызов получает живую сессию");
            assertEquals(1, rejected, "TEST_EXPECTED: второй вызов отклонён");
            assertEquals(owners.get(0), store.get(SESSION).orElseThrow().formId(),
                    "TEST_EXPECTED: возвращённая сессия совпадает с сохранённой");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void createReplacesExpiredSession() {
        service.create("contact-form", SESSION);
        clock.advance(Duration.ofHours(25));

        FormSession fresh = service.create("other-form", SESSION);

        assertEquals("other-form", fresh.formId());
        assertEquals(clock.instant(), fresh.createdAt());
    }

    @Test
    void createReturnsExistingLiveSession() {
        FormSession first = service.create("contact-form", SESSION);
        service.update(SESSION, Map.of("email", "a@b.c"), null);

        FormSession again = service.create("contact-form", SESSION);

        assertEquals(first.createdAt(), again.createdAt());
        assertEquals("a@b.c", again.formData().get("email"));
    }

    @Test
    void sessionOfAnotherFormIsRejected() {
        service.create("contact-form", SESSION);

        ValidationException e = assertThrows(ValidationException.class, () -> service.create("other-form", SESSION));
        assertEquals(ContextIds.FORM_ID_MISMATCH, e.code());
        assertTrue(service.getByContextId("other-form:" + SESSION).isEmpty());
        assertTrue(service.getByContextId("contact-form:" + SESSION).isPresent());
    }

    @Test
    void invalidIdsFailBeforeLookup() {
        assertThrows(ValidationException.class, () -> service.get("123"));
        assertThrows(ValidationException.class, () -> service.create("bad:form", null));
        assertThrows(ValidationException.class, () -> service.create("contact-form", "not-a-uuid"));
    }

    @Test
    void updateMergesFormDataAndAgentContext() {
        service.create("contact-form", SESSION);
        service.update(SESSION, Map.of("firstName", "John", "email", "old@x.io"), Map.of("step", 1));
        FormSession s = service.update(SESSION, Map.of("email", "new@x.io"), Map.of("step", 2)).orElseThrow();

        assertEquals("John", s.formData().get("firstName"));
        assertEquals("new@x.io", s.formData().get("email"));
        assertEquals(2, s.agentContext().get("step"));
        assertTrue(service.update(ContextIds.newSessionId(), Map.of("a", 1), null).isEmpty());
    }

    @Test
    void sweepRemovesExpiredSessions() {
        service.create("contact-form", SESSION);
        clock.advance(Duration.ofHours(12));
        FormSession young = service.create("contact-form", null);
        clock.advance(Duration.ofHours(13));

        assertEquals(1, service.sweep());
        assertTrue(service.get(young.sessionId()).isPresent());
    }
}

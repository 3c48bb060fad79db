package ru.aritmos.formbroker.session;

import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.context.ContextIds;
import ru.aritmos.formbroker.context.ContextRef;
import ru.aritmos.formbroker.core.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Жизненный цикл сессий форм.
 * <p>
 * Правила:
 * <ul>
 *   <li>sessionId проверяется как UUIDv4 до обращения к хранилищу;</li>
 *   <li>сессия живёт фиксированный срок от создания, чтение обновляет только lastActivity;</li>
 *   <li>просроченная сессия удаляется при чтении и фоновой очисткой раз в час.</li>
 * </ul>
 */
@Singleton
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionStore store;
    private final Clock clock;
    private final Duration ttl;

    public SessionService(SessionStore store, FormBrokerProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.ttl = Duration.ofHours(Math.max(1, properties.getSessions().getTtlHours()));
    }

    /**
     * Создать сессию формы.
     * <p>
     * Если передан sessionId живой сессии той же формы, возвращается существующая сессия.
     *
     * @param formId идентификатор формы
     * @param sessionId UUIDv4 сессии или null для генерации нового
     * @return созданная (или существующая) сессия
     */
    public FormSession create(String formId, String sessionId) {
        if (formId == null || formId.isBlank() || formId.contains(":")) {
            throw new ValidationException("INVALID_FORM_ID", "formId не задан или содержит недопустимый символ ':'");
        }
        String id = sessionId == null || sessionId.isBlank() ? ContextIds.newSessionId() : sessionId.trim();
        ContextIds.requireSessionId(id);

        Instant now = clock.instant();
        FormSession candidate = new FormSession(id, formId, ContextIds.format(formId, id), now, now, now.plus(ttl), Map.of(), Map.of());
        FormSession stored = store.putIfAbsent(candidate, now);
        if (stored == candidate) {
            log.info("Создана сессия формы: formId={}, sessionId={}", formId, id);
            return candidate;
        }
        if (!stored.formId().equals(formId)) {
            throw new ValidationException(ContextIds.FORM_ID_MISMATCH,
                    "Сессия уже существует для другой формы",
                    Map.of("sessionId", id, "formId", formId));
        }
        return store.compute(id, s -> s.isExpired(now) ? null : s.touch(now)).orElse(stored);
    }

    /**
     * Получить живую сессию и обновить lastActivity.
     *
     * @param sessionId UUIDv4 сессии
     * @return сессия или пусто, если её нет либо она истекла (истёкшая сессия удаляется)
     */
    public Optional<FormSession> get(String sessionId) {
        ContextIds.requireSessionId(sessionId);
        Instant now = clock.instant();
        Optional<FormSession> touched = store.compute(sessionId, s -> s.isExpired(now) ? null : s.touch(now));
        if (touched.isEmpty()) {
            log.debug("Сессия не найдена или истекла: sessionId={}", sessionId);
        }
        return touched;
    }

    /**
     * Получить сессию по contextId.
     * <p>
     * formId из contextId должен совпадать с formId сессии.
     */
    public Optional<FormSession> getByContextId(String contextId) {
        ContextRef ref = ContextIds.parse(contextId);
        return get(ref.sessionId()).filter(s -> s.formId().equals(ref.formId()));
    }

    /**
     * Обновить данные формы и/или контекст агента живой сессии.
     *
     * @return обновлённая сессия или пусто, если сессии нет
     */
    public Optional<FormSession> update(String sessionId, Map<String, Object> formData, Map<String, Object> agentContext) {
        ContextIds.requireSessionId(sessionId);
        Instant now = clock.instant();
        return store.compute(sessionId, s -> s.isExpired(now) ? null : s.merge(formData, agentContext, now));
    }

    public boolean delete(String sessionId) {
        ContextIds.requireSessionId(sessionId);
        boolean removed = store.delete(sessionId);
        if (removed) {
            log.info("Сессия формы удалена: sessionId={}", sessionId);
        }
        return removed;
    }

    /**
     * Удалить все истёкшие сессии.
     *
     * @return количество удалённых сессий
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = store.removeIf(s -> s.isExpired(now));
        if (removed > 0) {
            log.info("Очистка сессий форм: удалено {}", removed);
        }
        return removed;
    }

    @Scheduled(fixedDelay = "${formbroker.sessions.sweep-interval:1h}", initialDelay = "${formbroker.sessions.sweep-interval:1h}")
    void scheduledSweep() {
        sweep();
    }
}

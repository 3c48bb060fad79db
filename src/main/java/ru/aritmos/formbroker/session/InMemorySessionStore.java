package ru.aritmos.formbroker.session;

import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-memory хранилище сессий форм.
 * <p>
 * Данные теряются при перезапуске процесса.
 */
@Singleton
public class InMemorySessionStore implements SessionStore {

    private final Map<String, FormSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<FormSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void put(FormSession session) {
        sessions.put(session.sessionId(), session);
    }

    @Override
    public FormSession putIfAbsent(FormSession session, Instant now) {
        return sessions.compute(session.sessionId(), (id, current) ->
                current == null || current.isExpired(now) ? session : current);
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public Optional<FormSession> compute(String sessionId, UnaryOperator<FormSession> update) {
        return Optional.ofNullable(sessions.computeIfPresent(sessionId, (id, current) -> update.apply(current)));
    }

    @Override
    public Collection<FormSession> values() {
        return List.copyOf(sessions.values());
    }

    @Override
    public int removeIf(Predicate<FormSession> condition) {
        AtomicInteger removed = new AtomicInteger();
        sessions.values().removeIf(s -> {
            if (condition.test(s)) {
                removed.incrementAndGet();
                return true;
            }
            return false;
        });
        return removed.get();
    }
}

package ru.aritmos.formbroker.auth;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Хранилище токен-сессий.
 * <p>
 * Все изменяющие операции, кроме {@link #touch(String, long)}, сохраняются немедленно.
 */
public interface TokenStore {

    Optional<AuthModels.TokenSession> get(String sessionId);

    /**
     * Найти токен-сессию по contextId (самую свежую, если их несколько).
     */
    Optional<AuthModels.TokenSession> findByContextId(String contextId);

    void put(AuthModels.TokenSession session);

    boolean delete(String sessionId);

    int removeIf(Predicate<AuthModels.TokenSession> condition);

    /**
     * Обновить момент последнего обращения без немедленного сохранения.
     */
    void touch(String sessionId, long nowEpochMs);

    List<AuthModels.TokenSession> all();
}

package ru.aritmos.formbroker.auth;

import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ConnectionException;
import ru.aritmos.formbroker.core.SensitiveDataSanitizer;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Управление токен-сессиями OAuth: сохранение, выдача действующего access token и обновление.
 * <p>
 * Обновление токена выполняется в режиме single-flight: для одной токен-сессии одновременно идёт
 * не более одного запроса refresh, остальные потоки дожидаются его результата.
 * <p>
 * Неудачное обновление удаляет токен-сессию: пользователь должен пройти авторизацию заново.
 */
@Singleton
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private final TokenStore store;
    private final OAuthClient oauthClient;
    private final Clock clock;
    private final Duration refreshSkew;
    private final Duration maxIdle;
    private final long defaultExpiresInSec;
    private final Map<String, CompletableFuture<String>> refreshes = new ConcurrentHashMap<>();

    public TokenManager(TokenStore store, OAuthClient oauthClient, FormBrokerProperties properties, Clock clock) {
        this.store = store;
        this.oauthClient = oauthClient;
        this.clock = clock;
        FormBrokerProperties.Tokens cfg = properties.getTokens();
        this.refreshSkew = Duration.ofSeconds(Math.max(0, cfg.getRefreshSkewSec()));
        this.maxIdle = Duration.ofHours(Math.max(1, cfg.getMaxIdleHours()));
        this.defaultExpiresInSec = Math.max(60, cfg.getDefaultExpiresInSec());
    }

    /**
     * Сохранить токены, полученные по завершении OAuth-авторизации.
     * <p>
     * Предыдущие токен-сессии с тем же contextId удаляются.
     *
     * @param contextId contextId пользователя или contextId сервисной учётной записи
     * @param tokens ответ token endpoint
     * @return созданная токен-сессия
     */
    public AuthModels.TokenSession storeTokens(String contextId, AuthModels.TokenResponse tokens) {
        long now = clock.millis();
        store.removeIf(s -> contextId != null && contextId.equals(s.contextId()));
        AuthModels.TokenSession session = new AuthModels.TokenSession(
                UUID.randomUUID().toString(),
                contextId,
                toTokenData(tokens, null, now),
                tokens.userId(),
                now,
                now
        );
        store.put(session);
        log.info("Сохранена токен-сессия: contextId={}, sessionId={}, token={}",
                contextId, session.sessionId(), SensitiveDataSanitizer.maskToken(tokens.accessToken()));
        return session;
    }

    public Optional<AuthModels.TokenSession> findByContextId(String contextId) {
        return store.findByContextId(contextId);
    }

    public Optional<AuthModels.TokenSession> getSession(String sessionId) {
        return store.get(sessionId);
    }

    /**
     * Получить действующий access token.
     * <p>
     * Если до истечения токена осталось меньше {@code refresh-skew-sec}, выполняется обновление.
     *
     * @param sessionId идентификатор токен-сессии
     * @return access token или пусто, если сессии нет либо обновление не удалось
     */
    public Optional<String> getValidAccessToken(String sessionId) {
        AuthModels.TokenSession session = store.get(sessionId).orElse(null);
        if (session == null) {
            return Optional.empty();
        }
        long now = clock.millis();
        store.touch(sessionId, now);
        if (isFresh(session.tokenData(), now)) {
            return Optional.of(session.tokenData().accessToken());
        }

        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> inFlight = refreshes.putIfAbsent(sessionId, mine);
        if (inFlight != null) {
            return await(sessionId, inFlight);
        }
        try {
            mine.complete(refresh(sessionId));
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
        } finally {
            refreshes.remove(sessionId, mine);
        }
        return await(sessionId, mine);
    }

    /**
     * Удалить токен-сессии, к которым не обращались дольше {@code max-idle-hours}.
     *
     * @return количество удалённых сессий
     */
    public int sweep() {
        long cutoff = clock.millis() - maxIdle.toMillis();
        int removed = store.removeIf(s -> s.lastAccessedEpochMs() < cutoff);
        if (removed > 0) {
            log.info("Очистка токен-сессий: удалено {}", removed);
        }
        return removed;
    }

    @Scheduled(fixedDelay = "${formbroker.tokens.sweep-interval:1h}", initialDelay = "${formbroker.tokens.sweep-interval:1h}")
    void scheduledSweep() {
        sweep();
    }

    private String refresh(String sessionId) {
        AuthModels.TokenSession session = store.get(sessionId).orElseThrow(() ->
                new ConnectionException("TOKEN_SESSION_NOT_FOUND", "Токен-сессия не найдена", Map.of("tokenSessionId", sessionId)));
        long now = clock.millis();
        // токен мог быть обновлён предыдущим запросом, завершившимся между проверкой и захватом
        if (isFresh(session.tokenData(), now)) {
            return session.tokenData().accessToken();
        }
        String refreshToken = session.tokenData().refreshToken();
        if (refreshToken == null || refreshToken.isBlank()) {
            store.delete(sessionId);
            throw new ConnectionException("REFRESH_TOKEN_MISSING", "Токен истёк, refresh token отсутствует",
                    Map.of("contextId", String.valueOf(session.contextId())));
        }
        try {
            AuthModels.TokenResponse response = oauthClient.refresh(refreshToken);
            AuthModels.TokenData data = toTokenData(response, session.tokenData(), clock.millis());
            store.put(session.withTokenData(data, clock.millis()));
            log.info("Access token обновлён: contextId={}, token={}",
                    session.contextId(), SensitiveDataSanitizer.maskToken(data.accessToken()));
            return data.accessToken();
        } catch (RuntimeException e) {
            store.delete(sessionId);
            log.warn("Не удалось обновить access token, токен-сессия удалена: contextId={}, error={}",
                    session.contextId(), e.getMessage());
            throw e;
        }
    }

    private Optional<String> await(String sessionId, CompletableFuture<String> future) {
        try {
            return Optional.ofNullable(future.join());
        } catch (CompletionException e) {
            log.debug("Обновление токена завершилось ошибкой: tokenSessionId={}, error={}",
                    sessionId, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return Optional.empty();
        }
    }

    private boolean isFresh(AuthModels.TokenData data, long nowMs) {
        return data != null && data.accessToken() != null && nowMs < data.expiresAtEpochMs() - refreshSkew.toMillis();
    }

    private AuthModels.TokenData toTokenData(AuthModels.TokenResponse response, AuthModels.TokenData previous, long nowMs) {
        long expiresIn = response.expiresInSec() == null || response.expiresInSec() <= 0 ? defaultExpiresInSec : response.expiresInSec();
        String refreshToken = response.refreshToken() != null ? response.refreshToken() : previous == null ? null : previous.refreshToken();
        String instanceUrl = response.instanceUrl() != null ? response.instanceUrl() : previous == null ? null : previous.instanceUrl();
        return new AuthModels.TokenData(
                response.accessToken(),
                refreshToken,
                response.tokenType() == null ? "Bearer" : response.tokenType(),
                response.scope(),
                instanceUrl,
                nowMs,
                nowMs + expiresIn * 1000L
        );
    }
}

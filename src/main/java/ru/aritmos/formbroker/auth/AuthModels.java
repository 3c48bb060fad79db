package ru.aritmos.formbroker.auth;

/**
 * Модели OAuth-подключения к CRM.
 */
public final class AuthModels {

    private AuthModels() {
        // утилитарный класс
    }

    /**
     * Токены доступа к CRM.
     *
     * @param accessToken access token
     * @param refreshToken refresh token (может отсутствовать)
     * @param tokenType тип токена, обычно Bearer
     * @param scope выданные права
     * @param instanceUrl адрес экземпляра CRM для REST-вызовов
     * @param issuedAtEpochMs момент выдачи
     * @param expiresAtEpochMs момент истечения access token
     */
    public record TokenData(
            String accessToken,
            String refreshToken,
            String tokenType,
            String scope,
            String instanceUrl,
            long issuedAtEpochMs,
            long expiresAtEpochMs
    ) {
    }

    /**
     * Токен-сессия: OAuth-токены, привязанные к contextId.
     * <p>
     * Сохраняется в JSON-файл, поэтому поля только простые.
     */
    public record TokenSession(
            String sessionId,
            String contextId,
            TokenData tokenData,
            String userId,
            long createdAtEpochMs,
            long lastAccessedEpochMs
    ) {

        public TokenSession withTokenData(TokenData data, long nowMs) {
            return new TokenSession(sessionId, contextId, data, userId, createdAtEpochMs, nowMs);
        }

        public TokenSession touch(long nowMs) {
            return new TokenSession(sessionId, contextId, tokenData, userId, createdAtEpochMs, nowMs);
        }
    }

    /**
     * Ответ token endpoint сервера авторизации.
     *
     * @param expiresInSec время жизни access token в секундах или null, если сервер его не вернул
     */
    public record TokenResponse(
            String accessToken,
            String refreshToken,
            String tokenType,
            String scope,
            String instanceUrl,
            String userId,
            Long expiresInSec
    ) {
    }
}

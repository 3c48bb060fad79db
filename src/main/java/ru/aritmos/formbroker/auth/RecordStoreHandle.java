package ru.aritmos.formbroker.auth;

/**
 * Аутентифицированное подключение к CRM для выполнения REST-вызовов.
 *
 * @param instanceUrl адрес экземпляра CRM (нормализованный)
 * @param accessToken действующий access token
 * @param source источник подключения
 * @param tokenSessionId токен-сессия, из которой получен токен
 */
public record RecordStoreHandle(String instanceUrl, String accessToken, Source source, String tokenSessionId) {

    /**
     * Источник подключения.
     */
    public enum Source {
        /** OAuth-сессия пользователя, привязанная к contextId */
        USER,
        /** общая сервисная учётная запись */
        SERVICE_ACCOUNT
    }

    @Override
    public String toString() {
        return "RecordStoreHandle{instanceUrl=" + instanceUrl + ", source=" + source + ", tokenSessionId=" + tokenSessionId + "}";
    }
}

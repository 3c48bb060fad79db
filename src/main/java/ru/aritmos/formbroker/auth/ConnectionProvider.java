package ru.aritmos.formbroker.auth;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ConnectionException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Выбор подключения к CRM для запроса.
 * <p>
 * Порядок:
 * <ol>
 *   <li>OAuth-сессия пользователя, найденная по contextId;</li>
 *   <li>общая сервисная учётная запись (токен-сессия с contextId из
 *       {@code formbroker.record-store.service-account-context-id}), ищется при первом обращении.</li>
 * </ol>
 * Подключение без адреса экземпляра CRM не возвращается никогда.
 */
@Singleton
public class ConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(ConnectionProvider.class);

    private final TokenManager tokenManager;
    private final String serviceAccountContextId;
    private final AtomicReference<String> serviceAccountSessionId = new AtomicReference<>();

    public ConnectionProvider(TokenManager tokenManager, FormBrokerProperties properties) {
        this.tokenManager = tokenManager;
        this.serviceAccountContextId = properties.getRecordStore().getServiceAccountContextId();
    }

    /**
     * Получить подключение для запроса.
     *
     * @param contextId contextId пользователя или null
     * @return подключение к CRM
     * @throws ConnectionException если нет ни пользовательской, ни сервисной токен-сессии
     */
    public RecordStoreHandle resolve(String contextId) {
        if (contextId != null && !contextId.isBlank() && !contextId.equals(serviceAccountContextId)) {
            Optional<AuthModels.TokenSession> user = tokenManager.findByContextId(contextId);
            if (user.isPresent()) {
                Optional<RecordStoreHandle> handle = toHandle(user.get(), RecordStoreHandle.Source.USER);
                if (handle.isPresent()) {
                    return handle.get();
                }
                log.info("Пользовательская токен-сессия недействительна, используется сервисная учётная запись: contextId={}", contextId);
            }
        }
        return serviceAccount().orElseThrow(() -> new ConnectionException("NO_CONNECTION",
                "Нет подключения к CRM: требуется авторизация пользователя или сервисной учётной записи",
                contextId == null ? Map.of() : Map.of("contextId", contextId)));
    }

    public boolean isServiceAccountConnected() {
        return serviceAccount().isPresent();
    }

    private Optional<RecordStoreHandle> serviceAccount() {
        String cached = serviceAccountSessionId.get();
        if (cached != null) {
            Optional<AuthModels.TokenSession> session = tokenManager.getSession(cached);
            if (session.isPresent()) {
                Optional<RecordStoreHandle> handle = toHandle(session.get(), RecordStoreHandle.Source.SERVICE_ACCOUNT);
                if (handle.isPresent()) {
                    return handle;
                }
            }
            serviceAccountSessionId.compareAndSet(cached, null);
        }

        Optional<AuthModels.TokenSession> found = tokenManager.findByContextId(serviceAccountContextId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Optional<RecordStoreHandle> handle = toHandle(found.get(), RecordStoreHandle.Source.SERVICE_ACCOUNT);
        if (handle.isPresent() && serviceAccountSessionId.compareAndSet(null, found.get().sessionId())) {
            log.info("Подключение сервисной учётной записи инициализировано: instanceUrl={}", handle.get().instanceUrl());
        }
        return handle;
    }

    private Optional<RecordStoreHandle> toHandle(AuthModels.TokenSession session, RecordStoreHandle.Source source) {
        Optional<String> token = tokenManager.getValidAccessToken(session.sessionId());
        if (token.isEmpty()) {
            return Optional.empty();
        }
        // после обновления instance_url берётся из актуальной версии сессии
        AuthModels.TokenSession current = tokenManager.getSession(session.sessionId()).orElse(session);
        String instanceUrl = normalizeInstanceUrl(current.tokenData().instanceUrl());
        if (instanceUrl == null) {
            throw new ConnectionException("MISSING_INSTANCE_URL",
                    "Токен-сессия не содержит адреса экземпляра CRM",
                    Map.of("contextId", String.valueOf(current.contextId()), "source", source.name()));
        }
        return Optional.of(new RecordStoreHandle(instanceUrl, token.get(), source, current.sessionId()));
    }

    /**
     * Привести адрес экземпляра к домену REST API: {@code .my.salesforce-setup.com} и {@code .my.site.com}
     * заменяются на {@code .my.salesforce.com}, завершающий слэш убирается.
     */
    public static String normalizeInstanceUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String u = url.trim()
                .replace(".my.salesforce-setup.com", ".my.salesforce.com")
                .replace(".my.site.com", ".my.salesforce.com");
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}

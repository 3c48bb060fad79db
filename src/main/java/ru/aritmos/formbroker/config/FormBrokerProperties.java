package ru.aritmos.formbroker.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

/**
 * Конфигурация Form Broker (префикс {@code formbroker}).
 * <p>
 * Секции:
 * <ul>
 *   <li>{@code record-store}: подключение к CRM (OAuth, версия REST API, объекты трекинга);</li>
 *   <li>{@code tokens}: хранение и обновление OAuth-сессий;</li>
 *   <li>{@code sessions}: время жизни сессий форм;</li>
 *   <li>{@code audit}: журнал аудита;</li>
 *   <li>{@code submission}: поведение оркестратора отправок.</li>
 * </ul>
 * <p>
 * Значения по умолчанию позволяют поднять сервис локально; client-id/client-secret обязательно
 * задаются через переменные окружения в рабочих контурах.
 */
@Introspected
@ConfigurationProperties("formbroker")
public class FormBrokerProperties {

    private RecordStore recordStore = new RecordStore();
    private Tokens tokens = new Tokens();
    private Sessions sessions = new Sessions();
    private Audit audit = new Audit();
    private Submission submission = new Submission();

    public RecordStore getRecordStore() {
        return recordStore;
    }

    public void setRecordStore(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    public Tokens getTokens() {
        return tokens;
    }

    public void setTokens(Tokens tokens) {
        this.tokens = tokens;
    }

    public Sessions getSessions() {
        return sessions;
    }

    public void setSessions(Sessions sessions) {
        this.sessions = sessions;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Submission getSubmission() {
        return submission;
    }

    public void setSubmission(Submission submission) {
        this.submission = submission;
    }

    /**
     * Подключение к CRM.
     */
    @Introspected
    @ConfigurationProperties("record-store")
    public static class RecordStore {
        /** адрес сервера авторизации */
        private String loginUrl = "https://login.salesforce.com";
        private String clientId;
        private String clientSecret;
        private String redirectUri = "http://localhost:8080/oauth/callback";
        /** версия REST API, подставляется в путь /services/data/v{apiVersion} */
        private String apiVersion = "58.0";
        private int httpTimeoutMs = 15000;
        /** contextId, под которым хранится токен-сессия сервисной учётной записи */
        private String serviceAccountContextId = "service_account";
        private String formDefinitionObject = "Form_Definition__c";
        private String trackingObject = "Form_Submission__c";
        private String relationshipObject = "Form_Submission_Relationship__c";

        public String getLoginUrl() {
            return loginUrl;
        }

        public void setLoginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getRedirectUri() {
            return redirectUri;
        }

        public void setRedirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public int getHttpTimeoutMs() {
            return httpTimeoutMs;
        }

        public void setHttpTimeoutMs(int httpTimeoutMs) {
            this.httpTimeoutMs = httpTimeoutMs;
        }

        public String getServiceAccountContextId() {
            return serviceAccountContextId;
        }

        public void setServiceAccountContextId(String serviceAccountContextId) {
            this.serviceAccountContextId = serviceAccountContextId;
        }

        public String getFormDefinitionObject() {
            return formDefinitionObject;
        }

        public void setFormDefinitionObject(String formDefinitionObject) {
            this.formDefinitionObject = formDefinitionObject;
        }

        public String getTrackingObject() {
            return trackingObject;
        }

        public void setTrackingObject(String trackingObject) {
            this.trackingObject = trackingObject;
        }

        public String getRelationshipObject() {
            return relationshipObject;
        }

        public void setRelationshipObject(String relationshipObject) {
            this.relationshipObject = relationshipObject;
        }
    }

    /**
     * OAuth-сессии.
     */
    @Introspected
    @ConfigurationProperties("tokens")
    public static class Tokens {
        /** JSON-файл с токен-сессиями; пустое значение отключает сохранение на диск */
        private String storageFile = "data/oauth-sessions.json";
        /** за сколько секунд до истечения access token выполняется обновление */
        private long refreshSkewSec = 300;
        /** простой, после которого токен-сессия удаляется */
        private long maxIdleHours = 24;
        /** срок, после которого записи отбрасываются при загрузке файла */
        private long maxAgeHours = 24;
        /** используется, если сервер авторизации не вернул expires_in */
        private long defaultExpiresInSec = 3600;

        public String getStorageFile() {
            return storageFile;
        }

        public void setStorageFile(String storageFile) {
            this.storageFile = storageFile;
        }

        public long getRefreshSkewSec() {
            return refreshSkewSec;
        }

        public void setRefreshSkewSec(long refreshSkewSec) {
            this.refreshSkewSec = refreshSkewSec;
        }

        public long getMaxIdleHours() {
            return maxIdleHours;
        }

        public void setMaxIdleHours(long maxIdleHours) {
            this.maxIdleHours = maxIdleHours;
        }

        public long getMaxAgeHours() {
            return maxAgeHours;
        }

        public void setMaxAgeHours(long maxAgeHours) {
            this.maxAgeHours = maxAgeHours;
        }

        public long getDefaultExpiresInSec() {
            return defaultExpiresInSec;
        }

        public void setDefaultExpiresInSec(long defaultExpiresInSec) {
            this.defaultExpiresInSec = defaultExpiresInSec;
        }
    }

    /**
     * Сессии форм.
     */
    @Introspected
    @ConfigurationProperties("sessions")
    public static class Sessions {
        /** фиксированное время жизни сессии от момента создания */
        private long ttlHours = 24;

        public long getTtlHours() {
            return ttlHours;
        }

        public void setTtlHours(long ttlHours) {
            this.ttlHours = ttlHours;
        }
    }

    /**
     * Журнал аудита.
     */
    @Introspected
    @ConfigurationProperties("audit")
    public static class Audit {
        private boolean enabled = true;
        private long retentionHours = 24;
        /** максимальная длина тела запроса/ответа, сохраняемого в журнал */
        private int maxBodyLength = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getRetentionHours() {
            return retentionHours;
        }

        public void setRetentionHours(long retentionHours) {
            this.retentionHours = retentionHours;
        }

        public int getMaxBodyLength() {
            return maxBodyLength;
        }

        public void setMaxBodyLength(int maxBodyLength) {
            this.maxBodyLength = maxBodyLength;
        }
    }

    /**
     * Оркестратор отправок.
     */
    @Introspected
    @ConfigurationProperties("submission")
    public static class Submission {
        /** выполнять ли фоновую проверку созданной бизнес-записи повторным запросом */
        private boolean verifyBusinessRecord = true;

        public boolean isVerifyBusinessRecord() {
            return verifyBusinessRecord;
        }

        public void setVerifyBusinessRecord(boolean verifyBusinessRecord) {
            this.verifyBusinessRecord = verifyBusinessRecord;
        }
    }
}

package ru.aritmos.formbroker.context;

/**
 * Разобранный contextId: идентификатор формы и UUID чат-сессии.
 *
 * @param formId идентификатор формы
 * @param sessionId UUIDv4 сессии
 */
public record ContextRef(String formId, String sessionId) {

    public String contextId() {
        return ContextIds.format(formId, sessionId);
    }
}

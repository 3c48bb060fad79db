package ru.aritmos.formbroker.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Базовое исключение Form Broker.
 * <p>
 * Несёт категорию ({@link ErrorType}), машинно-читаемый код и контекст (formId, contextId, objectType и т.п.),
 * из которых контроллеры формируют тело ответа об ошибке.
 * <p>
 * Важно: контекст не должен содержать токенов и секретов, он попадает в ответ клиенту и в журнал.
 */
public class FormBrokerException extends RuntimeException {

    private final ErrorType type;
    private final String code;
    private final Map<String, Object> context;

    public FormBrokerException(ErrorType type, String code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.code = code;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public FormBrokerException(ErrorType type, String code, String message, Map<String, ?> context) {
        this(type, code, message, context, null);
    }

    public ErrorType type() {
        return type;
    }

    public String code() {
        return code;
    }

    public Map<String, Object> context() {
        return context;
    }

    /**
     * HTTP-статус ответа для данной ошибки.
     */
    public int httpStatus() {
        return type.httpStatus();
    }

    /**
     * Признак того, что операцию имеет смысл повторить позже.
     */
    public boolean retryable() {
        return false;
    }
}

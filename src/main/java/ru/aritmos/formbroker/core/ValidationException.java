package ru.aritmos.formbroker.core;

import java.util.Map;

/**
 * Некорректный входной запрос (contextId, formId, тело запроса).
 */
public class ValidationException extends FormBrokerException {

    public ValidationException(String code, String message, Map<String, ?> context) {
        super(ErrorType.VALIDATION_ERROR, code, message, context);
    }

    public ValidationException(String code, String message) {
        this(code, message, Map.of());
    }
}

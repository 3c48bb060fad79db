package ru.aritmos.formbroker.core;

import java.util.Map;

/**
 * Запрошенная форма или сессия не найдена.
 */
public class NotFoundException extends FormBrokerException {

    public NotFoundException(String code, String message, Map<String, ?> context) {
        super(ErrorType.NOT_FOUND, code, message, context);
    }
}

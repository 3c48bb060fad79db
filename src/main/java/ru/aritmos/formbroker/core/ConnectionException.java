package ru.aritmos.formbroker.core;

import java.util.Map;

/**
 * Нет пригодного подключения к CRM либо сетевой сбой (таймаут, разрыв соединения).
 * <p>
 * Такие ошибки считаются повторяемыми.
 */
public class ConnectionException extends FormBrokerException {

    public ConnectionException(String code, String message, Map<String, ?> context, Throwable cause) {
        super(ErrorType.CONNECTION_ERROR, code, message, context, cause);
    }

    public ConnectionException(String code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

package ru.aritmos.formbroker.core;

import java.util.Map;

/**
 * Ошибка конфигурации формы: невалидный JSON в определении формы, пустая бизнес-запись после маппинга,
 * отсутствующие настройки подключения.
 */
public class ConfigurationException extends FormBrokerException {

    public ConfigurationException(String code, String message, Map<String, ?> context, Throwable cause) {
        super(ErrorType.CONFIGURATION_ERROR, code, message, context, cause);
    }

    public ConfigurationException(String code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }
}

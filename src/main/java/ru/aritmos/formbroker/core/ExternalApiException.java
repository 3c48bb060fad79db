package ru.aritmos.formbroker.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ошибка, возвращённая REST API CRM.
 * <p>
 * Классификация ({@link Kind}) выполняется по коду ошибки CRM и HTTP-статусу ответа:
 * <ul>
 *   <li>AUTH: INVALID_LOGIN, INVALID_CLIENT, INVALID_SESSION_ID, 401;</li>
 *   <li>PERMISSION: INSUFFICIENT_ACCESS, INVALID_FIELD, 403;</li>
 *   <li>QUERY: любая ошибка запроса, MALFORMED_QUERY, INVALID_QUERY_LOCATOR;</li>
 *   <li>CREATE: REQUIRED_FIELD_MISSING, INVALID_FIELD_FOR_INSERT при создании записи;</li>
 *   <li>CONNECTION: 502/503/504 (сервер CRM недоступен);</li>
 *   <li>GENERIC: всё остальное.</li>
 * </ul>
 */
public class ExternalApiException extends FormBrokerException {

    /**
     * Подкатегория ошибки внешнего API.
     */
    public enum Kind {
        AUTH,
        PERMISSION,
        QUERY,
        CREATE,
        CONNECTION,
        GENERIC
    }

    /**
     * Операция над CRM, во время которой произошла ошибка.
     */
    public enum Operation {
        AUTH,
        DESCRIBE,
        QUERY,
        CREATE
    }

    private final Kind kind;
    private final String externalCode;
    private final int externalStatus;

    public ExternalApiException(Kind kind, String externalCode, int externalStatus, String message, Map<String, ?> context) {
        super(ErrorType.EXTERNAL_API_ERROR, "EXTERNAL_" + kind.name(), message, withExternal(context, externalCode, externalStatus));
        this.kind = kind;
        this.externalCode = externalCode;
        this.externalStatus = externalStatus;
    }

    public Kind kind() {
        return kind;
    }

    public String externalCode() {
        return externalCode;
    }

    public int externalStatus() {
        return externalStatus;
    }

    @Override
    public int httpStatus() {
        return kind == Kind.CONNECTION ? 503 : ErrorType.EXTERNAL_API_ERROR.httpStatus();
    }

    @Override
    public boolean retryable() {
        return kind == Kind.CONNECTION;
    }

    /**
     * Построить исключение по ответу CRM.
     *
     * @param operation операция, во время которой получена ошибка
     * @param errorCode код ошибки CRM (может быть null)
     * @param httpStatus HTTP-статус ответа
     * @param message сообщение CRM
     * @param context контекст (objectType и т.п.)
     * @return классифицированное исключение
     */
    public static ExternalApiException classify(Operation operation, String errorCode, int httpStatus, String message, Map<String, ?> context) {
        Kind kind = classifyKind(operation, errorCode, httpStatus);
        String safe = SensitiveDataSanitizer.sanitizeText(message);
        String text = "Ошибка CRM при операции " + operation.name() + ": " + (safe == null || safe.isBlank() ? "HTTP " + httpStatus : safe);
        return new ExternalApiException(kind, errorCode, httpStatus, text, context);
    }

    static Kind classifyKind(Operation operation, String errorCode, int httpStatus) {
        String code = errorCode == null ? "" : errorCode.toUpperCase(Locale.ROOT);
        if (code.equals("INVALID_LOGIN") || code.equals("INVALID_CLIENT") || code.equals("INVALID_GRANT")
                || code.equals("INVALID_SESSION_ID") || httpStatus == 401 || operation == Operation.AUTH) {
            return Kind.AUTH;
        }
        if (code.equals("INSUFFICIENT_ACCESS") || code.equals("INVALID_FIELD") || httpStatus == 403) {
            return Kind.PERMISSION;
        }
        if (httpStatus == 502 || httpStatus == 503 || httpStatus == 504) {
            return Kind.CONNECTION;
        }
        if (operation == Operation.QUERY || code.equals("MALFORMED_QUERY") || code.equals("INVALID_QUERY_LOCATOR")) {
            return Kind.QUERY;
        }
        if (operation == Operation.CREATE || code.equals("REQUIRED_FIELD_MISSING") || code.startsWith("INVALID_FIELD_FOR_INSERT")) {
            return Kind.CREATE;
        }
        return Kind.GENERIC;
    }

    private static Map<String, Object> withExternal(Map<String, ?> context, String externalCode, int externalStatus) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (context != null) {
            out.putAll(context);
        }
        if (externalCode != null) {
            out.put("externalCode", externalCode);
        }
        if (externalStatus > 0) {
            out.put("externalStatus", externalStatus);
        }
        return out;
    }
}

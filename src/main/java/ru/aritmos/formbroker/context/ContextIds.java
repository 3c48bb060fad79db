package ru.aritmos.formbroker.context;

import ru.aritmos.formbroker.core.ValidationException;

import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Разбор и проверка contextId формата {@code {formId}:{sessionId}}.
 * <p>
 * contextId связывает отправку формы с чат-сессией агента и служит ключом де-дупликации записей трекинга,
 * поэтому проверяется до любого обращения к хранилищам.
 */
public final class ContextIds {

    public static final String INVALID_CONTEXT_ID = "INVALID_CONTEXT_ID";
    public static final String FORM_ID_MISMATCH = "FORM_ID_MISMATCH";
    public static final String INVALID_SESSION_ID = "INVALID_SESSION_ID";

    private static final Pattern UUID_V4 = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE);

    private ContextIds() {
        // утилитарный класс
    }

    /**
     * Разобрать contextId.
     *
     * @param contextId строка вида formId:sessionId
     * @return разобранная ссылка
     * @throws ValidationException если формат неверен или sessionId не является UUIDv4
     */
    public static ContextRef parse(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            throw new ValidationException(INVALID_CONTEXT_ID, "contextId не задан");
        }
        String[] parts = contextId.split(":", -1);
        if (parts.length != 2) {
            throw new ValidationException(INVALID_CONTEXT_ID,
                    "contextId должен иметь формат formId:sessionId", Map.of("contextId", contextId));
        }
        String formId = parts[0].trim();
        String sessionId = parts[1].trim();
        if (formId.isEmpty()) {
            throw new ValidationException(INVALID_CONTEXT_ID, "В contextId отсутствует formId", Map.of("contextId", contextId));
        }
        if (!isUuidV4(sessionId)) {
            throw new ValidationException(INVALID_CONTEXT_ID,
                    "sessionId в contextId должен быть UUIDv4", Map.of("contextId", contextId));
        }
        return new ContextRef(formId, sessionId);
    }

    /**
     * Разобрать contextId и убедиться, что он относится к ожидаемой форме.
     *
     * @param contextId строка вида formId:sessionId
     * @param expectedFormId formId из маршрута запроса
     * @return разобранная ссылка
     */
    public static ContextRef validate(String contextId, String expectedFormId) {
        ContextRef ref = parse(contextId);
        if (expectedFormId == null || !ref.formId().equals(expectedFormId)) {
            throw new ValidationException(FORM_ID_MISMATCH,
                    "formId в contextId не совпадает с formId запроса",
                    Map.of("contextId", contextId, "formId", String.valueOf(expectedFormId)));
        }
        return ref;
    }

    public static String format(String formId, String sessionId) {
        return formId + ":" + sessionId;
    }

    public static boolean isUuidV4(String value) {
        return value != null && UUID_V4.matcher(value).matches();
    }

    /**
     * Проверить идентификатор сессии до поиска в хранилище.
     */
    public static void requireSessionId(String sessionId) {
        if (!isUuidV4(sessionId)) {
            throw new ValidationException(INVALID_SESSION_ID, "sessionId должен быть UUIDv4",
                    Map.of("sessionId", String.valueOf(sessionId)));
        }
    }

    public static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}

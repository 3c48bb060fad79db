package ru.aritmos.formbroker.recordstore;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Locale;

/**
 * Модели REST API CRM.
 */
public final class RecordStoreModels {

    private RecordStoreModels() {
        // утилитарный класс
    }

    /**
     * Описание поля объекта CRM.
     *
     * @param name API-имя поля
     * @param label отображаемое имя
     * @param type тип поля
     * @param nillable допускает ли пустое значение
     * @param createable можно ли задать при создании
     * @param defaultedOnCreate заполняется ли автоматически при создании
     */
    public record FieldInfo(String name, String label, String type, boolean nillable, boolean createable, boolean defaultedOnCreate) {

        /**
         * Поле обязательно для создания записи.
         */
        public boolean requiredOnCreate() {
            return createable && !nillable && !defaultedOnCreate && !"boolean".equalsIgnoreCase(type);
        }
    }

    /**
     * Ссылка на запись CRM.
     *
     * @param id идентификатор записи
     * @param objectType тип объекта
     */
    @Serdeable
    @Schema(name = "RecordRef", description = "Ссылка на запись CRM")
    public record RecordRef(String id, String objectType) {
    }

    /**
     * Ошибка, возвращённая CRM для конкретной операции.
     */
    public record ApiError(String errorCode, String message, List<String> fields) {

        public ApiError {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        public boolean isDuplicateViolation() {
            String code = errorCode == null ? "" : errorCode.toUpperCase(Locale.ROOT);
            String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
            return code.contains("DUPLICATE") || msg.contains("duplicate");
        }

        public boolean mentions(String fieldName) {
            return fields.contains(fieldName) || (message != null && message.contains(fieldName));
        }
    }

    /**
     * Результат создания записи.
     *
     * @param success признак успеха
     * @param id идентификатор созданной записи (при успехе)
     * @param errors ошибки CRM (при неуспехе)
     */
    public record CreateResult(boolean success, String id, List<ApiError> errors) {

        public CreateResult {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }

        public static CreateResult ok(String id) {
            return new CreateResult(true, id, List.of());
        }

        public static CreateResult fail(List<ApiError> errors) {
            return new CreateResult(false, null, errors);
        }

        public boolean hasId() {
            return success && id != null && !id.isBlank();
        }

        /**
         * Нарушение уникальности, в том числе по указанному полю.
         */
        public boolean isDuplicateViolation(String fieldName) {
            return errors.stream().anyMatch(e -> e.isDuplicateViolation() || (fieldName != null && e.mentions(fieldName)));
        }

        public String describeErrors() {
            if (errors.isEmpty()) {
                return success ? "" : "CRM не вернула идентификатор записи";
            }
            StringBuilder sb = new StringBuilder();
            for (ApiError e : errors) {
                if (sb.length() > 0) {
                    sb.append("; ");
                }
                sb.append(e.errorCode()).append(": ").append(e.message());
                if (!e.fields().isEmpty()) {
                    sb.append(" ").append(e.fields());
                }
            }
            return sb.toString();
        }
    }
}

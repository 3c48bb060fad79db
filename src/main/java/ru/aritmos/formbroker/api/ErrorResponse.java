package ru.aritmos.formbroker.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * Тело ответа об ошибке.
 *
 * @param type класс ошибки (VALIDATION_ERROR, NOT_FOUND и т.д.)
 * @param code машиночитаемый код
 * @param message сообщение (санитизированное)
 * @param details дополнительные сведения
 * @param context контекст ошибки (formId, contextId, objectType и т.п.)
 * @param timestamp момент формирования ответа (ISO-8601)
 */
@Serdeable
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ErrorResponse", description = "Ошибка обработки запроса")
public record ErrorResponse(
        @Schema(description = "Класс ошибки") String type,
        @Schema(description = "Код ошибки") String code,
        @Schema(description = "Сообщение") String message,
        @Schema(description = "Дополнительные сведения") String details,
        @Schema(description = "Контекст ошибки") Map<String, Object> context,
        @Schema(description = "Момент формирования ответа") String timestamp
) {
}

package ru.aritmos.formbroker.submission;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import ru.aritmos.formbroker.recordstore.RecordStoreModels;

import java.util.List;
import java.util.Map;

/**
 * Модели отправки формы.
 */
public final class SubmissionModels {

    private SubmissionModels() {
        // утилитарный класс
    }

    /**
     * Тело запроса отправки формы.
     *
     * @param contextId contextId вида formId:sessionId (необязателен)
     * @param formData данные формы
     */
    @Serdeable
    @Schema(name = "SubmitRequest", description = "Отправка данных формы")
    public record SubmitRequest(
            @Schema(description = "contextId = formId:sessionId; при отсутствии дедупликация не выполняется") String contextId,
            @Schema(description = "Данные формы: имя поля → значение") Map<String, Object> formData
    ) {
    }

    /**
     * Счётчики для диагностики отправки.
     */
    @Serdeable
    @Schema(name = "SubmissionDebug", description = "Диагностические счётчики отправки")
    public record Debug(
            int businessRecordsCreated,
            int relationshipsCreated,
            boolean relationshipAttempted,
            boolean existingSubmission,
            List<String> unmappedFields
    ) {
    }

    /**
     * Результат отправки формы.
     *
     * @param success признак успешной фиксации отправки
     * @param trackingId идентификатор записи учёта отправки
     * @param businessRecordIds созданные бизнес-записи
     * @param relationshipIds записи связи учёта отправки с бизнес-записями
     * @param contextId contextId отправки
     * @param duplicate отправка с этим contextId уже была зафиксирована ранее
     * @param message текст результата
     * @param warning предупреждение о частичном сбое (необязательно)
     * @param debug диагностические счётчики
     * @param durationMs длительность обработки
     */
    @Serdeable
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(name = "SubmissionResult", description = "Результат отправки формы")
    public record SubmissionResult(
            boolean success,
            @Schema(description = "Идентификатор записи учёта отправки в CRM") String trackingId,
            List<RecordStoreModels.RecordRef> businessRecordIds,
            List<String> relationshipIds,
            String contextId,
            @JsonProperty("isDuplicate") boolean duplicate,
            String message,
            @Schema(description = "Предупреждение: отправка зафиксирована, но часть шагов не выполнена") String warning,
            Debug debug,
            long durationMs
    ) {

        public SubmissionResult {
            businessRecordIds = businessRecordIds == null ? List.of() : List.copyOf(businessRecordIds);
            relationshipIds = relationshipIds == null ? List.of() : List.copyOf(relationshipIds);
        }
    }
}

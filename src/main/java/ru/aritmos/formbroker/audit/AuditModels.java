package ru.aritmos.formbroker.audit;

import com.fasterxml.jackson.databind.JsonNode;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import ru.aritmos.formbroker.recordstore.RecordStoreModels;

import java.util.List;
import java.util.Map;

/**
 * Модели журнала аудита.
 */
public final class AuditModels {

    private AuditModels() {
        // утилитарный класс
    }

    /**
     * Итог отправки формы для журнала.
     *
     * @param formId идентификатор формы
     * @param contextId contextId отправки
     * @param trackingId идентификатор записи учёта отправки
     * @param businessRecords созданные бизнес-записи
     * @param relationshipIds идентификаторы записей связи
     * @param formData данные формы (после слияния с сессией)
     * @param mappingRules исходный JSON правил маппинга
     * @param success признак успеха
     * @param duplicate повторная отправка
     * @param errorMessage текст ошибки
     * @param warningMessage текст предупреждения
     * @param durationMs длительность обработки
     */
    public record SubmissionAudit(
            String formId,
            String contextId,
            String trackingId,
            List<RecordStoreModels.RecordRef> businessRecords,
            List<String> relationshipIds,
            Map<String, Object> formData,
            JsonNode mappingRules,
            boolean success,
            boolean duplicate,
            String errorMessage,
            String warningMessage,
            long durationMs
    ) {

        public SubmissionAudit {
            businessRecords = businessRecords == null ? List.of() : List.copyOf(businessRecords);
            relationshipIds = relationshipIds == null ? List.of() : List.copyOf(relationshipIds);
        }
    }

    /**
     * Вызов HTTP API брокера для журнала.
     */
    public record ApiCallAudit(
            String method,
            String path,
            int statusCode,
            long durationMs,
            Object requestBody,
            Object responseBody,
            String errorMessage,
            String contextId,
            String formId,
            String userAgent,
            String ipAddress
    ) {
    }

    @Serdeable
    @Schema(name = "ApiLogRow", description = "Запись журнала вызовов API")
    public record ApiLogRow(
            long id,
            String timestamp,
            String method,
            String path,
            Integer statusCode,
            Long durationMs,
            String requestBody,
            String responseBody,
            String errorMessage,
            String contextId,
            String formId,
            String userAgent,
            String ipAddress
    ) {
    }

    @Serdeable
    @Schema(name = "SubmissionLogRow", description = "Запись журнала отправок форм")
    public record SubmissionLogRow(
            long id,
            String timestamp,
            String formId,
            String contextId,
            String trackingId,
            String businessRecordIds,
            String relationshipIds,
            String formData,
            String mappingRules,
            boolean success,
            boolean duplicate,
            String errorMessage,
            String warningMessage,
            Long durationMs
    ) {
    }
}

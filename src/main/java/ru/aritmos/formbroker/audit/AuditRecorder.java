package ru.aritmos.formbroker.audit;

/**
 * Журнал аудита брокера.
 * <p>
 * Запись выполняется по принципу fire-and-forget: реализация не выбрасывает исключений,
 * сбой журнала не должен влиять на ответ клиенту.
 */
public interface AuditRecorder {

    void recordSubmission(AuditModels.SubmissionAudit audit);

    void recordApiCall(AuditModels.ApiCallAudit audit);
}

package ru.aritmos.formbroker.submission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.audit.AuditModels;
import ru.aritmos.formbroker.audit.AuditRecorder;
import ru.aritmos.formbroker.auth.ConnectionProvider;
import ru.aritmos.formbroker.auth.RecordStoreHandle;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.context.ContextIds;
import ru.aritmos.formbroker.context.ContextRef;
import ru.aritmos.formbroker.core.ConfigurationException;
import ru.aritmos.formbroker.core.ExternalApiException;
import ru.aritmos.formbroker.core.FormBrokerException;
import ru.aritmos.formbroker.core.ValidationException;
import ru.aritmos.formbroker.mapping.MappingEvaluator;
import ru.aritmos.formbroker.mapping.MappingModels;
import ru.aritmos.formbroker.mapping.MappingResolver;
import ru.aritmos.formbroker.recordstore.RecordStoreClient;
import ru.aritmos.formbroker.recordstore.RecordStoreClientFactory;
import ru.aritmos.formbroker.recordstore.RecordStoreModels;
import ru.aritmos.formbroker.recordstore.Soql;
import ru.aritmos.formbroker.session.FormSession;
import ru.aritmos.formbroker.session.SessionService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Оркестратор отправки формы.
 * <p>
 * Шаги выполняются строго по порядку:
 * <ol>
 *   <li><b>A</b> бизнес-запись (если в правилах задан тип объекта): пустая запись прерывает отправку
 *       до создания чего-либо, сбой создания понижается до предупреждения;</li>
 *   <li><b>B</b> запись учёта отправки: выполняется всегда, повторная отправка с тем же contextId
 *       переиспользует существующую запись;</li>
 *   <li><b>C</b> записи связи учёта с бизнес-записями: ошибки не прерывают отправку и
 *       возвращаются в поле {@code warning}.</li>
 * </ol>
 * Итог записывается в журнал аудита асинхронно.
 * <p>
 * Идемпотентность обеспечивается уникальностью Context_ID__c на стороне CRM; проверка запросом
 * перед созданием и повторный запрос после нарушения уникальности закрывают гонку двух отправок.
 */
@Singleton
public class SubmissionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SubmissionOrchestrator.class);

    static final String FIELD_FORM_DEFINITION = "Form_Definition__c";
    static final String FIELD_FORM_ID = "Form_Id__c";
    static final String FIELD_SUBMISSION_DATA = "Submission_Data__c";
    static final String FIELD_SUBMITTED_AT = "Submitted_At__c";
    static final String FIELD_CONTEXT_ID = "Context_ID__c";
    static final String FIELD_SESSION_ID = "Session_ID__c";

    static final String FIELD_REL_SUBMISSION = "Form_Submission__c";
    static final String FIELD_REL_RECORD_ID = "Related_Record_Id__c";
    static final String FIELD_REL_OBJECT_TYPE = "Related_Object_Type__c";

    static final String RELATIONSHIP_NOT_CREATED =
            "Бизнес-запись создана, но запись связи не создана. Подробности в логах брокера.";

    private final ConnectionProvider connectionProvider;
    private final RecordStoreClientFactory clientFactory;
    private final MappingResolver mappingResolver;
    private final MappingEvaluator mappingEvaluator;
    private final SessionService sessionService;
    private final AuditRecorder auditRecorder;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService executor;
    private final String trackingObject;
    private final String relationshipObject;
    private final boolean verifyBusinessRecord;

    public SubmissionOrchestrator(ConnectionProvider connectionProvider,
                                  RecordStoreClientFactory clientFactory,
                                  MappingResolver mappingResolver,
                                  MappingEvaluator mappingEvaluator,
                                  SessionService sessionService,
                                  AuditRecorder auditRecorder,
                                  FormBrokerProperties properties,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  @Named(TaskExecutors.IO) ExecutorService executor) {
        this.connectionProvider = connectionProvider;
        this.clientFactory = clientFactory;
        this.mappingResolver = mappingResolver;
        this.mappingEvaluator = mappingEvaluator;
        this.sessionService = sessionService;
        this.auditRecorder = auditRecorder;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executor = executor;
        this.trackingObject = Soql.identifier(properties.getRecordStore().getTrackingObject());
        this.relationshipObject = Soql.identifier(properties.getRecordStore().getRelationshipObject());
        this.verifyBusinessRecord = properties.getSubmission().isVerifyBusinessRecord();
    }

    /**
     * Отправить форму.
     *
     * @param formId идентификатор формы из маршрута
     * @param request contextId и данные формы
     * @return результат; {@code success=true} означает, что отправка зафиксирована записью учёта
     * @throws FormBrokerException при ошибке валидации, конфигурации, подключения или создания записи учёта
     */
    public SubmissionModels.SubmissionResult submit(String formId, SubmissionModels.SubmitRequest request) {
        Attempt attempt = new Attempt(formId, request);
        try {
            SubmissionModels.SubmissionResult result = run(attempt);
            audit(attempt, result, null);
            return result;
        } catch (RuntimeException e) {
            log.warn("Отправка формы не выполнена: formId={} contextId={} error={}", formId, attempt.contextId, e.getMessage());
            audit(attempt, null, e);
            throw e;
        }
    }

    private SubmissionModels.SubmissionResult run(Attempt attempt) {
        String formId = attempt.formId;
        String sessionId = null;
        if (attempt.contextId != null) {
            ContextRef ref = ContextIds.validate(attempt.contextId, formId);
            sessionId = ref.sessionId();
            Optional<FormSession> session = sessionService.getByContextId(attempt.contextId);
            if (session.isPresent()) {
                Map<String, Object> merged = new LinkedHashMap<>(session.get().formData());
                merged.putAll(attempt.formData);
                attempt.formData = merged;
            } else {
                log.debug("Сессия формы не найдена, используются только отправленные данные: contextId={}", attempt.contextId);
            }
        } else if (formId == null || formId.isBlank() || formId.contains(":")) {
            throw new ValidationException("INVALID_FORM_ID", "Некорректный formId", Map.of("formId", String.valueOf(formId)));
        }
        log.info("Отправка формы: formId={} contextId={} fields={}", formId, attempt.contextId, attempt.formData.size());

        RecordStoreHandle handle = connectionProvider.resolve(attempt.contextId);
        RecordStoreClient client = clientFactory.forHandle(handle);
        MappingModels.FormDefinition form = mappingResolver.fetch(formId, client);
        attempt.mappingRules = form.rawMappings();
        MappingModels.MappingRules rules = form.requireMappingRules();

        // A
        List<RecordStoreModels.RecordRef> businessRecords = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> unmapped = List.of();
        String target = rules.targetObjectType();
        if (target != null && !target.equalsIgnoreCase(trackingObject)) {
            MappingEvaluator.MappingResult mapping = mappingEvaluator.evaluate(attempt.formData, rules);
            unmapped = mapping.unmapped();
            if (mapping.record().isEmpty()) {
                throw new ConfigurationException("EMPTY_BUSINESS_RECORD",
                        "Ни одно поле формы не отображено в " + target + ": проверьте fieldMappings в " + MappingResolver.MAPPING_RULES_FIELD,
                        Map.of("formId", formId, "objectType", target));
            }
            createBusinessRecord(client, Soql.identifier(target), mapping.record(), attempt).ifPresentOrElse(
                    businessRecords::add,
                    () -> warnings.add("Бизнес-запись " + target + " не создана: " + attempt.businessError));
        }

        // B
        Tracking tracking = ensureTracking(client, form, attempt, sessionId);

        // C
        List<String> relationshipIds = new ArrayList<>();
        String relationshipError = null;
        if (!businessRecords.isEmpty()) {
            RelationshipOutcome rel = linkRecords(client, tracking, businessRecords);
            relationshipIds.addAll(rel.ids());
            relationshipError = rel.error();
        }
        if (!businessRecords.isEmpty() && relationshipIds.isEmpty()) {
            warnings.add(relationshipError != null ? relationshipError : RELATIONSHIP_NOT_CREATED);
        } else if (relationshipError != null) {
            warnings.add(relationshipError);
        }

        String message = tracking.duplicate()
                ? "Отправка с этим contextId уже зафиксирована, использована существующая запись учёта"
                : "Форма успешно отправлена";
        SubmissionModels.Debug debug = new SubmissionModels.Debug(
                businessRecords.size(), relationshipIds.size(), !businessRecords.isEmpty(), tracking.duplicate(), unmapped);
        long duration = clock.millis() - attempt.startedAt;
        log.info("Отправка формы завершена: formId={} contextId={} trackingId={} businessRecords={} relationships={} duplicate={} durationMs={}",
                formId, attempt.contextId, tracking.id(), businessRecords.size(), relationshipIds.size(), tracking.duplicate(), duration);
        return new SubmissionModels.SubmissionResult(
                true,
                tracking.id(),
                businessRecords,
                relationshipIds,
                attempt.contextId,
                tracking.duplicate(),
                message,
                warnings.isEmpty() ? null : String.join("; ", warnings),
                debug,
                duration
        );
    }

    private Optional<RecordStoreModels.RecordRef> createBusinessRecord(RecordStoreClient client, String objectType,
                                                                  Map<String, Object> record, Attempt attempt) {
        RecordStoreModels.CreateResult created;
        try {
            created = client.create(objectType, record);
        } catch (FormBrokerException e) {
            log.warn("Бизнес-запись {} не создана, отправка продолжается: {}", objectType, e.getMessage());
            attempt.businessError = e.getMessage();
            return Optional.empty();
        }
        if (!created.hasId()) {
            log.warn("Бизнес-запись {} не создана, отправка продолжается: {}", objectType, created.describeErrors());
            attempt.businessError = created.describeErrors();
            return Optional.empty();
        }
        log.info("Бизнес-запись создана: objectType={} id={}", objectType, created.id());
        if (verifyBusinessRecord) {
            runAsync("проверка бизнес-записи " + created.id(), () -> verify(client, objectType, created.id(), record));
        }
        return Optional.of(new RecordStoreModels.RecordRef(created.id(), objectType));
    }

    /**
     * Проверить повторным запросом, что созданная запись существует и содержит отправленные значения.
     * Расхождения только логируются.
     */
    void verify(RecordStoreClient client, String objectType, String id, Map<String, Object> record) {
        Set<String> fields = new LinkedHashSet<>();
        for (String f : record.keySet()) {
            fields.add(Soql.identifier(f));
        }
        fields.remove("Id");
        String soql = "SELECT Id" + (fields.isEmpty() ? "" : ", " + String.join(", ", fields))
                + " FROM " + objectType + " WHERE Id = " + Soql.quote(id) + " LIMIT 1";
        try {
            List<Map<String, Object>> rows = client.query(soql);
            if (rows.isEmpty()) {
                log.warn("Проверка: бизнес-запись {} {} не найдена повторным запросом", objectType, id);
                return;
            }
            List<String> mismatches = new ArrayList<>();
            for (String f : fields) {
                Object expected = record.get(f);
                Object actual = rows.get(0).get(f);
                if (expected != null && (actual == null || !String.valueOf(expected).equals(String.valueOf(actual)))) {
                    mismatches.add(f);
                }
            }
            if (!mismatches.isEmpty()) {
                log.warn("Проверка: значения бизнес-записи {} {} отличаются в полях {}", objectType, id, mismatches);
            }
        } catch (FormBrokerException e) {
            log.warn("Проверка бизнес-записи {} {} не выполнена: {}", objectType, id, e.getMessage());
        }
    }

    private Tracking ensureTracking(RecordStoreClient client, MappingModels.FormDefinition form, Attempt attempt, String sessionId) {
        if (attempt.contextId != null) {
            Optional<String> existing = findTracking(client, attempt.contextId);
            if (existing.isPresent()) {
                log.info("Повторная отправка: запись учёта уже существует contextId={} trackingId={}", attempt.contextId, existing.get());
                return new Tracking(existing.get(), true);
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        if (form.recordId() != null) {
            fields.put(FIELD_FORM_DEFINITION, form.recordId());
        }
        fields.put(FIELD_FORM_ID, attempt.formId);
        fields.put(FIELD_SUBMISSION_DATA, toJson(attempt.formData));
        fields.put(FIELD_SUBMITTED_AT, clock.instant().toString());
        if (attempt.contextId != null) {
            fields.put(FIELD_CONTEXT_ID, attempt.contextId);
            fields.put(FIELD_SESSION_ID, sessionId);
        }

        RecordStoreModels.CreateResult created = client.create(trackingObject, fields);
        if (created.hasId()) {
            log.info("Запись учёта отправки создана: trackingId={} contextId={}", created.id(), attempt.contextId);
            return new Tracking(created.id(), false);
        }
        if (attempt.contextId != null && created.isDuplicateViolation(FIELD_CONTEXT_ID)) {
            Optional<String> raced = findTracking(client, attempt.contextId);
            if (raced.isPresent()) {
                log.info("Нарушение уникальности Context_ID__c, использована параллельно созданная запись учёта: trackingId={}", raced.get());
                return new Tracking(raced.get(), true);
            }
        }
        String code = created.errors().isEmpty() ? null : created.errors().get(0).errorCode();
        throw ExternalApiException.classify(ExternalApiException.Operation.CREATE, code, 400, created.describeErrors(),
                Map.of("objectType", trackingObject, "formId", attempt.formId));
    }

    private Optional<String> findTracking(RecordStoreClient client, String contextId) {
        List<Map<String, Object>> rows = client.query("SELECT Id, " + FIELD_FORM_ID + ", " + FIELD_SUBMITTED_AT + " FROM " + trackingObject
                + " WHERE " + FIELD_CONTEXT_ID + " = " + Soql.quote(contextId) + " LIMIT 1");
        if (rows.isEmpty() || rows.get(0).get("Id") == null) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(rows.get(0).get("Id")));
    }

    private RelationshipOutcome linkRecords(RecordStoreClient client, Tracking tracking, List<RecordStoreModels.RecordRef> businessRecords) {
        try {
            if (tracking.duplicate()) {
                List<String> existing = findRelationships(client, tracking.id());
                if (!existing.isEmpty()) {
                    log.info("Повторная отправка: использованы существующие записи связи trackingId={} count={}", tracking.id(), existing.size());
                    return new RelationshipOutcome(existing, null);
                }
            }
            String describeWarning = checkRelationshipObject(client);

            List<String> ids = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (RecordStoreModels.RecordRef ref : businessRecords) {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put(FIELD_REL_SUBMISSION, tracking.id());
                fields.put(FIELD_REL_RECORD_ID, ref.id());
                fields.put(FIELD_REL_OBJECT_TYPE, ref.objectType());
                try {
                    RecordStoreModels.CreateResult created = client.create(relationshipObject, fields);
                    if (created.hasId()) {
                        ids.add(created.id());
                    } else {
                        errors.add(ref.objectType() + " " + ref.id() + ": " + created.describeErrors());
                    }
                } catch (FormBrokerException e) {
                    errors.add(ref.objectType() + " " + ref.id() + ": " + e.getMessage());
                }
            }
            if (errors.isEmpty()) {
                return new RelationshipOutcome(ids, null);
            }
            String error = "Записи связи не созданы: " + String.join("; ", errors)
                    + (describeWarning == null ? "" : " (" + describeWarning + ")");
            log.warn("{} trackingId={}", error, tracking.id());
            return new RelationshipOutcome(ids, error);
        } catch (FormBrokerException e) {
            log.warn("Шаг связывания записей не выполнен trackingId={}: {}", tracking.id(), e.getMessage());
            return new RelationshipOutcome(List.of(), "Записи связи не созданы: " + e.getMessage());
        }
    }

    private List<String> findRelationships(RecordStoreClient client, String trackingId) {
        List<Map<String, Object>> rows = client.query("SELECT Id, " + FIELD_REL_RECORD_ID + ", " + FIELD_REL_OBJECT_TYPE
                + " FROM " + relationshipObject + " WHERE " + FIELD_REL_SUBMISSION + " = " + Soql.quote(trackingId));
        List<String> ids = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (row.get("Id") != null) {
                ids.add(String.valueOf(row.get("Id")));
            }
        }
        return ids;
    }

    /**
     * Сверить описание объекта связи с полями, которые заполняет брокер.
     *
     * @return текст предупреждения или null
     */
    private String checkRelationshipObject(RecordStoreClient client) {
        List<RecordStoreModels.FieldInfo> described;
        try {
            described = client.describe(relationshipObject);
        } catch (FormBrokerException e) {
            log.warn("Описание объекта {} не получено: {}", relationshipObject, e.getMessage());
            return null;
        }
        Set<String> ours = Set.of(FIELD_REL_SUBMISSION, FIELD_REL_RECORD_ID, FIELD_REL_OBJECT_TYPE);
        Set<String> names = new LinkedHashSet<>();
        List<String> missingRequired = new ArrayList<>();
        for (RecordStoreModels.FieldInfo f : described) {
            names.add(f.name());
            if (f.requiredOnCreate() && !ours.contains(f.name())) {
                missingRequired.add(f.name());
            }
        }
        List<String> absent = new ArrayList<>();
        for (String f : ours) {
            if (!names.contains(f)) {
                absent.add(f);
            }
        }
        if (missingRequired.isEmpty() && absent.isEmpty()) {
            return null;
        }
        String warning = relationshipObject
                + (absent.isEmpty() ? "" : ": нет полей " + absent)
                + (missingRequired.isEmpty() ? "" : ": обязательные поля не заполняются брокером " + missingRequired);
        log.warn("Объект связи не соответствует ожидаемой структуре: {}", warning);
        return warning;
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ValidationException("INVALID_FORM_DATA", "Данные формы не сериализуются в JSON", Map.of("reason", String.valueOf(e.getOriginalMessage())));
        }
    }

    private void audit(Attempt attempt, SubmissionModels.SubmissionResult result, RuntimeException error) {
        long duration = result != null ? result.durationMs() : clock.millis() - attempt.startedAt;
        AuditModels.SubmissionAudit audit = new AuditModels.SubmissionAudit(
                attempt.formId,
                attempt.contextId,
                result == null ? null : result.trackingId(),
                result == null ? List.of() : result.businessRecordIds(),
                result == null ? List.of() : result.relationshipIds(),
                attempt.formData,
                attempt.mappingRules,
                result != null && result.success(),
                result != null && result.duplicate(),
                error == null ? null : error.getMessage(),
                result == null ? null : result.warning(),
                duration
        );
        runAsync("журнал аудита отправки", () -> auditRecorder.recordSubmission(audit));
    }

    private void runAsync(String what, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("Фоновая задача '{}' завершилась ошибкой: {}", what, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Фоновая задача '{}' не запущена: {}", what, e.getMessage());
        }
    }

    /**
     * Состояние одной отправки, нужное для журнала аудита и при ошибке.
     */
    private final class Attempt {
        private final String formId;
        private final String contextId;
        private final long startedAt;
        private Map<String, Object> formData;
        private JsonNode mappingRules;
        private String businessError;

        private Attempt(String formId, SubmissionModels.SubmitRequest request) {
            this.formId = formId;
            String ctx = request == null ? null : request.contextId();
            this.contextId = ctx == null || ctx.isBlank() ? null : ctx.trim();
            this.formData = request == null || request.formData() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.formData());
            this.startedAt = clock.millis();
        }
    }

    private record Tracking(String id, boolean duplicate) {
    }

    private record RelationshipOutcome(List<String> ids, String error) {
    }
}

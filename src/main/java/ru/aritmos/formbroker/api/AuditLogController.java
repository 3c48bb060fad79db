package ru.aritmos.formbroker.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.QueryValue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import ru.aritmos.formbroker.audit.AuditModels;
import ru.aritmos.formbroker.audit.JdbcAuditRecorder;

/**
 * Диагностика по журналу аудита.
 */
@Controller("/logs")
@Tag(name = "Журнал аудита", description = "Просмотр отправок форм и ошибок API за период хранения журнала")
public class AuditLogController {

    static final int DEFAULT_LIMIT = 50;

    private final JdbcAuditRecorder audit;
    private final ApiErrors apiErrors;

    @Inject
    public AuditLogController(JdbcAuditRecorder audit, ApiErrors apiErrors) {
        this.audit = audit;
        this.apiErrors = apiErrors;
    }

    @Get(uri = "/submissions{?limit,formId,contextId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Последние отправки форм", description = "Фильтр по formId или contextId необязателен.")
    @ApiResponse(responseCode = "200", description = "Записи журнала отправок",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = AuditModels.SubmissionLogRow.class))))
    public HttpResponse<?> submissions(@Nullable @QueryValue Integer limit,
                                       @Nullable @QueryValue String formId,
                                       @Nullable @QueryValue String contextId) {
        try {
            int n = limit == null ? DEFAULT_LIMIT : limit;
            if (formId != null && !formId.isBlank()) {
                return HttpResponse.ok(audit.submissionsByForm(formId, n));
            }
            if (contextId != null && !contextId.isBlank()) {
                return HttpResponse.ok(audit.submissionsByContext(contextId, n));
            }
            return HttpResponse.ok(audit.recentSubmissions(n));
        } catch (RuntimeException e) {
            return apiErrors.toResponse(e);
        }
    }

    @Get(uri = "/submissions/form/{formId}{?limit}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Отправки конкретной формы")
    @ApiResponse(responseCode = "200", description = "Записи журнала отправок",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = AuditModels.SubmissionLogRow.class))))
    public HttpResponse<?> submissionsByForm(@PathVariable String formId, @Nullable @QueryValue Integer limit) {
        try {
            return HttpResponse.ok(audit.submissionsByForm(formId, limit == null ? DEFAULT_LIMIT : limit));
        } catch (RuntimeException e) {
            return apiErrors.toResponse(e);
        }
    }

    @Get(uri = "/submissions/failed-relationships{?limit}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Отправки без записей связи", description = "Бизнес-записи созданы, но ни одна запись связи не создана.")
    @ApiResponse(responseCode = "200", description = "Записи журнала отправок",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = AuditModels.SubmissionLogRow.class))))
    public HttpResponse<?> failedRelationships(@Nullable @QueryValue Integer limit) {
        try {
            return HttpResponse.ok(audit.failedRelationships(limit == null ? DEFAULT_LIMIT : limit));
        } catch (RuntimeException e) {
            return apiErrors.toResponse(e);
        }
    }

    @Get(uri = "/errors{?limit}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Ошибки вызовов API", description = "Вызовы со статусом 400 и выше или с текстом ошибки.")
    @ApiResponse(responseCode = "200", description = "Записи журнала вызовов API",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = AuditModels.ApiLogRow.class))))
    public HttpResponse<?> errors(@Nullable @QueryValue Integer limit) {
        try {
            return HttpResponse.ok(audit.errors(limit == null ? DEFAULT_LIMIT : limit));
        } catch (RuntimeException e) {
            return apiErrors.toResponse(e);
        }
    }
}

package ru.aritmos.formbroker.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.QueryValue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import ru.aritmos.formbroker.auth.ConnectionProvider;
import ru.aritmos.formbroker.context.ContextIds;
import ru.aritmos.formbroker.mapping.MappingModels;
import ru.aritmos.formbroker.mapping.MappingResolver;
import ru.aritmos.formbroker.submission.SubmissionModels;
import ru.aritmos.formbroker.submission.SubmissionOrchestrator;

/**
 * API форм: определение формы и отправка данных.
 */
@Controller("/forms")
@Tag(name = "Формы", description = "Получение определения формы из CRM и отправка данных формы")
public class FormsController {

    private final ConnectionProvider connectionProvider;
    private final MappingResolver mappingResolver;
    private final SubmissionOrchestrator orchestrator;
    private final ApiCallHandler handler;

    @Inject
    public FormsController(ConnectionProvider connectionProvider,
                           MappingResolver mappingResolver,
                           SubmissionOrchestrator orchestrator,
                           ApiCallHandler handler) {
        this.connectionProvider = connectionProvider;
        this.mappingResolver = mappingResolver;
        this.orchestrator = orchestrator;
        this.handler = handler;
    }

    @Get(uri = "/{formId}{?contextId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Получить определение формы",
            description = "Определение читается из CRM при каждом запросе. Если передан contextId, используется OAuth-сессия " +
                    "пользователя, иначе сервисная учётная запись. Поддерживаются форматы Fields_JSON__c с sections и с fields."
    )
    @ApiResponse(responseCode = "200", description = "Определение формы: formId, name, title, sections или fields, mappings, agentConfig, active")
    @ApiResponse(responseCode = "400", description = "Некорректный contextId", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "404", description = "Форма не найдена", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "503", description = "Нет подключения к CRM", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> getForm(HttpRequest<?> request,
                                   @Parameter(description = "Идентификатор формы (Form_Id__c или Name)") @PathVariable String formId,
                                   @Parameter(description = "contextId = formId:sessionId") @Nullable @QueryValue String contextId) {
        return handler.handle(request, formId, contextId, null, () -> {
            if (contextId != null && !contextId.isBlank()) {
                ContextIds.validate(contextId, formId);
            }
            MappingModels.FormDefinition form = mappingResolver.fetch(formId, connectionProvider.resolve(contextId));
            return HttpResponse.ok(mappingResolver.render(form));
        });
    }

    @Post(uri = "/{formId}/submit", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Отправить данные формы",
            description = "Создаёт бизнес-запись по правилам маппинга, запись учёта отправки и записи связи между ними. " +
                    "Повторная отправка с тем же contextId возвращает ту же запись учёта (isDuplicate=true). " +
                    "Сбой создания бизнес-записи или записи связи не прерывает отправку и возвращается в поле warning."
    )
    @ApiResponse(responseCode = "200", description = "Отправка зафиксирована (в том числе повторная)",
            content = @Content(schema = @Schema(implementation = SubmissionModels.SubmissionResult.class)))
    @ApiResponse(responseCode = "400", description = "Некорректный contextId или ошибка конфигурации маппинга", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "404", description = "Форма не найдена", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "502", description = "Ошибка API CRM", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "503", description = "CRM недоступна или нет подключения", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> submit(HttpRequest<?> request,
                                  @PathVariable String formId,
                                  @Body SubmissionModels.SubmitRequest body) {
        String contextId = body == null ? null : body.contextId();
        return handler.handle(request, formId, contextId, body, () -> HttpResponse.ok(orchestrator.submit(formId, body)));
    }
}

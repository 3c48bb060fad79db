package ru.aritmos.formbroker.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.Put;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import ru.aritmos.formbroker.session.FormSession;
import ru.aritmos.formbroker.session.SessionService;

import java.util.Map;
import java.util.Optional;

/**
 * API сессий форм.
 */
@Controller("/sessions")
@Tag(name = "Сессии форм", description = "Создание, чтение, обновление и удаление сессий форм, связанных с чат-сессией агента")
public class SessionsController {

    private final SessionService sessionService;
    private final ApiCallHandler handler;
    private final ApiErrors apiErrors;

    @Inject
    public SessionsController(SessionService sessionService, ApiCallHandler handler, ApiErrors apiErrors) {
        this.sessionService = sessionService;
        this.handler = handler;
        this.apiErrors = apiErrors;
    }

    @Post(consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Создать сессию формы",
            description = "Если sessionId не передан, генерируется UUIDv4. Если передан sessionId живой сессии той же формы, " +
                    "возвращается существующая сессия. Время жизни сессии фиксированное (24 часа по умолчанию)."
    )
    @ApiResponse(responseCode = "200", description = "Сессия создана или найдена", content = @Content(schema = @Schema(implementation = SessionCreated.class)))
    @ApiResponse(responseCode = "400", description = "Некорректный formId или sessionId", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> create(HttpRequest<?> request, @Body CreateSessionRequest body) {
        String formId = body == null ? null : body.formId();
        return handler.handle(request, formId, null, body, () -> {
            FormSession s = sessionService.create(formId, body == null ? null : body.sessionId());
            return HttpResponse.ok(new SessionCreated(s.sessionId(), s.contextId(), s.formId(), s.expiresAt().toString()));
        });
    }

    @Get(uri = "/{sessionId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Получить сессию формы", description = "Чтение обновляет lastActivity, но не продлевает срок жизни сессии.")
    @ApiResponse(responseCode = "200", description = "Сессия", content = @Content(schema = @Schema(implementation = FormSession.class)))
    @ApiResponse(responseCode = "400", description = "sessionId не является UUIDv4", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "404", description = "Сессия не найдена или истекла", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> get(HttpRequest<?> request, @PathVariable String sessionId) {
        return handler.handle(request, null, null, null, () -> found(sessionService.get(sessionId), sessionId));
    }

    @Put(uri = "/{sessionId}", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Обновить сессию формы", description = "Ключи formData и agentContext сливаются с уже сохранёнными (новые значения перекрывают старые).")
    @ApiResponse(responseCode = "200", description = "Обновлённая сессия", content = @Content(schema = @Schema(implementation = FormSession.class)))
    @ApiResponse(responseCode = "400", description = "sessionId не является UUIDv4", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "404", description = "Сессия не найдена или истекла", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> update(HttpRequest<?> request, @PathVariable String sessionId, @Body UpdateSessionRequest body) {
        return handler.handle(request, null, null, body, () -> found(
                sessionService.update(sessionId, body == null ? null : body.formData(), body == null ? null : body.agentContext()),
                sessionId));
    }

    @Delete(uri = "/{sessionId}")
    @Operation(summary = "Удалить сессию формы")
    @ApiResponse(responseCode = "204", description = "Сессия удалена")
    @ApiResponse(responseCode = "404", description = "Сессия не найдена", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> delete(HttpRequest<?> request, @PathVariable String sessionId) {
        return handler.handle(request, null, null, null, () -> sessionService.delete(sessionId)
                ? HttpResponse.noContent()
                : apiErrors.notFound("SESSION_NOT_FOUND", "Сессия не найдена", Map.of("sessionId", sessionId)));
    }

    @Get(uri = "/context/{contextId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Найти сессию по contextId", description = "formId в contextId должен совпадать с formId сессии.")
    @ApiResponse(responseCode = "200", description = "Сессия", content = @Content(schema = @Schema(implementation = FormSession.class)))
    @ApiResponse(responseCode = "400", description = "Некорректный contextId", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "404", description = "Сессия не найдена или истекла", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> byContext(HttpRequest<?> request, @PathVariable String contextId) {
        return handler.handle(request, null, contextId, null, () -> {
            Optional<FormSession> session = sessionService.getByContextId(contextId);
            return session.<HttpResponse<?>>map(HttpResponse::ok)
                    .orElseGet(() -> apiErrors.notFound("SESSION_NOT_FOUND", "Сессия не найдена", Map.of("contextId", contextId)));
        });
    }

    private HttpResponse<?> found(Optional<FormSession> session, String sessionId) {
        if (session.isPresent()) {
            return HttpResponse.ok(session.get());
        }
        return apiErrors.notFound("SESSION_NOT_FOUND", "Сессия не найдена или истекла", Map.of("sessionId", sessionId));
    }

    @Serdeable
    @Schema(name = "CreateSessionRequest", description = "Создание сессии формы")
    public record CreateSessionRequest(
            @Schema(description = "Идентификатор формы", requiredMode = Schema.RequiredMode.REQUIRED) String formId,
            @Schema(description = "UUIDv4 сессии (необязательно)") @Nullable String sessionId
    ) {
    }

    @Serdeable
    @Schema(name = "UpdateSessionRequest", description = "Изменение данных сессии формы")
    public record UpdateSessionRequest(
            @Nullable Map<String, Object> formData,
            @Nullable Map<String, Object> agentContext
    ) {
    }

    @Serdeable
    @Schema(name = "SessionCreated", description = "Созданная сессия формы")
    public record SessionCreated(String sessionId, String contextId, String formId, String expiresAt) {
    }
}

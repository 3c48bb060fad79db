package ru.aritmos.formbroker.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.auth.AuthModels;
import ru.aritmos.formbroker.auth.OAuthClient;
import ru.aritmos.formbroker.auth.TokenManager;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ValidationException;

import java.net.URI;
import java.time.Clock;
import java.util.Map;

/**
 * OAuth 2.0 authorization code flow для подключения к CRM.
 * <p>
 * contextId передаётся через параметр {@code state}; для сервисной учётной записи используется
 * contextId из {@code formbroker.record-store.service-account-context-id}.
 */
@Controller("/oauth")
@Tag(name = "OAuth CRM", description = "Авторизация пользователя или сервисной учётной записи в CRM")
public class OAuthController {

    private static final Logger log = LoggerFactory.getLogger(OAuthController.class);

    private final OAuthClient oauthClient;
    private final TokenManager tokenManager;
    private final ApiErrors apiErrors;
    private final Clock clock;
    private final String serviceAccountContextId;

    @Inject
    public OAuthController(OAuthClient oauthClient,
                           TokenManager tokenManager,
                           ApiErrors apiErrors,
                           Clock clock,
                           FormBrokerProperties properties) {
        this.oauthClient = oauthClient;
        this.tokenManager = tokenManager;
        this.apiErrors = apiErrors;
        this.clock = clock;
        this.serviceAccountContextId = properties.getRecordStore().getServiceAccountContextId();
    }

    @Get(uri = "/authorize{?contextId}")
    @Operation(summary = "Начать авторизацию в CRM", description = "Перенаправляет на страницу авторизации CRM. contextId возвращается в callback через state.")
    @ApiResponse(responseCode = "303", description = "Перенаправление на страницу авторизации")
    @ApiResponse(responseCode = "400", description = "OAuth не настроен", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> authorize(@Nullable @QueryValue String contextId) {
        try {
            String state = contextId == null || contextId.isBlank() ? "oauth_" + clock.millis() : contextId;
            log.info("Начата авторизация в CRM: contextId={}", state);
            return HttpResponse.seeOther(URI.create(oauthClient.authorizationUrl(state)));
        } catch (RuntimeException e) {
            return apiErrors.toResponse(e);
        }
    }

    @Get(uri = "/callback{?code,state,error}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Завершить авторизацию в CRM", description = "Обменивает authorization code на токены и сохраняет токен-сессию для contextId из state.")
    @ApiResponse(responseCode = "200", description = "Токен-сессия сохранена", content = @Content(schema = @Schema(implementation = OAuthCompleted.class)))
    @ApiResponse(responseCode = "400", description = "Авторизация отклонена или не передан code", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "502", description = "Ошибка обмена кода на токены", content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    public HttpResponse<?> callback(@Nullable @QueryValue String code,
                                    @Nullable @QueryValue String state,
                                    @Nullable @QueryValue String error) {
        try {
            if (error != null && !error.isBlank()) {
                throw new ValidationException("OAUTH_DENIED", "Авторизация отклонена или завершилась ошибкой", Map.of("error", error));
            }
            if (code == null || code.isBlank()) {
                throw new ValidationException("OAUTH_CODE_MISSING", "В callback не передан authorization code");
            }
            String contextId = state == null || state.isBlank() ? "oauth_" + clock.millis() : state;
            AuthModels.TokenSession session = tokenManager.storeTokens(contextId, oauthClient.exchangeAuthorizationCode(code));
            boolean serviceAccount = contextId.equals(serviceAccountContextId);
            return HttpResponse.ok(new OAuthCompleted(contextId, session.sessionId(), serviceAccount,
                    serviceAccount ? "Токен-сессия сервисной учётной записи сохранена" : "Токен-сессия сохранена"));
        } catch (RuntimeException e) {
            return apiErrors.toResponse(e);
        }
    }

    @Serdeable
    @Schema(name = "OAuthCompleted", description = "Результат авторизации в CRM")
    public record OAuthCompleted(String contextId, String tokenSessionId, boolean serviceAccount, String message) {
    }
}

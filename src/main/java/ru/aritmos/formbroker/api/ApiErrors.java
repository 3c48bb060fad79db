package ru.aritmos.formbroker.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.core.ErrorType;
import ru.aritmos.formbroker.core.FormBrokerException;
import ru.aritmos.formbroker.core.SensitiveDataSanitizer;

import java.time.Clock;
import java.util.Map;

/**
 * Преобразование исключений в HTTP-ответы {@link ErrorResponse}.
 * <p>
 * Статус берётся из класса ошибки; всё, что не является {@link FormBrokerException},
 * становится INTERNAL_ERROR (500).
 */
@Singleton
public class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private final Clock clock;

    public ApiErrors(Clock clock) {
        this.clock = clock;
    }

    public HttpResponse<ErrorResponse> toResponse(Throwable error) {
        if (error instanceof FormBrokerException fbe) {
            ErrorResponse body = new ErrorResponse(
                    fbe.type().name(),
                    fbe.code(),
                    SensitiveDataSanitizer.sanitizeText(fbe.getMessage()),
                    fbe.retryable() ? "Ошибка временная, запрос можно повторить" : null,
                    fbe.context(),
                    clock.instant().toString());
            return HttpResponse.<ErrorResponse>status(HttpStatus.valueOf(fbe.httpStatus())).body(body);
        }
        log.error("Непредвиденная ошибка обработки запроса", error);
        ErrorResponse body = new ErrorResponse(
                ErrorType.INTERNAL_ERROR.name(),
                ErrorType.INTERNAL_ERROR.name(),
                "Внутренняя ошибка брокера",
                SensitiveDataSanitizer.sanitizeText(error.getMessage()),
                Map.of(),
                clock.instant().toString());
        return HttpResponse.<ErrorResponse>serverError().body(body);
    }

    public HttpResponse<ErrorResponse> notFound(String code, String message, Map<String, Object> context) {
        return HttpResponse.<ErrorResponse>notFound().body(new ErrorResponse(
                ErrorType.NOT_FOUND.name(), code, message, null, context, clock.instant().toString()));
    }
}

package ru.aritmos.formbroker.api;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.audit.AuditModels;
import ru.aritmos.formbroker.audit.AuditRecorder;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Выполнение обработчика API с переводом исключений в {@link ErrorResponse}
 * и записью вызова в журнал аудита.
 */
@Singleton
public class ApiCallHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiCallHandler.class);

    private final ApiErrors apiErrors;
    private final AuditRecorder auditRecorder;
    private final Clock clock;
    private final ExecutorService executor;

    public ApiCallHandler(ApiErrors apiErrors,
                          AuditRecorder auditRecorder,
                          Clock clock,
                          @Named(TaskExecutors.IO) ExecutorService executor) {
        this.apiErrors = apiErrors;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Выполнить обработчик.
     *
     * @param request HTTP-запрос (для метода, пути и сведений о клиенте)
     * @param formId formId для журнала
     * @param contextId contextId для журнала
     * @param requestBody тело запроса для журнала
     * @param action обработчик
     * @return ответ обработчика или ответ об ошибке
     */
    public HttpResponse<?> handle(HttpRequest<?> request,
                                  String formId,
                                  String contextId,
                                  Object requestBody,
                                  Supplier<HttpResponse<?>> action) {
        long started = clock.millis();
        HttpResponse<?> response;
        String error = null;
        try {
            response = action.get();
        } catch (RuntimeException e) {
            HttpResponse<ErrorResponse> failed = apiErrors.toResponse(e);
            error = failed.getBody().map(ErrorResponse::message).orElse(e.getMessage());
            response = failed;
        }
        record(request, response, clock.millis() - started, formId, contextId, requestBody, error);
        return response;
    }

    private void record(HttpRequest<?> request, HttpResponse<?> response, long durationMs,
                        String formId, String contextId, Object requestBody, String error) {
        AuditModels.ApiCallAudit audit = new AuditModels.ApiCallAudit(
                request.getMethodName(),
                request.getPath(),
                response.getStatus().getCode(),
                durationMs,
                requestBody,
                response.getBody().orElse(null),
                error,
                contextId,
                formId,
                request.getHeaders().get(HttpHeaders.USER_AGENT),
                remoteAddress(request)
        );
        try {
            executor.execute(() -> auditRecorder.recordApiCall(audit));
        } catch (RejectedExecutionException e) {
            log.warn("[AUDIT] вызов API {} {} не записан: {}", audit.method(), audit.path(), e.getMessage());
        }
    }

    private static String remoteAddress(HttpRequest<?> request) {
        InetSocketAddress address = request.getRemoteAddress();
        return address == null ? null : address.getHostString();
    }
}

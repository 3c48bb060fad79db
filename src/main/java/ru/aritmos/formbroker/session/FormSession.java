package ru.aritmos.formbroker.session;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Сессия формы, связанная с чат-сессией агента.
 * <p>
 * Время жизни фиксированное: {@code expiresAt} вычисляется при создании и не продлевается при активности.
 */
@Serdeable
@Schema(name = "FormSession", description = "Сессия формы: промежуточные данные формы и контекст агента")
public record FormSession(
        @Schema(description = "UUIDv4 сессии") String sessionId,
        @Schema(description = "Идентификатор формы") String formId,
        @Schema(description = "contextId = formId:sessionId") String contextId,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt,
        @Schema(description = "Накопленные данные формы") Map<String, Object> formData,
        @Schema(description = "Контекст агента") Map<String, Object> agentContext
) {

    public FormSession {
        formData = frozen(formData);
        agentContext = frozen(agentContext);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public FormSession touch(Instant now) {
        return new FormSession(sessionId, formId, contextId, createdAt, now, expiresAt, formData, agentContext);
    }

    /**
     * Слить изменения в данные формы и контекст агента (ключи изменения перекрывают существующие).
     */
    public FormSession merge(Map<String, Object> formDataPatch, Map<String, Object> agentContextPatch, Instant now) {
        Map<String, Object> fd = new LinkedHashMap<>(formData);
        if (formDataPatch != null) {
            fd.putAll(formDataPatch);
        }
        Map<String, Object> ac = new LinkedHashMap<>(agentContext);
        if (agentContextPatch != null) {
            ac.putAll(agentContextPatch);
        }
        return new FormSession(sessionId, formId, contextId, createdAt, now, expiresAt, fd, ac);
    }

    private static Map<String, Object> frozen(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

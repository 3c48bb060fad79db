package ru.aritmos.formbroker.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Санитайзер чувствительных данных.
 * <p>
 * Используется перед записью в лог, в журнал аудита и в тело ответа об ошибке:
 * OAuth-токены и секреты CRM не должны покидать процесс в сыром виде.
 * <p>
 * Важно: санитайзер работает эвристически и не заменяет DLP; данные формы не модифицируются.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Ключи, значения которых всегда маскируются.
     */
    private static final Set<String> FORBIDDEN_KEYS = Set.of(
            "authorization",
            "cookie",
            "set-cookie",
            "access_token",
            "accesstoken",
            "refresh_token",
            "refreshtoken",
            "client_secret",
            "clientsecret",
            "code"
    );

    private static final String MASK = "***";

    /**
     * Санитизировать плоскую карту (заголовки, параметры запроса).
     *
     * @param values исходные значения
     * @return новая карта с замаскированными значениями чувствительных ключей
     */
    public static Map<String, String> sanitizeMap(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : values.entrySet()) {
            String k = e.getKey();
            if (k == null) {
                continue;
            }
            if (FORBIDDEN_KEYS.contains(k.toLowerCase(Locale.ROOT).trim())) {
                out.put(k, MASK);
            } else {
                out.put(k, sanitizeText(e.getValue()));
            }
        }
        return out;
    }

    /**
     * Санитизировать текст (сообщения об ошибках, тела ответов CRM).
     *
     * @param text исходный текст
     * @return текст с замаскированными Bearer-токенами и параметрами вида access_token=...
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;
        t = t.replaceAll("(?i)bearer\\s+[^\\s\"]+", "Bearer " + MASK);
        t = t.replaceAll("(?i)(client_secret|access_token|refresh_token)\\s*=\\s*[^\\s&\"]+", "$1=" + MASK);
        t = t.replaceAll("(?i)\"(access_token|refresh_token|client_secret|accessToken|refreshToken)\"\\s*:\\s*\"[^\"]*\"", "\"$1\":\"" + MASK + "\"");
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Короткий отпечаток токена для диагностики: первые символы и маска.
     */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) {
            return "<none>";
        }
        return token.length() <= 6 ? MASK : token.substring(0, 6) + MASK;
    }
}

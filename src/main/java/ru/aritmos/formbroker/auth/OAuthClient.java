package ru.aritmos.formbroker.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ConfigurationException;
import ru.aritmos.formbroker.core.ConnectionException;
import ru.aritmos.formbroker.core.ExternalApiException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * OAuth2-клиент сервера авторизации CRM (authorization_code и refresh_token).
 * <p>
 * Запросы отправляются на {@code {loginUrl}/services/oauth2/token} в формате
 * application/x-www-form-urlencoded. Токены в лог не пишутся.
 */
@Singleton
public class OAuthClient {

    private static final Logger log = LoggerFactory.getLogger(OAuthClient.class);

    static final String TOKEN_PATH = "/services/oauth2/token";
    static final String AUTHORIZE_PATH = "/services/oauth2/authorize";
    static final String DEFAULT_SCOPE = "api refresh_token openid";

    private final ObjectMapper objectMapper;
    private final FormBrokerProperties.RecordStore config;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public OAuthClient(ObjectMapper objectMapper, FormBrokerProperties properties) {
        this.objectMapper = objectMapper;
        this.config = properties.getRecordStore();
        this.requestTimeout = Duration.ofMillis(Math.max(1000, config.getHttpTimeoutMs()));
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    }

    /**
     * Адрес страницы авторизации. В {@code state} передаётся contextId, он возвращается в callback.
     */
    public String authorizationUrl(String state) {
        StringBuilder sb = new StringBuilder(trimSlash(config.getLoginUrl())).append(AUTHORIZE_PATH)
                .append("?response_type=code");
        append(sb, "client_id", requireClientId());
        append(sb, "redirect_uri", config.getRedirectUri());
        append(sb, "scope", DEFAULT_SCOPE);
        append(sb, "state", state);
        return sb.toString().replace("+", "%20");
    }

    /**
     * Обменять authorization code на токены.
     */
    public AuthModels.TokenResponse exchangeAuthorizationCode(String code) {
        if (normalize(code) == null) {
            throw new ConfigurationException("OAUTH_CODE_MISSING", "Не передан authorization code", Map.of());
        }
        StringBuilder body = new StringBuilder("grant_type=authorization_code");
        append(body, "client_id", requireClientId());
        append(body, "client_secret", config.getClientSecret());
        append(body, "redirect_uri", config.getRedirectUri());
        append(body, "code", code);
        return post(body.toString(), "authorization_code");
    }

    /**
     * Обновить access token по refresh token.
     */
    public AuthModels.TokenResponse refresh(String refreshToken) {
        StringBuilder body = new StringBuilder("grant_type=refresh_token");
        append(body, "client_id", requireClientId());
        append(body, "client_secret", config.getClientSecret());
        append(body, "refresh_token", refreshToken);
        return post(body.toString(), "refresh_token");
    }

    private AuthModels.TokenResponse post(String body, String grantType) {
        String tokenUrl = trimSlash(config.getLoginUrl()) + TOKEN_PATH;
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ConnectionException("OAUTH_TIMEOUT", "Таймаут запроса к серверу авторизации", Map.of("grantType", grantType), e);
        } catch (IOException e) {
            throw new ConnectionException("OAUTH_UNAVAILABLE", "Сервер авторизации недоступен: " + e.getMessage(), Map.of("grantType", grantType), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("OAUTH_INTERRUPTED", "Запрос к серверу авторизации прерван", Map.of("grantType", grantType), e);
        }

        JsonNode node = readTree(resp.body());
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            String error = normalize(node.path("error").asText(null));
            String description = normalize(node.path("error_description").asText(null));
            log.warn("Сервер авторизации отклонил grant {}: status={}, error={}", grantType, resp.statusCode(), error);
            throw ExternalApiException.classify(ExternalApiException.Operation.AUTH,
                    error == null ? null : error.toUpperCase(Locale.ROOT),
                    resp.statusCode(), description == null ? error : description, Map.of("grantType", grantType));
        }

        String accessToken = normalize(node.path("access_token").asText(null));
        if (accessToken == null) {
            throw ExternalApiException.classify(ExternalApiException.Operation.AUTH, null, resp.statusCode(),
                    "Ответ token endpoint не содержит access_token", Map.of("grantType", grantType));
        }
        Long expiresIn = node.hasNonNull("expires_in") ? node.path("expires_in").asLong() : null;
        return new AuthModels.TokenResponse(
                accessToken,
                normalize(node.path("refresh_token").asText(null)),
                normalize(node.path("token_type").asText("Bearer")),
                normalize(node.path("scope").asText(null)),
                normalize(node.path("instance_url").asText(null)),
                normalize(node.path("id").asText(null)),
                expiresIn
        );
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Ответ сервера авторизации не является JSON: {}", e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private String requireClientId() {
        String clientId = normalize(config.getClientId());
        if (clientId == null) {
            throw new ConfigurationException("OAUTH_NOT_CONFIGURED", "Не задан formbroker.record-store.client-id", Map.of());
        }
        return clientId;
    }

    private static void append(StringBuilder sb, String key, String value) {
        String v = normalize(value);
        if (v == null) {
            return;
        }
        sb.append('&').append(key).append('=').append(URLEncoder.encode(v, StandardCharsets.UTF_8));
    }

    private static String trimSlash(String url) {
        String u = normalize(url);
        if (u == null) {
            throw new ConfigurationException("OAUTH_NOT_CONFIGURED", "Не задан formbroker.record-store.login-url", Map.of());
        }
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }

    private static String normalize(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

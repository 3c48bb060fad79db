package ru.aritmos.formbroker.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ConfigurationException;
import ru.aritmos.formbroker.core.ExternalApiException;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OAuthClientTest {

    private static HttpServer server(int status, String response, AtomicReference<String> lastBody) throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/services/oauth2/token", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        return server;
    }

    private static FormBrokerProperties props(HttpServer server) {
        FormBrokerProperties p = new FormBrokerProperties();
        p.getRecordStore().setLoginUrl("http://localhost:" + server.getAddress().getPort() + "/");
        p.getRecordStore().setClientId("broker-client");
        p.getRecordStore().setClientSecret("broker-secret");
        p.getRecordStore().setRedirectUri("http://localhost:8080/oauth/callback");
        return p;
    }

    @Test
    void exchangesAuthorizationCode() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        HttpServer server = server(200, "{\"access_token\":\"tok-1\",\"refresh_token\":\"ref-1\","
                + "\"instance_url\":\"https://acme.my.salesforce.com\",\"id\":\"https://login/id/005\",\"token_type\":\"Bearer\"}", body);
        try {
            OAuthClient client = new OAuthClient(new ObjectMapper(), props(server));
            AuthModels.TokenResponse r = client.exchangeAuthorizationCode("code-123");

            assertEquals("tok-1", r.accessToken());
            assertEquals("ref-1", r.refreshToken());
            assertEquals("https://acme.my.salesforce.com", r.instanceUrl());
            assertNull(r.expiresInSec(), "TEST_EXPECTED: expires_in не передан");
            assertTrue(body.get().startsWith("grant_type=authorization_code"), "TEST_EXPECTED: grant_type");
            assertTrue(body.get().contains("code=code-123"));
            assertTrue(body.get().contains("client_secret=broker-secret"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void refreshSendsRefreshGrant() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        HttpServer server = server(200, "{\"access_token\":\"tok-2\",\"expires_in\":7200}", body);
        try {
            OAuthClient client = new OAuthClient(new ObjectMapper(), props(server));
            AuthModels.TokenResponse r = client.refresh("ref-1");

            assertEquals("tok-2", r.accessToken());
            assertEquals(7200L, r.expiresInSec());
            assertEquals("Bearer", r.tokenType());
            assertTrue(body.get().contains("grant_type=refresh_token"));
            assertTrue(body.get().contains("refresh_token=ref-1"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void rejectedGrantIsAuthError() throws Exception {
        HttpServer server = server(400, "{\"error\":\"invalid_grant\",\"error_description\":\"expired access/refresh token\"}",
                new AtomicReference<>());
        try {
            OAuthClient client = new OAuthClient(new ObjectMapper(), props(server));
            ExternalApiException e = assertThrows(ExternalApiException.class, () -> client.refresh("ref-1"));

            assertEquals(ExternalApiException.Kind.AUTH, e.kind());
            assertEquals("INVALID_GRANT", e.externalCode());
            assertEquals(400, e.externalStatus());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void authorizationUrlCarriesState() {
        FormBrokerProperties p = new FormBrokerProperties();
        p.getRecordStore().setClientId("broker-client");
        OAuthClient client = new OAuthClient(new ObjectMapper(), p);

        String url = client.authorizationUrl("contact-form:550e8400-e29b-41d4-a716-446655440000");

        assertTrue(url.startsWith("https://login.salesforce.com/services/oauth2/authorize?response_type=code"));
        assertTrue(url.contains("client_id=broker-client"));
        assertTrue(url.contains("scope=api%20refresh_token%20openid"));
        assertTrue(url.contains("state=contact-form%3A550e8400-e29b-41d4-a716-446655440000"));
    }

    @Test
    void missingClientIdIsConfigurationError() {
        OAuthClient client = new OAuthClient(new ObjectMapper(), new FormBrokerProperties());
        assertThrows(ConfigurationException.class, () -> client.authorizationUrl("s"));
    }
}

package ru.aritmos.formbroker.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.MutableClock;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ConnectionException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionProviderTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-10T10:00:00Z"));
    private final FormBrokerProperties props = TokenManagerTest.memoryOnly();
    private final TokenManager tokens = new TokenManager(
            new JsonFileTokenStore(new ObjectMapper(), props, clock),
            new TokenManagerTest.CountingOAuthClient(props), props, clock);
    private final ConnectionProvider provider = new ConnectionProvider(tokens, props);

    private static AuthModels.TokenResponse tokens(String access, String instanceUrl) {
        return new AuthModels.TokenResponse(access, "ref", "Bearer", null, instanceUrl, null, 3600L);
    }

    @Test
    void prefersUserSession() {
        tokens.storeTokens("service_account", tokens("svc", "https://svc.my.salesforce.com"));
        tokens.storeTokens("f1:ctx", tokens("usr", "https://acme.my.site.com/"));

        RecordStoreHandle h = provider.resolve("f1:ctx");

        assertEquals(RecordStoreHandle.Source.USER, h.source());
        assertEquals("usr", h.accessToken());
        assertEquals("https://acme.my.salesforce.com", h.instanceUrl(), "TEST_EXPECTED: адрес нормализован");
    }

    @Test
    void fallsBackToServiceAccount() {
        assertFalse(provider.isServiceAccountConnected());
        tokens.storeTokens("service_account", tokens("svc", "https://svc.my.salesforce.com"));

        RecordStoreHandle h = provider.resolve("f1:unknown");

        assertEquals(RecordStoreHandle.Source.SERVICE_ACCOUNT, h.source());
        assertEquals("svc", h.accessToken());
        assertTrue(provider.isServiceAccountConnected());
        assertEquals(RecordStoreHandle.Source.SERVICE_ACCOUNT, provider.resolve(null).source());
    }

    @Test
    void noSessionsMeansNoConnection() {
        ConnectionException e = assertThrows(ConnectionException.class, () -> provider.resolve("f1:ctx"));
        assertEquals("NO_CONNECTION", e.code());
        assertEquals(503, e.httpStatus());
    }

    @Test
    void sessionWithoutInstanceUrlIsRejected() {
        tokens.storeTokens("service_account", tokens("svc", null));

        ConnectionException e = assertThrows(ConnectionException.class, () -> provider.resolve(null));
        assertEquals("MISSING_INSTANCE_URL", e.code());
    }

    @Test
    void normalizesInstanceUrl() {
        assertEquals("https://acme.my.salesforce.com",
                ConnectionProvider.normalizeInstanceUrl("https://acme.my.salesforce-setup.com//"));
        assertEquals("https://acme.my.salesforce.com", ConnectionProvider.normalizeInstanceUrl(" https://acme.my.site.com "));
        assertNull(ConnectionProvider.normalizeInstanceUrl(" "));
    }
}

package ru.aritmos.formbroker.recordstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.auth.RecordStoreHandle;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ExternalApiException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SalesforceRestClientTest {

    private HttpServer server;
    private RecordStoreClient client;
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void start() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/services/data/v58.0/sobjects/Lead/describe", ex -> reply(ex, 200,
                "{\"fields\":[{\"name\":\"LastName\",\"type\":\"string\",\"nillable\":false,\"createable\":true,\"defaultedOnCreate\":false},"
                        + "{\"name\":\"Company\",\"type\":\"string\",\"nillable\":false,\"createable\":true,\"defaultedOnCreate\":false},"
                        + "{\"name\":\"IsConverted\",\"type\":\"boolean\",\"nillable\":false,\"createable\":true,\"defaultedOnCreate\":true}]}"));
        server.createContext("/services/data/v58.0/sobjects/Missing__c/describe", ex -> reply(ex, 404,
                "[{\"errorCode\":\"NOT_FOUND\",\"message\":\"The requested resource does not exist\"}]"));
        server.createContext("/services/data/v58.0/query", ex -> {
            if (ex.getRequestURI().getPath().endsWith("/query")) {
                reply(ex, 200, "{\"done\":false,\"nextRecordsUrl\":\"/services/data/v58.0/query/01g-2000\","
                        + "\"records\":[{\"attributes\":{\"type\":\"Lead\"},\"Id\":\"00Q1\"}]}");
            } else {
                reply(ex, 200, "{\"done\":true,\"records\":[{\"attributes\":{\"type\":\"Lead\"},\"Id\":\"00Q2\"}]}");
            }
        });
        server.createContext("/services/data/v58.0/sobjects/Lead", ex -> {
            String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            lastBody.set(body);
            if (body.contains("\"LastName\"")) {
                reply(ex, 201, "{\"id\":\"00Q9\",\"success\":true,\"errors\":[]}");
            } else {
                reply(ex, 400, "[{\"errorCode\":\"REQUIRED_FIELD_MISSING\",\"message\":\"Required fields are missing: [LastName]\","
                        + "\"fields\":[\"LastName\"]}]");
            }
        });
        server.createContext("/services/data/v58.0/sobjects/Locked__c", ex -> reply(ex, 403,
                "[{\"errorCode\":\"INSUFFICIENT_ACCESS\",\"message\":\"no access\"}]"));
        server.start();

        FormBrokerProperties props = new FormBrokerProperties();
        RecordStoreHandle handle = new RecordStoreHandle("http://localhost:" + server.getAddress().getPort(),
                "tok-1", RecordStoreHandle.Source.USER, "ts-1");
        client = new SalesforceRestClientFactory(new ObjectMapper(), props).forHandle(handle);
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private void reply(HttpExchange ex, int status, String response) throws IOException {
        lastAuth.set(ex.getRequestHeaders().getFirst("Authorization"));
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void describeReturnsFieldMetadata() {
        List<RecordStoreModels.FieldInfo> fields = client.describe("Lead");

        assertEquals(3, fields.size());
        assertTrue(fields.get(0).requiredOnCreate());
        assertFalse(fields.get(2).requiredOnCreate(), "TEST_EXPECTED: boolean с default не обязателен");
        assertEquals("Bearer tok-1", lastAuth.get());
    }

    @Test
    void describeOfUnknownObjectFails() {
        ExternalApiException e = assertThrows(ExternalApiException.class, () -> client.describe("Missing__c"));
        assertEquals(404, e.externalStatus());
        assertEquals("NOT_FOUND", e.externalCode());
    }

    @Test
    void queryFollowsNextRecordsUrl() {
        List<Map<String, Object>> rows = client.query("SELECT Id FROM Lead");

        assertEquals(2, rows.size(), "TEST_EXPECTED: обе страницы прочитаны");
        assertEquals("00Q1", rows.get(0).get("Id"));
        assertEquals("00Q2", rows.get(1).get("Id"));
        assertFalse(rows.get(0).containsKey("attributes"));
    }

    @Test
    void createReturnsIdOrErrors() {
        RecordStoreModels.CreateResult ok = client.create("Lead", Map.of("LastName", "Public", "Company", "Acme"));
        assertTrue(ok.hasId());
        assertEquals("00Q9", ok.id());
        assertTrue(lastBody.get().contains("\"Company\":\"Acme\""));

        RecordStoreModels.CreateResult fail = client.create("Lead", Map.of("Company", "Acme"));
        assertFalse(fail.success());
        assertEquals("REQUIRED_FIELD_MISSING", fail.errors().get(0).errorCode());
        assertTrue(fail.describeErrors().contains("[LastName]"));
    }

    @Test
    void forbiddenCreateIsPermissionError() {
        ExternalApiException e = assertThrows(ExternalApiException.class, () -> client.create("Locked__c", Map.of("Name", "x")));
        assertEquals(ExternalApiException.Kind.PERMISSION, e.kind());
    }
}

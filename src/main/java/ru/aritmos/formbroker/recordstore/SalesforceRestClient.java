package ru.aritmos.formbroker.recordstore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.auth.RecordStoreHandle;
import ru.aritmos.formbroker.core.ConnectionException;
import ru.aritmos.formbroker.core.ExternalApiException;
import ru.aritmos.formbroker.core.SensitiveDataSanitizer;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Реализация {@link RecordStoreClient} поверх REST API Salesforce и JDK {@link HttpClient}.
 * <p>
 * Все вызовы выполняются с заголовком {@code Authorization: Bearer ...} подключения и таймаутом запроса.
 * Постраничные результаты запросов дочитываются по {@code nextRecordsUrl}.
 */
public class SalesforceRestClient implements RecordStoreClient {

    private static final Logger log = LoggerFactory.getLogger(SalesforceRestClient.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final int MAX_PAGES = 50;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RecordStoreHandle handle;
    private final String dataPath;
    private final Duration requestTimeout;

    public SalesforceRestClient(HttpClient httpClient, ObjectMapper objectMapper, RecordStoreHandle handle, String apiVersion, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.handle = handle;
        this.dataPath = "/services/data/v" + apiVersion;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<RecordStoreModels.FieldInfo> describe(String objectType) {
        String type = Soql.identifier(objectType);
        HttpResponse<String> resp = send("GET", dataPath + "/sobjects/" + type + "/describe", null, ExternalApiException.Operation.DESCRIBE, type);
        JsonNode root = readTree(resp.body());
        if (!isSuccess(resp.statusCode())) {
            throw error(ExternalApiException.Operation.DESCRIBE, resp.statusCode(), root, type);
        }
        List<RecordStoreModels.FieldInfo> fields = new ArrayList<>();
        for (JsonNode f : root.path("fields")) {
            fields.add(new RecordStoreModels.FieldInfo(
                    f.path("name").asText(null),
                    f.path("label").asText(null),
                    f.path("type").asText(null),
                    f.path("nillable").asBoolean(true),
                    f.path("createable").asBoolean(false),
                    f.path("defaultedOnCreate").asBoolean(false)
            ));
        }
        return fields;
    }

    @Override
    public List<Map<String, Object>> query(String soql) {
        List<Map<String, Object>> records = new ArrayList<>();
        String path = dataPath + "/query?q=" + URLEncoder.encode(soql, StandardCharsets.UTF_8);
        for (int page = 0; path != null && page < MAX_PAGES; page++) {
            HttpResponse<String> resp = send("GET", path, null, ExternalApiException.Operation.QUERY, null);
            JsonNode root = readTree(resp.body());
            if (!isSuccess(resp.statusCode())) {
                throw error(ExternalApiException.Operation.QUERY, resp.statusCode(), root, null);
            }
            for (JsonNode r : root.path("records")) {
                Map<String, Object> row = objectMapper.convertValue(r, MAP_TYPE);
                row.remove("attributes");
                records.add(row);
            }
            boolean done = root.path("done").asBoolean(true);
            String next = root.path("nextRecordsUrl").asText(null);
            path = done || next == null || next.isBlank() ? null : next;
        }
        return records;
    }

    @Override
    public RecordStoreModels.CreateResult create(String objectType, Map<String, Object> record) {
        String type = Soql.identifier(objectType);
        String body;
        try {
            body = objectMapper.writeValueAsString(record);
        } catch (IOException e) {
            throw new IllegalArgumentException("Запись не сериализуется в JSON: " + e.getMessage(), e);
        }
        HttpResponse<String> resp = send("POST", dataPath + "/sobjects/" + type, body, ExternalApiException.Operation.CREATE, type);
        JsonNode root = readTree(resp.body());
        int status = resp.statusCode();
        if (isSuccess(status)) {
            String id = root.path("id").asText(null);
            if (root.path("success").asBoolean(true) && id != null && !id.isBlank()) {
                return RecordStoreModels.CreateResult.ok(id);
            }
            return RecordStoreModels.CreateResult.fail(parseErrors(root.path("errors")));
        }
        if (status == 400) {
            List<RecordStoreModels.ApiError> errors = parseErrors(root);
            log.warn("CRM отклонила создание записи {}: {}", type, SensitiveDataSanitizer.sanitizeText(
                    RecordStoreModels.CreateResult.fail(errors).describeErrors()));
            return RecordStoreModels.CreateResult.fail(errors);
        }
        throw error(ExternalApiException.Operation.CREATE, status, root, type);
    }

    private HttpResponse<String> send(String method, String path, String body, ExternalApiException.Operation op, String objectType) {
        String url = path.startsWith("http") ? path : handle.instanceUrl() + path;
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + handle.accessToken())
                .header("Accept", "application/json");
        if (body == null) {
            b.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            b.header("Content-Type", "application/json");
            b.method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("operation", op.name());
        if (objectType != null) {
            ctx.put("objectType", objectType);
        }
        try {
            return httpClient.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ConnectionException("CRM_TIMEOUT", "Таймаут запроса к CRM", ctx, e);
        } catch (IOException e) {
            throw new ConnectionException("CRM_UNAVAILABLE", "CRM недоступна: " + e.getMessage(), ctx, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("CRM_INTERRUPTED", "Запрос к CRM прерван", ctx, e);
        }
    }

    private ExternalApiException error(ExternalApiException.Operation op, int status, JsonNode root, String objectType) {
        List<RecordStoreModels.ApiError> errors = parseErrors(root);
        String code = errors.isEmpty() ? null : errors.get(0).errorCode();
        String message = errors.isEmpty() ? null : errors.get(0).message();
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (objectType != null) {
            ctx.put("objectType", objectType);
        }
        log.warn("Ошибка CRM: operation={}, status={}, code={}", op, status, code);
        return ExternalApiException.classify(op, code, status, message, ctx);
    }

    private List<RecordStoreModels.ApiError> parseErrors(JsonNode node) {
        List<RecordStoreModels.ApiError> errors = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return errors;
        }
        if (node.isObject()) {
            if (node.has("errorCode") || node.has("message")) {
                errors.add(toError(node));
            }
            return errors;
        }
        for (JsonNode e : node) {
            errors.add(toError(e));
        }
        return errors;
    }

    private RecordStoreModels.ApiError toError(JsonNode e) {
        List<String> fields = new ArrayList<>();
        for (JsonNode f : e.path("fields")) {
            fields.add(f.asText());
        }
        String code = e.has("errorCode") ? e.path("errorCode").asText(null) : e.path("statusCode").asText(null);
        return new RecordStoreModels.ApiError(code, e.path("message").asText(null), fields);
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Ответ CRM не является JSON: {}", e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}

package ru.aritmos.formbroker.recordstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import ru.aritmos.formbroker.auth.RecordStoreHandle;
import ru.aritmos.formbroker.config.FormBrokerProperties;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Фабрика REST-клиентов Salesforce. Один {@link HttpClient} разделяется всеми подключениями.
 */
@Singleton
public class SalesforceRestClientFactory implements RecordStoreClientFactory {

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String apiVersion;

    public SalesforceRestClientFactory(ObjectMapper objectMapper, FormBrokerProperties properties) {
        this.objectMapper = objectMapper;
        FormBrokerProperties.RecordStore cfg = properties.getRecordStore();
        this.requestTimeout = Duration.ofMillis(Math.max(1000, cfg.getHttpTimeoutMs()));
        this.apiVersion = cfg.getApiVersion();
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    }

    @Override
    public RecordStoreClient forHandle(RecordStoreHandle handle) {
        return new SalesforceRestClient(httpClient, objectMapper, handle, apiVersion, requestTimeout);
    }
}

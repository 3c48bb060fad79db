package ru.aritmos.formbroker.recordstore;

import java.util.List;
import java.util.Map;

/**
 * Клиент REST API CRM.
 * <p>
 * Ошибки транспорта выбрасываются как {@link ru.aritmos.formbroker.core.ConnectionException},
 * ошибки API как {@link ru.aritmos.formbroker.core.ExternalApiException}. Отказ в создании записи
 * с перечнем ошибок CRM возвращается как неуспешный {@link RecordStoreModels.CreateResult}.
 */
public interface RecordStoreClient {

    /**
     * Описание полей объекта.
     */
    List<RecordStoreModels.FieldInfo> describe(String objectType);

    /**
     * Выполнить SOQL-запрос и вернуть все записи результата.
     */
    List<Map<String, Object>> query(String soql);

    /**
     * Создать запись.
     */
    RecordStoreModels.CreateResult create(String objectType, Map<String, Object> record);
}

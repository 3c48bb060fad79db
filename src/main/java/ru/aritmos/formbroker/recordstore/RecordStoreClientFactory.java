package ru.aritmos.formbroker.recordstore;

import ru.aritmos.formbroker.auth.RecordStoreHandle;

/**
 * Создание клиента CRM для конкретного подключения.
 */
@FunctionalInterface
public interface RecordStoreClientFactory {

    RecordStoreClient forHandle(RecordStoreHandle handle);
}

package ru.aritmos.formbroker.core;

/**
 * Категории ошибок Form Broker и соответствующие им HTTP-статусы.
 */
public enum ErrorType {
    VALIDATION_ERROR(400),
    NOT_FOUND(404),
    CONFIGURATION_ERROR(400),
    CONNECTION_ERROR(503),
    EXTERNAL_API_ERROR(502),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}

package ru.aritmos.formbroker.config;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Источник времени для сервисов с TTL (сессии форм, токены, ретеншн аудита).
 */
@Factory
public class ClockFactory {

    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}

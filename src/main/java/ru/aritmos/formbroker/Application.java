package ru.aritmos.formbroker;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Form Broker.
 * <p>
 * Сервис принимает отправки веб-форм, связанные с чат-сессией агента (contextId = formId:sessionId),
 * и превращает их в записи внешней CRM: бизнес-запись по правилам маппинга, запись трекинга отправки
 * и связующие записи между ними.
 * <p>
 * Важно: правила маппинга хранятся в самой CRM (объект определения формы) и читаются при каждой
 * отправке. Локально сервис хранит только сессии форм, OAuth-токены и журнал аудита.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}

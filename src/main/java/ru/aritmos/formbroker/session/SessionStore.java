package ru.aritmos.formbroker.session;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Хранилище сессий форм.
 * <p>
 * Реализация по умолчанию хранит данные в памяти процесса; контракт позволяет заменить её
 * на разделяемое хранилище без изменения {@link SessionService}.
 */
public interface SessionStore {

    Optional<FormSession> get(String sessionId);

    void put(FormSession session);

    /**
     * Атомарно сохранить сессию, если под её id нет живой сессии. Истёкшая сессия заменяется.
     *
     * @param session новая сессия
     * @param now текущий момент для проверки срока жизни
     * @return сохранённая сессия: переданная либо уже существующая живая
     */
    FormSession putIfAbsent(FormSession session, Instant now);

    boolean delete(String sessionId);

    /**
     * Атомарно изменить сессию. Если функция вернула null, сессия удаляется.
     *
     * @return новое значение или пусто, если сессии не было либо она удалена
     */
    Optional<FormSession> compute(String sessionId, UnaryOperator<FormSession> update);

    Collection<FormSession> values();

    /**
     * Удалить все сессии, удовлетворяющие условию.
     *
     * @return количество удалённых сессий
     */
    int removeIf(Predicate<FormSession> condition);
}

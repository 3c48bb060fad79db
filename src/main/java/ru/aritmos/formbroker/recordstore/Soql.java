package ru.aritmos.formbroker.recordstore;

import ru.aritmos.formbroker.core.ConfigurationException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Построение фрагментов SOQL-запросов.
 */
public final class Soql {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*(\\.[A-Za-z][A-Za-z0-9_]*)?$");

    private Soql() {
        // утилитарный класс
    }

    /**
     * Строковый литерал в одинарных кавычках с экранированием.
     */
    public static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /**
     * Проверить имя объекта или поля перед подстановкой в запрос.
     */
    public static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new ConfigurationException("INVALID_IDENTIFIER", "Недопустимое имя объекта или поля", Map.of("name", String.valueOf(name)));
        }
        return name;
    }
}

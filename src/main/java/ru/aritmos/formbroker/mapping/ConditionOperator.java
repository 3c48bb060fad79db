package ru.aritmos.formbroker.mapping;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Операторы условий условного маппинга.
 * <p>
 * Набор закрыт: неизвестный оператор в правилах не может попасть в вычисление,
 * парсер правил заменяет его на {@link #EQUALS} с предупреждением в логе.
 */
public enum ConditionOperator {

    EQUALS("equals", "==", "eq") {
        @Override
        public boolean test(Object actual, Object expected) {
            return valuesEqual(actual, expected);
        }
    },
    NOT_EQUALS("notEquals", "!=", "ne") {
        @Override
        public boolean test(Object actual, Object expected) {
            return !valuesEqual(actual, expected);
        }
    },
    CONTAINS("contains") {
        @Override
        public boolean test(Object actual, Object expected) {
            return text(actual).contains(text(expected));
        }
    },
    NOT_CONTAINS("notContains") {
        @Override
        public boolean test(Object actual, Object expected) {
            return !text(actual).contains(text(expected));
        }
    },
    GREATER_THAN("greaterThan", ">", "gt") {
        @Override
        public boolean test(Object actual, Object expected) {
            Optional<BigDecimal> a = number(actual);
            Optional<BigDecimal> b = number(expected);
            return a.isPresent() && b.isPresent() && a.get().compareTo(b.get()) > 0;
        }
    },
    LESS_THAN("lessThan", "<", "lt") {
        @Override
        public boolean test(Object actual, Object expected) {
            Optional<BigDecimal> a = number(actual);
            Optional<BigDecimal> b = number(expected);
            return a.isPresent() && b.isPresent() && a.get().compareTo(b.get()) < 0;
        }
    },
    EXISTS("exists", "isNotEmpty", "notEmpty") {
        @Override
        public boolean test(Object actual, Object expected) {
            return isPresent(actual);
        }
    },
    IS_EMPTY("isEmpty", "notExists", "empty") {
        @Override
        public boolean test(Object actual, Object expected) {
            return !isPresent(actual);
        }
    };

    private final String[] tokens;

    ConditionOperator(String... tokens) {
        this.tokens = tokens;
    }

    /**
     * Проверить условие.
     *
     * @param actual значение поля формы
     * @param expected значение из правила
     * @return результат сравнения
     */
    public abstract boolean test(Object actual, Object expected);

    /**
     * Основное имя оператора в правилах маппинга.
     */
    public String token() {
        return tokens[0];
    }

    /**
     * Найти оператор по имени или псевдониму (регистр не учитывается).
     */
    public static Optional<ConditionOperator> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String t = token.trim();
        for (ConditionOperator op : values()) {
            for (String candidate : op.tokens) {
                if (candidate.equalsIgnoreCase(t)) {
                    return Optional.of(op);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Значение считается присутствующим, если оно не null и не пустая строка.
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof String s) || !s.isEmpty();
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            Optional<BigDecimal> a = number(actual);
            Optional<BigDecimal> b = number(expected);
            if (a.isPresent() && b.isPresent()) {
                return a.get().compareTo(b.get()) == 0;
            }
        }
        return Objects.equals(actual, expected);
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static Optional<BigDecimal> number(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal d) {
            return Optional.of(d);
        }
        String s = String.valueOf(value).trim();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}

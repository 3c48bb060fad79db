package ru.aritmos.formbroker.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Преобразования полей формы: разбиение имени, форматирование телефона и даты, конкатенация.
 * <p>
 * Все функции чистые: читают исходные данные формы и возвращают набор новых полей
 * (пустая карта, если результата нет). Исключения наружу не выбрасываются.
 */
public final class FieldTransformer {

    private static final Logger log = LoggerFactory.getLogger(FieldTransformer.class);

    static final String DEFAULT_FIRST_NAME_FIELD = "FirstName";
    static final String DEFAULT_LAST_NAME_FIELD = "LastName";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s, DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT)).atStartOfDay().toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s, DateTimeFormatter.ofPattern("d.M.uuuu").withResolverStyle(ResolverStyle.STRICT)).atStartOfDay().toInstant(ZoneOffset.UTC),
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC)
    );

    private FieldTransformer() {
        // утилитарный класс
    }

    /**
     * Применить все преобразования к копии данных формы.
     * <p>
     * Каждое преобразование читает исходные данные; результаты добавляются к копии
     * (исходные ключи сохраняются, одноимённые перекрываются).
     *
     * @param formData исходные данные формы
     * @param transformations преобразования из правил маппинга
     * @return дополненные данные
     */
    public static Map<String, Object> applyAll(Map<String, Object> formData, Map<String, MappingModels.TransformSpec> transformations) {
        Map<String, Object> augmented = new LinkedHashMap<>(formData);
        if (transformations == null || transformations.isEmpty()) {
            return augmented;
        }
        for (MappingModels.TransformSpec spec : transformations.values()) {
            try {
                augmented.putAll(apply(formData, spec));
            } catch (RuntimeException e) {
                log.warn("Преобразование {} ({}) не применено: {}", spec.key(), spec.type().token(), e.getMessage());
            }
        }
        return augmented;
    }

    public static Map<String, Object> apply(Map<String, Object> formData, MappingModels.TransformSpec spec) {
        return switch (spec.type()) {
            case SPLIT_NAME -> splitName(formData, spec);
            case FORMAT_PHONE -> single(spec.target(), formatPhone(formData.get(spec.source()), spec.option("format", "US")));
            case FORMAT_DATE -> single(spec.target(), formatDate(formData.get(spec.source()), spec.option("outputFormat", "ISO8601")));
            case CONCAT -> single(spec.target(), concat(formData, spec.sources(), spec.option("separator", " ")));
        };
    }

    /**
     * Разбить полное имя: последнее слово становится фамилией, остальные именем.
     * Для одного слова заполняется только фамилия.
     */
    public static Map<String, Object> splitName(Map<String, Object> formData, MappingModels.TransformSpec spec) {
        String source = spec.source() == null ? "name" : spec.source();
        Map<String, Object> out = new LinkedHashMap<>();
        String[] parts = splitNameParts(formData.get(source), spec.options().get("delimiter"));
        if (parts.length == 0) {
            return out;
        }
        String firstField = spec.option("firstName", DEFAULT_FIRST_NAME_FIELD);
        String lastField = spec.option("lastName", DEFAULT_LAST_NAME_FIELD);
        if (parts.length > 1) {
            out.put(firstField, String.join(" ", Arrays.copyOf(parts, parts.length - 1)));
        }
        out.put(lastField, parts[parts.length - 1]);
        return out;
    }

    static String[] splitNameParts(Object value, String delimiter) {
        if (!(value instanceof String s) || s.isBlank()) {
            return new String[0];
        }
        String trimmed = s.trim();
        String[] raw = delimiter == null || delimiter.isEmpty() || delimiter.isBlank()
                ? WHITESPACE.split(trimmed)
                : trimmed.split(Pattern.quote(delimiter));
        List<String> parts = new ArrayList<>();
        for (String p : raw) {
            String t = p.trim();
            if (!t.isEmpty()) {
                parts.add(t);
            }
        }
        return parts.toArray(new String[0]);
    }

    /**
     * Отформатировать телефон. Номер из 10 цифр форматируется, остальные возвращаются только цифрами.
     *
     * @param value исходное значение
     * @param format US, NATIONAL или E164
     * @return отформатированный номер или null, если цифр нет
     */
    public static String formatPhone(Object value, String format) {
        if (!ConditionOperator.isPresent(value)) {
            return null;
        }
        String digits = NON_DIGITS.matcher(String.valueOf(value)).replaceAll("");
        if (digits.isEmpty()) {
            return null;
        }
        if ("E164".equalsIgnoreCase(format)) {
            if (digits.length() == 11 && digits.startsWith("1")) {
                return "+" + digits;
            }
            return digits.length() == 10 ? "+1" + digits : digits;
        }
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        return digits;
    }

    /**
     * Отформатировать дату.
     *
     * @param value исходное значение (ISO-дата, ISO-дата-время, M/d/yyyy, d.M.yyyy)
     * @param outputFormat ISO8601 или YYYY-MM-DD для даты; иное значение даёт ISO-момент времени в UTC
     * @return строка даты или null, если значение не распознано
     */
    public static String formatDate(Object value, String outputFormat) {
        if (!ConditionOperator.isPresent(value)) {
            return null;
        }
        Instant instant = parseInstant(String.valueOf(value).trim());
        if (instant == null) {
            return null;
        }
        if ("ISO8601".equalsIgnoreCase(outputFormat) || "YYYY-MM-DD".equalsIgnoreCase(outputFormat)) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(instant.atOffset(ZoneOffset.UTC));
        }
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private static Instant parseInstant(String s) {
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(s);
            } catch (DateTimeParseException e) {
                log.trace("Дата '{}' не распознана: {}", s, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Склеить непустые значения полей через разделитель.
     *
     * @return строка или null, если ни одно поле не заполнено
     */
    public static String concat(Map<String, Object> formData, List<String> sources, String separator) {
        List<String> values = new ArrayList<>();
        for (String source : sources) {
            Object v = formData.get(source);
            if (ConditionOperator.isPresent(v)) {
                values.add(String.valueOf(v));
            }
        }
        return values.isEmpty() ? null : String.join(separator, values);
    }

    private static Map<String, Object> single(String target, Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (target != null && value != null) {
            out.put(target, value);
        }
        return out;
    }
}

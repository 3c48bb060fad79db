package ru.aritmos.formbroker.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import ru.aritmos.formbroker.core.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Модели определения формы и правил маппинга.
 */
public final class MappingModels {

    private MappingModels() {
        // утилитарный класс
    }

    /**
     * Правила маппинга данных формы в бизнес-запись CRM.
     *
     * @param targetObjectType тип бизнес-записи (например, Lead) или null, если бизнес-запись не создаётся
     * @param fieldMappings прямой маппинг: поле формы → поле записи
     * @param conditionalMappings условный маппинг: поле записи → правило
     * @param transformations преобразования: ключ → описание
     */
    public record MappingRules(
            String targetObjectType,
            Map<String, String> fieldMappings,
            Map<String, ConditionalRule> conditionalMappings,
            Map<String, TransformSpec> transformations
    ) {

        public MappingRules {
            fieldMappings = fieldMappings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldMappings));
            conditionalMappings = conditionalMappings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(conditionalMappings));
            transformations = transformations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(transformations));
        }

        public static MappingRules empty() {
            return new MappingRules(null, Map.of(), Map.of(), Map.of());
        }

        public boolean hasTransformation(TransformType type) {
            return transformations.values().stream().anyMatch(t -> t.type() == type);
        }
    }

    /**
     * Правило условного маппинга.
     */
    public interface ConditionalRule {
    }

    /**
     * Форма «when/then/else»: если все поля {@code when} равны значениям формы, значение берётся
     * из {@code thenMapFrom}, иначе из {@code elseMapFrom}.
     */
    public record WhenThenElse(Map<String, Object> when, String thenMapFrom, String elseMapFrom) implements ConditionalRule {

        public WhenThenElse {
            when = when == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(when));
        }
    }

    /**
     * Упорядоченный список условий; применяется первое истинное условие, у которого есть источник значения.
     */
    public record ConditionsList(List<ConditionalBranch> branches) implements ConditionalRule {

        public ConditionsList {
            branches = branches == null ? List.of() : List.copyOf(branches);
        }
    }

    /**
     * Ветка списка условий.
     *
     * @param condition условие
     * @param mapFrom поле формы-источник значения
     * @param value литеральное значение (приоритетнее mapFrom)
     * @param hasValue задано ли литеральное значение в правиле
     */
    public record ConditionalBranch(Condition condition, String mapFrom, Object value, boolean hasValue) {
    }

    public record Condition(String field, ConditionOperator operator, Object value) {

        public boolean test(Map<String, Object> data) {
            return operator.test(data.get(field), value);
        }
    }

    /**
     * Тип преобразования поля.
     */
    public enum TransformType {
        SPLIT_NAME("splitName"),
        FORMAT_PHONE("formatPhone"),
        FORMAT_DATE("formatDate"),
        CONCAT("concat");

        private final String token;

        TransformType(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        public static Optional<TransformType> fromToken(String token) {
            for (TransformType t : values()) {
                if (t.token.equalsIgnoreCase(token == null ? "" : token.trim())) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Описание преобразования.
     *
     * @param key ключ преобразования в правилах
     * @param type тип
     * @param source поле-источник
     * @param sources поля-источники (concat)
     * @param target поле-результат (для splitName не используется)
     * @param options параметры: delimiter, format, outputFormat, inputFormat, separator, firstName, lastName
     */
    public record TransformSpec(String key, TransformType type, String source, List<String> sources, String target, Map<String, String> options) {

        public TransformSpec {
            sources = sources == null ? List.of() : List.copyOf(sources);
            options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        }

        public String option(String name, String defaultValue) {
            String v = options.get(name);
            return v == null ? defaultValue : v;
        }
    }

    /**
     * Определение формы, прочитанное из CRM.
     * <p>
     * JSON-поля разбираются независимо: ошибка разбора одного поля фиксируется в {@code parseErrors}
     * и не мешает остальным.
     *
     * @param recordId идентификатор записи определения в CRM
     * @param formId идентификатор формы
     * @param name имя записи
     * @param fieldsSchema схема полей формы
     * @param mappingRules разобранные правила маппинга (null, если не заданы или не разобраны)
     * @param rawMappings исходный JSON правил маппинга
     * @param agentConfig конфигурация агента
     * @param active признак активности формы
     * @param parseErrors ошибки разбора по имени поля CRM
     */
    public record FormDefinition(
            String recordId,
            String formId,
            String name,
            JsonNode fieldsSchema,
            MappingRules mappingRules,
            JsonNode rawMappings,
            JsonNode agentConfig,
            boolean active,
            Map<String, ConfigurationException> parseErrors
    ) {

        public FormDefinition {
            parseErrors = parseErrors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parseErrors));
        }

        /**
         * Правила маппинга для отправки формы.
         *
         * @return правила или {@link MappingRules#empty()}, если правила не заданы
         * @throws ConfigurationException если правила заданы, но не разобраны
         */
        public MappingRules requireMappingRules() {
            ConfigurationException error = parseErrors.get(MappingResolver.MAPPING_RULES_FIELD);
            if (error != null) {
                throw error;
            }
            return mappingRules == null ? MappingRules.empty() : mappingRules;
        }
    }
}

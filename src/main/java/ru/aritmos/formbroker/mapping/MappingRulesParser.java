package ru.aritmos.formbroker.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Разбор JSON правил маппинга в типизированную модель.
 * <p>
 * Структура корня должна быть объектом; отдельные некорректные элементы (неизвестный тип
 * преобразования, правило без источника) пропускаются с предупреждением в логе.
 */
@Singleton
public class MappingRulesParser {

    private static final Logger log = LoggerFactory.getLogger(MappingRulesParser.class);

    private final ObjectMapper objectMapper;

    public MappingRulesParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MappingModels.MappingRules parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return MappingModels.MappingRules.empty();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("INVALID_MAPPING_RULES", "Правила маппинга должны быть JSON-объектом",
                    Map.of("field", MappingResolver.MAPPING_RULES_FIELD));
        }
        String target = firstText(root, "salesforceObject", "targetObjectType", "objectType");
        return new MappingModels.MappingRules(
                target,
                parseFieldMappings(root.path("fieldMappings")),
                parseConditionals(root.path("conditionalMappings")),
                parseTransformations(root.path("transformations"))
        );
    }

    private Map<String, String> parseFieldMappings(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (!node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isTextual() && !e.getValue().asText().isBlank()) {
                out.put(e.getKey(), e.getValue().asText().trim());
            } else {
                log.warn("Маппинг поля {} пропущен: ожидается имя поля записи", e.getKey());
            }
        }
        return out;
    }

    private Map<String, MappingModels.ConditionalRule> parseConditionals(JsonNode node) {
        Map<String, MappingModels.ConditionalRule> out = new LinkedHashMap<>();
        if (!node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode rule = e.getValue();
            if (rule.path("conditions").isArray()) {
                out.put(e.getKey(), parseConditionsList(e.getKey(), rule.path("conditions")));
            } else if (rule.path("when").isObject()) {
                out.put(e.getKey(), new MappingModels.WhenThenElse(
                        toMap(rule.path("when")),
                        mapFrom(rule.path("then")),
                        mapFrom(rule.path("else"))
                ));
            } else {
                log.warn("Условный маппинг {} пропущен: нет ни conditions, ни when", e.getKey());
            }
        }
        return out;
    }

    private MappingModels.ConditionsList parseConditionsList(String target, JsonNode conditions) {
        List<MappingModels.ConditionalBranch> branches = new ArrayList<>();
        for (JsonNode c : conditions) {
            JsonNode cond = c.has("if") ? c.path("if") : c;
            String field = firstText(cond, "field", "formField");
            if (field == null) {
                log.warn("Условие для {} пропущено: не задано поле", target);
                continue;
            }
            String opToken = firstText(cond, "operator");
            ConditionOperator op = opToken == null ? ConditionOperator.EQUALS : ConditionOperator.fromToken(opToken).orElseGet(() -> {
                log.warn("Неизвестный оператор {} в условии для {}, используется equals", opToken, target);
                return ConditionOperator.EQUALS;
            });
            Object value = cond.has("value") ? objectMapper.convertValue(cond.get("value"), Object.class) : null;

            JsonNode then = c.path("then");
            boolean hasValue = then.isObject() && then.has("value") && !then.get("value").isNull();
            Object literal = hasValue ? objectMapper.convertValue(then.get("value"), Object.class) : null;
            branches.add(new MappingModels.ConditionalBranch(new MappingModels.Condition(field, op, value), mapFrom(then), literal, hasValue));
        }
        return new MappingModels.ConditionsList(branches);
    }

    private Map<String, MappingModels.TransformSpec> parseTransformations(JsonNode node) {
        Map<String, MappingModels.TransformSpec> out = new LinkedHashMap<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                parseTransformation(e.getKey(), e.getValue()).ifPresent(t -> out.put(t.key(), t));
            }
        } else if (node.isArray()) {
            int i = 0;
            for (JsonNode t : node) {
                String key = t.path("target").isTextual() ? t.path("target").asText() : "transformation" + i;
                parseTransformation(key, t).ifPresent(spec -> out.put(spec.key(), spec));
                i++;
            }
        }
        return out;
    }

    private Optional<MappingModels.TransformSpec> parseTransformation(String key, JsonNode node) {
        if (!node.isObject()) {
            log.warn("Преобразование {} пропущено: ожидается объект", key);
            return Optional.empty();
        }
        String typeToken = firstText(node, "type");
        Optional<MappingModels.TransformType> type = MappingModels.TransformType.fromToken(typeToken);
        if (type.isEmpty()) {
            log.warn("Неизвестный тип преобразования {} ({}), преобразование пропущено", typeToken, key);
            return Optional.empty();
        }

        Map<String, String> options = new LinkedHashMap<>();
        for (String opt : List.of("delimiter", "format", "outputFormat", "inputFormat", "separator")) {
            String v = node.path(opt).isValueNode() && !node.path(opt).isNull() ? node.path(opt).asText() : null;
            if (v != null) {
                options.put(opt, v);
            }
        }
        JsonNode targetNode = node.path("target");
        String target = null;
        if (targetNode.isObject()) {
            String first = firstText(targetNode, "firstName");
            String last = firstText(targetNode, "lastName");
            if (first != null) {
                options.put("firstName", first);
            }
            if (last != null) {
                options.put("lastName", last);
            }
        } else if (targetNode.isTextual()) {
            target = targetNode.asText();
        }
        if (target == null && type.get() != MappingModels.TransformType.SPLIT_NAME) {
            target = key;
        }

        List<String> sources = new ArrayList<>();
        for (JsonNode s : node.path("sources")) {
            if (s.isTextual()) {
                sources.add(s.asText());
            }
        }
        return Optional.of(new MappingModels.TransformSpec(key, type.get(), firstText(node, "source", "field"), sources, target, options));
    }

    private String mapFrom(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return firstText(node, "mapFrom");
    }

    private Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), objectMapper.convertValue(e.getValue(), Object.class));
        }
        return out;
    }

    private static String firstText(JsonNode node, String... names) {
        for (String n : names) {
            JsonNode v = node.path(n);
            if (v.isTextual() && !v.asText().isBlank()) {
                return v.asText().trim();
            }
        }
        return null;
    }
}

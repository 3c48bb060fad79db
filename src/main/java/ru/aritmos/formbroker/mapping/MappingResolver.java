package ru.aritmos.formbroker.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.auth.RecordStoreHandle;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ConfigurationException;
import ru.aritmos.formbroker.core.NotFoundException;
import ru.aritmos.formbroker.recordstore.RecordStoreClient;
import ru.aritmos.formbroker.recordstore.RecordStoreClientFactory;
import ru.aritmos.formbroker.recordstore.Soql;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Получение определения формы и правил маппинга из CRM.
 * <p>
 * Определение читается при каждом запросе, кэша нет: изменения в CRM применяются сразу.
 */
@Singleton
public class MappingResolver {

    private static final Logger log = LoggerFactory.getLogger(MappingResolver.class);

    public static final String FIELDS_JSON_FIELD = "Fields_JSON__c";
    public static final String MAPPING_RULES_FIELD = "Mapping_Rules__c";
    public static final String AGENT_CONFIG_FIELD = "Agent_Config__c";

    private final RecordStoreClientFactory clientFactory;
    private final MappingRulesParser parser;
    private final ObjectMapper objectMapper;
    private final String formDefinitionObject;

    public MappingResolver(RecordStoreClientFactory clientFactory,
                           MappingRulesParser parser,
                           ObjectMapper objectMapper,
                           FormBrokerProperties properties) {
        this.clientFactory = clientFactory;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.formDefinitionObject = Soql.identifier(properties.getRecordStore().getFormDefinitionObject());
    }

    public MappingModels.FormDefinition fetch(String formId, RecordStoreHandle handle) {
        return fetch(formId, clientFactory.forHandle(handle));
    }

    /**
     * Прочитать определение формы по Form_Id__c или Name.
     *
     * @param formId идентификатор формы
     * @param client клиент CRM
     * @return определение формы; ошибки разбора JSON-полей собраны в {@code parseErrors}
     * @throws NotFoundException если определение не найдено
     */
    public MappingModels.FormDefinition fetch(String formId, RecordStoreClient client) {
        String literal = Soql.quote(formId);
        String soql = "SELECT Id, Name, Form_Id__c, " + FIELDS_JSON_FIELD + ", " + MAPPING_RULES_FIELD + ", "
                + AGENT_CONFIG_FIELD + ", Active__c FROM " + formDefinitionObject
                + " WHERE Form_Id__c = " + literal + " OR Name = " + literal + " LIMIT 1";
        List<Map<String, Object>> rows = client.query(soql);
        if (rows.isEmpty()) {
            throw new NotFoundException("FORM_NOT_FOUND", "Определение формы не найдено", Map.of("formId", formId));
        }
        Map<String, Object> row = rows.get(0);

        Map<String, ConfigurationException> errors = new LinkedHashMap<>();
        JsonNode fields = readJson(row, FIELDS_JSON_FIELD, formId, errors);
        JsonNode rawMappings = readJson(row, MAPPING_RULES_FIELD, formId, errors);
        JsonNode agentConfig = readJson(row, AGENT_CONFIG_FIELD, formId, errors);

        MappingModels.MappingRules rules = null;
        if (rawMappings != null) {
            try {
                rules = parser.parse(rawMappings);
            } catch (ConfigurationException e) {
                log.warn("Правила маппинга формы {} не разобраны: {}", formId, e.getMessage());
                errors.put(MAPPING_RULES_FIELD, e);
            }
        }

        String recordFormId = text(row.get("Form_Id__c"));
        String name = text(row.get("Name"));
        return new MappingModels.FormDefinition(
                text(row.get("Id")),
                recordFormId != null ? recordFormId : (name != null ? name : formId),
                name,
                fields,
                rules,
                rawMappings,
                agentConfig,
                !Boolean.FALSE.equals(row.get("Active__c")),
                errors
        );
    }

    /**
     * Представление формы для клиента.
     * <p>
     * Поддерживаются три формы Fields_JSON__c: объект с {@code sections}, массив полей
     * и объект с {@code fields}. Иначе возвращается пустой список полей.
     */
    public Map<String, Object> render(MappingModels.FormDefinition form) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("formId", form.formId());
        view.put("name", form.name() == null ? "Unnamed Form" : form.name());
        JsonNode fields = form.fieldsSchema();
        if (fields != null && fields.isObject() && fields.hasNonNull("sections")) {
            view.put("title", textOr(fields, "title", form.name()));
            view.put("formId", textOr(fields, "formId", form.formId()));
            view.put("sections", fields.get("sections"));
        } else if (fields != null && fields.isArray()) {
            view.put("fields", fields);
        } else if (fields != null && fields.isObject() && fields.hasNonNull("fields")) {
            view.put("title", textOr(fields, "title", textOr(fields, "name", form.name())));
            view.put("formId", textOr(fields, "formId", form.formId()));
            view.put("fields", fields.get("fields"));
        } else {
            log.warn("В {} формы {} нет ни sections, ни fields", FIELDS_JSON_FIELD, form.formId());
            view.put("fields", List.of());
        }
        view.put("mappings", form.rawMappings());
        view.put("agentConfig", form.agentConfig());
        view.put("active", form.active());
        return view;
    }

    private JsonNode readJson(Map<String, Object> row, String field, String formId, Map<String, ConfigurationException> errors) {
        Object value = row.get(field);
        if (value == null || (value instanceof String s && s.isBlank())) {
            return null;
        }
        if (!(value instanceof String s)) {
            return objectMapper.valueToTree(value);
        }
        try {
            return objectMapper.readTree(s);
        } catch (JsonProcessingException e) {
            log.warn("Поле {} формы {} содержит некорректный JSON: {}", field, formId, e.getOriginalMessage());
            errors.put(field, new ConfigurationException("INVALID_JSON_FIELD",
                    "Поле " + field + " содержит некорректный JSON", Map.of("field", field, "formId", formId), e));
            return null;
        }
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() && !v.asText().isBlank() ? v.asText() : fallback;
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}

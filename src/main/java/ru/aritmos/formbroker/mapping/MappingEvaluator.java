package ru.aritmos.formbroker.mapping;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Построение бизнес-записи CRM из данных формы по правилам маппинга.
 * <p>
 * Порядок шагов:
 * <ol>
 *   <li>преобразования дополняют копию данных формы новыми ключами;</li>
 *   <li>прямой маппинг переносит поля с заданным соответствием, остальные попадают в unmapped;</li>
 *   <li>условный маппинг перекрывает значения при выполнении условий;</li>
 *   <li>если в правилах нет splitName, поле {@code name}, отображённое в LastName, разбивается
 *       на FirstName и LastName.</li>
 * </ol>
 */
@Singleton
public class MappingEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MappingEvaluator.class);

    static final String LEGACY_NAME_FIELD = "name";

    /**
     * Результат маппинга.
     *
     * @param record поля бизнес-записи
     * @param unmapped поля формы без прямого маппинга (диагностика)
     * @param augmentedData данные формы после преобразований
     */
    public record MappingResult(Map<String, Object> record, List<String> unmapped, Map<String, Object> augmentedData) {

        public MappingResult {
            record = Collections.unmodifiableMap(new LinkedHashMap<>(record));
            unmapped = List.copyOf(unmapped);
            augmentedData = Collections.unmodifiableMap(new LinkedHashMap<>(augmentedData));
        }
    }

    public MappingResult evaluate(Map<String, Object> formData, MappingModels.MappingRules rules) {
        Map<String, Object> data = FieldTransformer.applyAll(formData == null ? Map.of() : formData, rules.transformations());

        Map<String, Object> record = new LinkedHashMap<>();
        List<String> unmapped = new ArrayList<>();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            String target = rules.fieldMappings().get(e.getKey());
            if (target == null) {
                unmapped.add(e.getKey());
            } else if (e.getValue() != null) {
                record.put(target, e.getValue());
            }
        }

        for (Map.Entry<String, MappingModels.ConditionalRule> e : rules.conditionalMappings().entrySet()) {
            Object resolved = resolveConditional(e.getValue(), data);
            if (ConditionOperator.isPresent(resolved)) {
                record.put(e.getKey(), resolved);
            } else {
                log.debug("Условный маппинг {} не дал значения, поле оставлено без изменений", e.getKey());
            }
        }

        if (!rules.hasTransformation(MappingModels.TransformType.SPLIT_NAME)) {
            splitLegacyName(formData, rules, record);
        }

        if (!unmapped.isEmpty()) {
            log.debug("Поля формы без маппинга: {}", unmapped);
        }
        return new MappingResult(record, unmapped, data);
    }

    private Object resolveConditional(MappingModels.ConditionalRule rule, Map<String, Object> data) {
        if (rule instanceof MappingModels.WhenThenElse wte) {
            boolean matched = wte.when().entrySet().stream()
                    .allMatch(w -> ConditionOperator.EQUALS.test(data.get(w.getKey()), w.getValue()));
            String source = matched ? wte.thenMapFrom() : wte.elseMapFrom();
            return source == null ? null : data.get(source);
        }
        if (rule instanceof MappingModels.ConditionsList list) {
            for (MappingModels.ConditionalBranch branch : list.branches()) {
                if (!branch.condition().test(data)) {
                    continue;
                }
                if (branch.mapFrom() != null) {
                    return data.get(branch.mapFrom());
                }
                if (branch.hasValue()) {
                    return branch.value();
                }
            }
        }
        return null;
    }

    private void splitLegacyName(Map<String, Object> formData, MappingModels.MappingRules rules, Map<String, Object> record) {
        if (formData == null
                || !FieldTransformer.DEFAULT_LAST_NAME_FIELD.equals(rules.fieldMappings().get(LEGACY_NAME_FIELD))
                || record.get(FieldTransformer.DEFAULT_LAST_NAME_FIELD) == null
                || record.containsKey(FieldTransformer.DEFAULT_FIRST_NAME_FIELD)) {
            return;
        }
        String[] parts = FieldTransformer.splitNameParts(formData.get(LEGACY_NAME_FIELD), null);
        if (parts.length > 1) {
            record.put(FieldTransformer.DEFAULT_FIRST_NAME_FIELD, String.join(" ", Arrays.copyOf(parts, parts.length - 1)));
            record.put(FieldTransformer.DEFAULT_LAST_NAME_FIELD, parts[parts.length - 1]);
        }
    }
}

package ru.aritmos.formbroker.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MappingEvaluatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MappingRulesParser parser = new MappingRulesParser(mapper);
    private final MappingEvaluator evaluator = new MappingEvaluator();

    private MappingModels.MappingRules rules(String json) throws Exception {
        return parser.parse(mapper.readTree(json));
    }

    @Test
    void whenThenElsePicksSourceByCondition() throws Exception {
        MappingModels.MappingRules r = rules("""
                {"targetObjectType":"Lead",
                 "fieldMappings":{"lastName":"LastName"},
                 "conditionalMappings":{"Company":{"when":{"enquiryType":"commercial"},
                   "then":{"mapFrom":"companyName"},"else":{"mapFrom":"lastName"}}}}
                """);

        Map<String, Object> commercial = evaluator.evaluate(Map.of("enquiryType", "commercial", "companyName", "Acme"), r).record();
        Map<String, Object> personal = evaluator.evaluate(Map.of("enquiryType", "personal", "lastName", "Smith"), r).record();

        assertEquals("Acme", commercial.get("Company"));
        assertEquals("Smith", personal.get("Company"));
        assertEquals("Smith", personal.get("LastName"));
    }

    @Test
    void firstSatisfiedConditionWins() throws Exception {
        MappingModels.MappingRules r = rules("""
                {"conditionalMappings":{"Rating":{"conditions":[
                  {"if":{"field":"budget","operator":"greaterThan","value":1000},"then":{"value":"Hot"}},
                  {"if":{"field":"budget","operator":"greaterThan","value":10},"then":{"value":"Warm"}},
                  {"if":{"field":"budget","operator":"exists"},"then":{"mapFrom":"missing"}}
                ]}}}
                """);

        assertEquals("Hot", evaluator.evaluate(Map.of("budget", 5000), r).record().get("Rating"));
        assertEquals("Warm", evaluator.evaluate(Map.of("budget", 50), r).record().get("Rating"));
        assertFalse(evaluator.evaluate(Map.of("budget", 1), r).record().containsKey("Rating"),
                "TEST_EXPECTED: пустой источник не перекрывает запись");
    }

    @Test
    void conditionalKeepsStaticValueWhenSourceEmpty() throws Exception {
        MappingModels.MappingRules r = rules("""
                {"fieldMappings":{"company":"Company"},
                 "conditionalMappings":{"Company":{"when":{"b2b":true},"then":{"mapFrom":"org"}}}}
                """);

        Map<String, Object> record = evaluator.evaluate(Map.of("company", "Static Inc", "b2b", true, "org", ""), r).record();

        assertEquals("Static Inc", record.get("Company"));
    }

    @Test
    void staticMappingSkipsNullsAndReportsUnmapped() throws Exception {
        MappingModels.MappingRules r = rules("{\"fieldMappings\":{\"email\":\"Email\",\"phone\":\"Phone\"}}");
        Map<String, Object> data = new HashMap<>();
        data.put("email", "a@b.c");
        data.put("phone", null);
        data.put("comment", "hello");

        MappingEvaluator.MappingResult result = evaluator.evaluate(data, r);

        assertEquals(Map.of("Email", "a@b.c"), result.record());
        assertEquals(java.util.List.of("comment"), result.unmapped());
    }

    @Test
    void legacyNameFieldIsSplitWithoutSplitNameRule() throws Exception {
        MappingModels.MappingRules r = rules("{\"fieldMappings\":{\"name\":\"LastName\"}}");

        Map<String, Object> record = evaluator.evaluate(Map.of("name", "Mary Ann Smith"), r).record();
        assertEquals("Mary Ann", record.get("FirstName"));
        assertEquals("Smith", record.get("LastName"));

        Map<String, Object> single = evaluator.evaluate(Map.of("name", "Cher"), r).record();
        assertEquals(Map.of("LastName", "Cher"), single);
    }

    @Test
    void transformationsFeedStaticMapping() throws Exception {
        MappingModels.MappingRules r = rules("""
                {"fieldMappings":{"FirstName":"FirstName","LastName":"LastName","phoneFormatted":"Phone"},
                 "transformations":{
                   "split":{"type":"splitName","source":"fullName"},
                   "phoneFormatted":{"type":"formatPhone","source":"phone"}}}
                """);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("fullName", "John Q Public");
        data.put("phone", "415.555.1212");

        MappingEvaluator.MappingResult result = evaluator.evaluate(data, r);

        assertEquals("John Q", result.record().get("FirstName"));
        assertEquals("Public", result.record().get("LastName"));
        assertEquals("(415) 555-1212", result.record().get("Phone"));
        assertTrue(result.unmapped().contains("fullName"));
        assertEquals("415.555.1212", result.augmentedData().get("phone"));
    }
}

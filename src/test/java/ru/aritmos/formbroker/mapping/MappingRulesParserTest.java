package ru.aritmos.formbroker.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.core.ConfigurationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MappingRulesParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MappingRulesParser parser = new MappingRulesParser(mapper);

    @Test
    void parsesAllSections() throws Exception {
        String json = """
                {
                  "salesforceObject": "Lead",
                  "fieldMappings": {"email": "Email", "lastName": "LastName", "bad": 5},
                  "conditionalMappings": {
                    "Company": {"when": {"enquiryType": "commercial"}, "then": {"mapFrom": "companyName"}, "else": {"mapFrom": "lastName"}},
                    "LeadSource": {"conditions": [
                      {"if": {"field": "budget", "operator": ">", "value": 1000}, "then": {"value": "Enterprise"}},
                      {"if": {"field": "budget", "operator": "bogus", "value": 0}, "then": {"mapFrom": "source"}}
                    ]}
                  },
                  "transformations": {
                    "nameSplit": {"type": "splitName", "source": "fullName", "target": {"firstName": "FirstName", "lastName": "LastName"}},
                    "Phone": {"type": "formatPhone", "source": "phone", "format": "E164"},
                    "unknown": {"type": "uppercase", "source": "x"}
                  }
                }
                """;

        MappingModels.MappingRules rules = parser.parse(mapper.readTree(json));

        assertEquals("Lead", rules.targetObjectType());
        assertEquals(2, rules.fieldMappings().size(), "TEST_EXPECTED: нетекстовый маппинг пропущен");
        MappingModels.WhenThenElse company = assertInstanceOf(MappingModels.WhenThenElse.class, rules.conditionalMappings().get("Company"));
        assertEquals("companyName", company.thenMapFrom());
        assertEquals("lastName", company.elseMapFrom());

        MappingModels.ConditionsList source = assertInstanceOf(MappingModels.ConditionsList.class, rules.conditionalMappings().get("LeadSource"));
        assertEquals(ConditionOperator.GREATER_THAN, source.branches().get(0).condition().operator());
        assertTrue(source.branches().get(0).hasValue());
        assertEquals(ConditionOperator.EQUALS, source.branches().get(1).condition().operator(), "TEST_EXPECTED: неизвестный оператор → equals");

        assertEquals(2, rules.transformations().size(), "TEST_EXPECTED: неизвестный тип пропущен");
        MappingModels.TransformSpec phone = rules.transformations().get("Phone");
        assertEquals("Phone", phone.target());
        assertEquals("E164", phone.option("format", "US"));
        assertNull(rules.transformations().get("nameSplit").target());
        assertTrue(rules.hasTransformation(MappingModels.TransformType.SPLIT_NAME));
    }

    @Test
    void acceptsTransformationArray() throws Exception {
        MappingModels.MappingRules rules = parser.parse(mapper.readTree(
                "{\"targetObjectType\":\"Contact\",\"transformations\":[{\"type\":\"concat\",\"sources\":[\"a\",\"b\"],\"target\":\"Description\"}]}"));

        assertEquals("Contact", rules.targetObjectType());
        assertEquals(MappingModels.TransformType.CONCAT, rules.transformations().get("Description").type());
    }

    @Test
    void nonObjectRootIsConfigurationError() throws Exception {
        assertThrows(ConfigurationException.class, () -> parser.parse(mapper.readTree("[1,2]")));
        assertNull(parser.parse(null).targetObjectType());
    }
}

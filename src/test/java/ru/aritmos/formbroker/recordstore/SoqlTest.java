package ru.aritmos.formbroker.recordstore;

import org.junit.jupiter.api.Test;
import ru.aritmos.formbroker.core.ConfigurationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SoqlTest {

    @Test
    void quotesAndEscapesLiterals() {
        assertEquals("'contact-form'", Soql.quote("contact-form"));
        assertEquals("'O\\'Brien'", Soql.quote("O'Brien"));
        assertEquals("'a\\\\b'", Soql.quote("a\\b"));
        assertEquals("'x\\ny'", Soql.quote("x\ny"));
        assertEquals("null", Soql.quote(null));
    }

    @Test
    void acceptsOnlyPlainIdentifiers() {
        assertEquals("Form_Submission__c", Soql.identifier("Form_Submission__c"));
        assertEquals("Account.Name", Soql.identifier("Account.Name"));
        assertThrows(ConfigurationException.class, () -> Soql.identifier("Lead; DELETE"));
        assertThrows(ConfigurationException.class, () -> Soql.identifier("1Lead"));
        assertThrows(ConfigurationException.class, () -> Soql.identifier(null));
    }

    @Test
    void recognizesDuplicateViolations() {
        RecordStoreModels.CreateResult dup = RecordStoreModels.CreateResult.fail(List.of(
                new RecordStoreModels.ApiError("DUPLICATE_VALUE", "duplicate value found: Context_ID__c", List.of())));
        RecordStoreModels.CreateResult other = RecordStoreModels.CreateResult.fail(List.of(
                new RecordStoreModels.ApiError("REQUIRED_FIELD_MISSING", "Required fields are missing", List.of("Name"))));

        assertTrue(dup.isDuplicateViolation("Context_ID__c"));
        assertFalse(other.isDuplicateViolation("Context_ID__c"));
        assertFalse(other.hasId());
    }
}

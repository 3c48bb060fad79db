package ru.aritmos.formbroker.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class SensitiveDataSanitizerTest {

    @Test
    void masksTokensInText() {
        String text = SensitiveDataSanitizer.sanitizeText("Authorization: Bearer 00D.abc\nrefresh_token=xyz&x=1 {\"access_token\":\"tok\"}");

        assertFalse(text.contains("00D.abc"));
        assertFalse(text.contains("xyz"));
        assertFalse(text.contains("\"tok\""));
        assertFalse(text.contains("\n"), "TEST_EXPECTED: переводы строк заменены");
    }

    @Test
    void masksForbiddenKeys() {
        Map<String, String> out = SensitiveDataSanitizer.sanitizeMap(Map.of("Authorization", "Bearer x", "X-Request-Id", "r-1"));

        assertEquals("***", out.get("Authorization"));
        assertEquals("r-1", out.get("X-Request-Id"));
    }

    @Test
    void tokenFingerprintKeepsPrefixOnly() {
        assertEquals("00Dxx0***", SensitiveDataSanitizer.maskToken("00Dxx0000001gEREAY"));
        assertEquals("***", SensitiveDataSanitizer.maskToken("abc"));
        assertEquals("<none>", SensitiveDataSanitizer.maskToken(null));
    }
}

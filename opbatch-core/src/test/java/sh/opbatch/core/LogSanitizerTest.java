// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsJsonSignature() {
        String sanitized = LogSanitizer.sanitize("{\"sender\":\"0x01\",\"signature\" : \"0xdeadbeef\"}");
        assertEquals("{\"sender\":\"0x01\",\"signature\":\"0x***[REDACTED]***\"}", sanitized);
    }

    @Test
    void redactsToStringSignature() {
        String sanitized = LogSanitizer.sanitize("UserOperation[nonce=1, signature=0xdeadbeef]");
        assertEquals("UserOperation[nonce=1, signature=0x***[REDACTED]***]", sanitized);
    }

    @Test
    void truncatesLongPayloads() {
        String sanitized = LogSanitizer.sanitize("a".repeat(5000));
        assertEquals(2000, sanitized.length());
        assertTrue(sanitized.endsWith("...(truncated)"));
    }

    @Test
    void nullBecomesLiteral() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}

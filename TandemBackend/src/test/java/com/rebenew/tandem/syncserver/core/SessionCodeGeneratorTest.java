package com.rebenew.tandem.syncserver.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCodeGeneratorTest {

    @Test
    void shouldGenerateReadableCodes() {
        SessionCodeGenerator generator = new SessionCodeGenerator(6);
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 500; i++) {
            String code = generator.next();
            assertTrue(code.matches("[A-Z0-9]{6}"), code);
            seen.add(code);
        }
        assertTrue(seen.size() > 490);
    }

    @Test
    void shouldNormalizeUserInput() {
        assertEquals("K3Q9ZD", SessionCodeGenerator.normalize("  k3q9zd "));
        assertNull(SessionCodeGenerator.normalize(null));
    }

    @Test
    void shouldRejectShortCodes() {
        assertThrows(IllegalArgumentException.class, () -> new SessionCodeGenerator(3));
    }
}

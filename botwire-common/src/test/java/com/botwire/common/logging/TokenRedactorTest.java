package com.botwire.common.logging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenRedactorTest {

    private static final String TOKEN = "123456789:AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw";

    @Test
    void redact_urlSegment() {
        String out = TokenRedactor.redact("https://api.telegram.org/bot" + TOKEN + "/getUpdates");

        assertFalse(out.contains(TOKEN));
        assertTrue(out.startsWith("https://api.telegram.org/bot1234"));
        assertTrue(out.endsWith("/getUpdates"));
    }

    @Test
    void redact_jsonField() {
        String out = TokenRedactor.redact("{\"secretToken\":\"hunter2-very-secret\"}");

        assertFalse(out.contains("hunter2-very-secret"));
    }

    @Test
    void redact_knownShortToken() {
        String out = TokenRedactor.redact("token=1:abc used", "1:abc");

        assertEquals("token=*** used", out);
    }

    @Test
    void redact_nullAndEmptyPassThrough() {
        assertNull(TokenRedactor.redact(null));
        assertEquals("", TokenRedactor.redact(""));
    }

    @Test
    void mask_keepsEnds() {
        assertEquals("1234…aw", TokenRedactor.mask(TOKEN));
        assertEquals("***", TokenRedactor.mask("short"));
    }
}

package com.botwire.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_fallsBackToClassName() {
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void formatErrorMessage_redactsTokens() {
        String msg = ErrorUtils.formatErrorMessage(
                new IOException("POST https://api.example/bot123456789:AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw/getMe"));

        assertFalse(msg.contains("AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw"));
    }

    @Test
    void formatErrorChain_joinsDistinctCauses() {
        var err = new RuntimeException("poll failed", new IOException("connection reset"));

        assertEquals("poll failed | connection reset", ErrorUtils.formatErrorChain(err));
    }

    @Test
    void isRecoverableNetworkError_detectsNestedTimeout() {
        var err = new RuntimeException("wrapped", new SocketTimeoutException("read"));

        assertTrue(ErrorUtils.isRecoverableNetworkError(err));
        assertFalse(ErrorUtils.isRecoverableNetworkError(new IllegalArgumentException("bad arg")));
    }
}

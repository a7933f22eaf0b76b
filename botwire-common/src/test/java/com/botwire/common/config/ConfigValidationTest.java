package com.botwire.common.config;

import com.botwire.common.errors.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidationTest {

    private BotConfig defaults(String token) {
        ConfigService service = new ConfigService(java.nio.file.Path.of("unused.json"),
                Duration.ofMinutes(1), k -> null);
        return token == null ? service.fromMap(Map.of()) : service.fromMap(Map.of("token", token));
    }

    @Test
    void validConfig_ok() {
        var result = ConfigValidation.validate(defaults("123456:AAbbCC_dd-ee"));

        assertTrue(result.ok());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void missingToken_isError() {
        var result = ConfigValidation.validate(defaults(null));

        assertFalse(result.ok());
        assertEquals("token", result.issues().get(0).path());
    }

    @Test
    void oddLookingToken_isWarningOnly() {
        var result = ConfigValidation.validate(defaults("not-a-token"));

        assertTrue(result.ok());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void outOfRangeValues_reported() {
        BotConfig config = defaults("1:a");
        config.getPolling().setLimit(500);
        config.getDispatch().setMode("threads");
        config.getDispatch().setPoolSize(0);
        config.getWebhook().setPath("hook");

        var result = ConfigValidation.validate(config);

        assertFalse(result.ok());
        List<String> paths = result.issues().stream().map(ConfigValidation.ValidationIssue::path).toList();
        assertTrue(paths.containsAll(List.of("polling.limit", "dispatch.mode", "dispatch.poolSize", "webhook.path")));
    }

    @Test
    void unknownAllowedUpdate_isWarning() {
        BotConfig config = defaults("1:a");
        config.getPolling().setAllowedUpdates(List.of("message", "bogus"));

        var result = ConfigValidation.validate(config);

        assertTrue(result.ok());
        assertTrue(result.warnings().stream().anyMatch(w -> w.path().equals("polling.allowedUpdates")));
    }

    @Test
    void requireValid_throwsOnError() {
        var ex = assertThrows(ConfigurationException.class, () -> ConfigValidation.requireValid(defaults(null)));
        assertTrue(ex.getMessage().contains("token"));
    }
}

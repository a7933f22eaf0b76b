package com.botwire.common.config;

import com.botwire.common.errors.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("bot.json");
    }

    private ConfigService service(Map<String, String> env) {
        return new ConfigService(configPath, Duration.ofMinutes(1), env::get);
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "token": "12345:abc",
                  "parseMode": "HTML",
                  "polling": {
                    "timeoutSeconds": 5,
                    "allowedUpdates": ["message", "callback_query"]
                  },
                  "dispatch": { "mode": "pooled", "poolSize": 8 },
                  "somethingElse": true
                }
                """;
        Files.writeString(configPath, json);

        BotConfig config = service(Map.of()).loadConfig();

        assertEquals("12345:abc", config.getToken());
        assertEquals("HTML", config.getParseMode());
        assertEquals(5, config.getPolling().getTimeoutSeconds());
        assertEquals(100, config.getPolling().getLimit());
        assertEquals(List.of("message", "callback_query"), config.getPolling().getAllowedUpdates());
        assertEquals("pooled", config.getDispatch().getMode());
        assertEquals(8, config.getDispatch().getPoolSize());
        assertNotNull(config.getWebhook());
        assertNotNull(config.getNetwork());
        assertEquals(BotConfig.DEFAULT_API_BASE_URL, config.getApiBaseUrl());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        ConfigService service = new ConfigService(tempDir.resolve("nonexistent.json"),
                Duration.ofMinutes(1), k -> null);
        BotConfig config = service.loadConfig();

        assertNull(config.getToken());
        assertEquals("inline", config.getDispatch().getMode());
        assertEquals(4, config.getDispatch().getPoolSize());
        assertTrue(config.getPolling().isNonStop());
    }

    @Test
    void loadConfig_malformedJson_throwsConfigurationException() throws IOException {
        Files.writeString(configPath, "{ \"token\": ");

        assertThrows(ConfigurationException.class, () -> service(Map.of()).loadConfig());
    }

    @Test
    void loadConfig_substitutesEnvVars() throws IOException {
        Files.writeString(configPath, """
                { "token": "${MY_TOKEN}", "webhook": { "path": "${HOOK_PATH:-/hook}" } }
                """);

        BotConfig config = service(Map.of("MY_TOKEN", "999:xyz")).loadConfig();

        assertEquals("999:xyz", config.getToken());
        assertEquals("/hook", config.getWebhook().getPath());
    }

    @Test
    void loadConfig_missingToken_fallsBackToEnvironment() {
        BotConfig config = service(Map.of(ConfigService.TOKEN_ENV, " 42:from-env ")).loadConfig();

        assertEquals("42:from-env", config.getToken());
    }

    @Test
    void loadConfig_legacyTokenEnv_used() {
        BotConfig config = service(Map.of(ConfigService.LEGACY_TOKEN_ENV, "7:legacy")).loadConfig();

        assertEquals("7:legacy", config.getToken());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service(Map.of()).substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_unsetWithoutDefault_becomesEmpty() {
        assertEquals("a--b", service(Map.of()).substituteEnvVars("a-${NOPE}-b"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"token\": \"1:a\" }");

        ConfigService service = service(Map.of());
        BotConfig first = service.loadConfig();
        BotConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, "{ \"token\": \"1:a\" }");
        ConfigService service = service(Map.of());
        assertEquals("1:a", service.loadConfig().getToken());

        Files.writeString(configPath, "{ \"token\": \"2:b\" }");

        assertEquals("2:b", service.reloadConfig().getToken());
    }

    @Test
    void fromMap_appliesDefaults() {
        BotConfig config = service(Map.of()).fromMap(Map.of("token", "5:map"));

        assertEquals("5:map", config.getToken());
        assertEquals(20, config.getPolling().getTimeoutSeconds());
    }
}

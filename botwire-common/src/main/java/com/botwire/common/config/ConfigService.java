package com.botwire.common.config;

import com.botwire.common.errors.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the bot configuration from a JSON file.
 * Supports {@code ${VAR}} and {@code ${VAR:-default}} environment substitution.
 */
@Slf4j
public class ConfigService {

    public static final String TOKEN_ENV = "BOTWIRE_BOT_TOKEN";
    static final String LEGACY_TOKEN_ENV = "TELEGRAM_BOT_TOKEN";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BotConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     *
     * @throws ConfigurationException if the file exists but is not valid JSON
     */
    public BotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public BotConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private BotConfig doLoadConfig() {
        BotConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new BotConfig();
        } else {
            try {
                String raw = Files.readString(configPath);
                raw = substituteEnvVars(raw);
                config = objectMapper.readValue(raw, BotConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load config from " + configPath + ": "
                        + e.getMessage(), e);
            }
        }
        return applyDefaults(config);
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill missing sections and the token from the environment.
     */
    BotConfig applyDefaults(BotConfig config) {
        if (config.getApiBaseUrl() == null || config.getApiBaseUrl().isBlank()) {
            config.setApiBaseUrl(BotConfig.DEFAULT_API_BASE_URL);
        }
        if (config.getPolling() == null) {
            config.setPolling(new BotConfig.PollingConfig());
        }
        if (config.getDispatch() == null) {
            config.setDispatch(new BotConfig.DispatchConfig());
        }
        if (config.getWebhook() == null) {
            config.setWebhook(new BotConfig.WebhookConfig());
        }
        if (config.getNetwork() == null) {
            config.setNetwork(new BotConfig.NetworkConfig());
        }
        if (config.getToken() == null || config.getToken().isBlank()) {
            String token = firstNonBlank(env.apply(TOKEN_ENV), env.apply(LEGACY_TOKEN_ENV));
            if (token != null) {
                config.setToken(token.trim());
                log.debug("Bot token taken from environment");
            }
        }
        return config;
    }

    /**
     * Build a config from an in-memory map (tests, embedding applications).
     */
    public BotConfig fromMap(Map<String, Object> values) {
        return applyDefaults(objectMapper.convertValue(values, BotConfig.class));
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank())
                return v;
        }
        return null;
    }
}

package com.botwire.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Root configuration for a bot instance.
 * Passed explicitly to the transport, dispatcher and poller constructors.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BotConfig {

    public static final String DEFAULT_API_BASE_URL = "https://api.telegram.org";

    /** Bot token issued by the platform. */
    private String token;

    /** Base URL of the bot API, without the {@code /bot<token>} suffix. */
    private String apiBaseUrl = DEFAULT_API_BASE_URL;

    /** Default parse mode applied to outgoing text ("HTML", "MarkdownV2"), or null. */
    private String parseMode;

    private PollingConfig polling;

    private DispatchConfig dispatch;

    private WebhookConfig webhook;

    private NetworkConfig network;

    // --- Nested config types ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PollingConfig {
        /** Long-poll wait in seconds. */
        private int timeoutSeconds = 20;
        /** Max updates per batch (1..100). */
        private int limit = 100;
        /** Extra delay between two polls. */
        private long intervalMs = 0;
        /** Keep polling after transport errors (retry forever with backoff). */
        private boolean nonStop = true;
        /** Drop pending updates before the first poll. */
        private boolean skipPending = false;
        /** Update kinds to request, by wire name; null keeps the server-side setting. */
        private List<String> allowedUpdates;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30_000;
        /** Directory where the last update offset is persisted; null disables persistence. */
        private String offsetStateDir;
        /** No-update period after which the poller reports itself as stalled. */
        private long stallThresholdMs = 5 * 60_000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DispatchConfig {
        /** "inline" or "pooled". */
        private String mode = "inline";
        private int poolSize = 4;
        private boolean middlewareEnabled = true;
        /** Propagate handler errors to the dispatch caller when no error sink is set. */
        private boolean strict = false;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebhookConfig {
        private String host = "0.0.0.0";
        private int port = 8443;
        private String path = "/telegram-webhook";
        /** Expected value of the secret-token header; null disables the check. */
        private String secretToken;
        /** Public HTTPS URL registered with setWebhook. */
        private String publicUrl;
        private int maxBodyBytes = 1024 * 1024;
        private long dedupeTtlMs = 5 * 60_000;
        private int dedupeMaxSize = 2000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NetworkConfig {
        private long connectTimeoutMs = 15_000;
        private long readTimeoutMs = 30_000;
        /** HTTP proxy, e.g. "http://127.0.0.1:3128"; falls back to HTTPS_PROXY / HTTP_PROXY. */
        private String proxyUrl;
    }
}

package com.botwire.common.config;

import com.botwire.common.errors.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Semantic checks on a loaded {@link BotConfig}.
 */
@Slf4j
public final class ConfigValidation {

    private ConfigValidation() {
    }

    // =========================================================================
    // Types
    // =========================================================================

    public enum Severity {
        ERROR, WARNING
    }

    public record ValidationIssue(
            String path,
            String message,
            Severity severity) {
    }

    public record ValidationResult(
            boolean ok,
            BotConfig config,
            List<ValidationIssue> issues,
            List<ValidationIssue> warnings) {
        public static ValidationResult success(BotConfig config, List<ValidationIssue> warnings) {
            return new ValidationResult(true, config, List.of(), warnings);
        }

        public static ValidationResult failure(List<ValidationIssue> issues, List<ValidationIssue> warnings) {
            return new ValidationResult(false, null, issues, warnings);
        }
    }

    // =========================================================================
    // Constants
    // =========================================================================

    /** Tokens look like {@code 123456:ABC-DEF...}. */
    private static final Pattern TOKEN_RE = Pattern.compile("^\\d+:[A-Za-z0-9_-]+$");

    private static final Set<String> KNOWN_DISPATCH_MODES = Set.of("inline", "pooled");

    private static final Set<String> KNOWN_UPDATE_KINDS = Set.of(
            "message", "edited_message", "channel_post", "edited_channel_post",
            "callback_query", "inline_query", "chosen_inline_result", "shipping_query",
            "pre_checkout_query", "poll", "poll_answer", "my_chat_member", "chat_member",
            "chat_join_request");

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Validate a config object after defaults were applied.
     */
    public static ValidationResult validate(BotConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        validateToken(config, issues, warnings);
        validatePolling(config, issues, warnings);
        validateDispatch(config, issues);
        validateWebhook(config, issues, warnings);

        for (ValidationIssue w : warnings) {
            log.warn("Config warning at {}: {}", w.path(), w.message());
        }
        if (!issues.isEmpty()) {
            return ValidationResult.failure(issues, warnings);
        }
        return ValidationResult.success(config, warnings);
    }

    /**
     * Validate and throw on the first error.
     *
     * @throws ConfigurationException if any error-level issue is found
     */
    public static BotConfig requireValid(BotConfig config) {
        ValidationResult result = validate(config);
        if (!result.ok()) {
            ValidationIssue first = result.issues().get(0);
            throw new ConfigurationException("Invalid config at " + first.path() + ": " + first.message()
                    + (result.issues().size() > 1 ? " (+" + (result.issues().size() - 1) + " more)" : ""));
        }
        return config;
    }

    // =========================================================================
    // Sections
    // =========================================================================

    private static void validateToken(BotConfig config,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        String token = config.getToken();
        if (token == null || token.isBlank()) {
            issues.add(new ValidationIssue("token",
                    "Bot token is missing; set it in the config or " + ConfigService.TOKEN_ENV,
                    Severity.ERROR));
            return;
        }
        if (!TOKEN_RE.matcher(token.trim()).matches()) {
            warnings.add(new ValidationIssue("token",
                    "Token does not look like <id>:<secret>", Severity.WARNING));
        }
    }

    private static void validatePolling(BotConfig config,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        var polling = config.getPolling();
        if (polling == null)
            return;

        if (polling.getLimit() < 1 || polling.getLimit() > 100) {
            issues.add(new ValidationIssue("polling.limit",
                    "limit must be 1-100, got " + polling.getLimit(), Severity.ERROR));
        }
        if (polling.getTimeoutSeconds() < 0) {
            issues.add(new ValidationIssue("polling.timeoutSeconds",
                    "timeoutSeconds must be >= 0, got " + polling.getTimeoutSeconds(), Severity.ERROR));
        }
        if (polling.getInitialBackoffMs() <= 0 || polling.getMaxBackoffMs() < polling.getInitialBackoffMs()) {
            issues.add(new ValidationIssue("polling.maxBackoffMs",
                    "backoff must satisfy 0 < initialBackoffMs <= maxBackoffMs", Severity.ERROR));
        }
        if (polling.getAllowedUpdates() != null) {
            for (String kind : polling.getAllowedUpdates()) {
                if (!KNOWN_UPDATE_KINDS.contains(kind)) {
                    warnings.add(new ValidationIssue("polling.allowedUpdates",
                            "Unknown update kind: \"" + kind + "\"", Severity.WARNING));
                }
            }
        }
    }

    private static void validateDispatch(BotConfig config, List<ValidationIssue> issues) {
        var dispatch = config.getDispatch();
        if (dispatch == null)
            return;

        String mode = dispatch.getMode();
        if (mode == null || !KNOWN_DISPATCH_MODES.contains(mode.toLowerCase())) {
            issues.add(new ValidationIssue("dispatch.mode",
                    "Unknown dispatch mode: \"" + mode + "\"; expected one of: " + KNOWN_DISPATCH_MODES,
                    Severity.ERROR));
        }
        if (dispatch.getPoolSize() < 1) {
            issues.add(new ValidationIssue("dispatch.poolSize",
                    "poolSize must be >= 1, got " + dispatch.getPoolSize(), Severity.ERROR));
        }
    }

    private static void validateWebhook(BotConfig config,
            List<ValidationIssue> issues, List<ValidationIssue> warnings) {
        var webhook = config.getWebhook();
        if (webhook == null)
            return;

        if (webhook.getPort() < 0 || webhook.getPort() > 65535) {
            issues.add(new ValidationIssue("webhook.port",
                    "Port must be 0-65535, got " + webhook.getPort(), Severity.ERROR));
        }
        String path = webhook.getPath();
        if (path == null || !path.startsWith("/")) {
            issues.add(new ValidationIssue("webhook.path",
                    "path must start with '/', got " + path, Severity.ERROR));
        }
        String publicUrl = webhook.getPublicUrl();
        if (publicUrl != null && !publicUrl.toLowerCase().startsWith("https://")) {
            warnings.add(new ValidationIssue("webhook.publicUrl",
                    "The platform only delivers webhooks over HTTPS", Severity.WARNING));
        }
    }
}

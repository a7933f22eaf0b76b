package com.botwire.webhook;

import com.botwire.api.client.BotApi;
import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.errors.TransportException;
import com.botwire.api.types.WebhookInfo;
import com.botwire.common.config.BotConfig;
import com.botwire.common.errors.BotException;
import com.botwire.common.errors.ConfigurationException;
import com.botwire.common.infra.ErrorUtils;
import com.botwire.common.infra.RetryRunner;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Registers and removes the bot's webhook with the platform.
 * <p>
 * Network failures and rate limits are retried with backoff (honouring {@code retry_after});
 * other API errors and unreadable responses fail immediately.
 */
@Slf4j
public class WebhookRegistrar {

    static final String DEFAULT_PATH = "/telegram-webhook";

    private final BotApi api;
    private final RetryRunner retry;

    public WebhookRegistrar(BotApi api) {
        this(api, RetryRunner.Config.DEFAULT);
    }

    public WebhookRegistrar(BotApi api, RetryRunner.Config retryConfig) {
        this.api = Objects.requireNonNull(api, "api");
        this.retry = new RetryRunner(retryConfig, (err, attempt) -> isRetryable(err), WebhookRegistrar::retryAfterMs,
                null);
    }

    /**
     * Network-level failures (timeouts, refused or reset connections, DNS) and rate limits. A
     * response that cannot be read is not retried.
     */
    static boolean isRetryable(Exception err) {
        if (err instanceof TransportException)
            return ErrorUtils.isRecoverableNetworkError(err);
        return err instanceof RemoteApiException remote && remote.isRateLimited();
    }

    static long retryAfterMs(Exception err) {
        if (err instanceof RemoteApiException remote && remote.getRetryAfter() > 0)
            return remote.getRetryAfter() * 1000L;
        return -1;
    }

    /**
     * Point the platform at {@code publicUrl + path} from the given config.
     *
     * @throws ConfigurationException when no public URL is configured
     */
    public boolean register(BotConfig.WebhookConfig config, List<String> allowedUpdates, boolean dropPending) {
        if (config.getPublicUrl() == null || config.getPublicUrl().isBlank()) {
            throw new ConfigurationException("webhook.publicUrl is required to register a webhook");
        }
        return setWebhook(webhookUrl(config.getPublicUrl(), config.getPath()), config.getSecretToken(),
                allowedUpdates, dropPending);
    }

    public boolean setWebhook(String url, String secretToken, List<String> allowedUpdates, boolean dropPending) {
        boolean ok = call(() -> api.setWebhook(url, secretToken, null, allowedUpdates, dropPending), "setWebhook");
        if (ok) {
            log.info("Webhook set: {}", url);
        } else {
            log.error("Failed to set webhook: {}", url);
        }
        return ok;
    }

    public boolean deleteWebhook(boolean dropPending) {
        boolean ok = call(() -> api.deleteWebhook(dropPending), "deleteWebhook");
        if (ok) {
            log.info("Webhook deleted");
        } else {
            log.error("Failed to delete webhook");
        }
        return ok;
    }

    public WebhookInfo getWebhookInfo() {
        return call(api::getWebhookInfo, "getWebhookInfo");
    }

    private <T> T call(Callable<T> fn, String label) {
        try {
            return retry.execute(fn, label);
        } catch (BotException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BotException(label + " interrupted", e);
        } catch (Exception e) {
            throw new BotException(label + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Webhook path under {@code basePath}; {@value #DEFAULT_PATH} when none is given.
     */
    public static String webhookPath(String basePath) {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath.trim())) {
            return DEFAULT_PATH;
        }
        String base = basePath.trim();
        return base.endsWith("/") ? base + DEFAULT_PATH.substring(1) : base + DEFAULT_PATH;
    }

    /**
     * Join a public base URL and a server path without doubling or dropping the slash.
     */
    public static String webhookUrl(String publicUrl, String path) {
        String base = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        if (path == null || path.isEmpty())
            return base;
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}

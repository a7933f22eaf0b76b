package com.botwire.api.transport;

import com.botwire.api.binding.BotJson;
import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.errors.TransportException;
import com.botwire.common.config.BotConfig;
import com.botwire.common.logging.TokenRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.Proxy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link BotTransport} over OkHttp. Every call is a POST to {@code {apiBaseUrl}/bot{token}/{method}}.
 */
@Slf4j
public class OkHttpBotTransport implements BotTransport {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    /** Added on top of the long-poll wait before the client gives up on a getUpdates call. */
    private static final Duration POLL_READ_MARGIN = Duration.ofSeconds(10);

    private final String token;
    private final String apiBaseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicReference<Call> inFlightFetch = new AtomicReference<>();

    public OkHttpBotTransport(BotConfig config) {
        this(config.getToken(), config.getApiBaseUrl(), buildClient(config.getNetwork()));
    }

    public OkHttpBotTransport(String token, String apiBaseUrl, OkHttpClient httpClient) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("bot token is required");
        }
        this.token = token.trim();
        String base = apiBaseUrl != null && !apiBaseUrl.isBlank() ? apiBaseUrl.trim() : BotConfig.DEFAULT_API_BASE_URL;
        this.apiBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = BotJson.mapper();
    }

    /**
     * Client with the configured timeouts and proxy.
     */
    public static OkHttpClient buildClient(BotConfig.NetworkConfig network) {
        BotConfig.NetworkConfig net = network != null ? network : new BotConfig.NetworkConfig();
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(net.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(net.getReadTimeoutMs()))
                .writeTimeout(Duration.ofMillis(net.getReadTimeoutMs()))
                .retryOnConnectionFailure(true);
        Proxy proxy = ProxySupport.toProxy(ProxySupport.resolveProxyUrl(net.getProxyUrl(), System::getenv));
        if (proxy != null) {
            builder.proxy(proxy);
            log.info("Bot API calls go through proxy {}", proxy.address());
        }
        return builder.build();
    }

    // =========================================================================
    // BotTransport
    // =========================================================================

    @Override
    public List<JsonNode> fetchUpdates(long offset, int timeoutSeconds, int limit, List<String> allowedUpdates) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (offset != 0) {
            params.put("offset", offset);
        }
        params.put("timeout", Math.max(0, timeoutSeconds));
        params.put("limit", Math.max(1, Math.min(100, limit)));
        if (allowedUpdates != null) {
            params.put("allowed_updates", allowedUpdates);
        }

        OkHttpClient pollClient = httpClient.newBuilder()
                .readTimeout(Duration.ofSeconds(Math.max(0, timeoutSeconds)).plus(POLL_READ_MARGIN))
                .build();
        Call call = pollClient.newCall(jsonRequest("getUpdates", params));
        inFlightFetch.set(call);
        JsonNode result;
        try {
            result = execute("getUpdates", call);
        } finally {
            inFlightFetch.compareAndSet(call, null);
        }

        if (result == null || !result.isArray()) {
            throw new TransportException("getUpdates returned a non-array result");
        }
        List<JsonNode> records = new ArrayList<>(result.size());
        result.forEach(records::add);
        return records;
    }

    @Override
    public JsonNode send(String method, Map<String, Object> params) {
        return execute(method, httpClient.newCall(jsonRequest(method, params)));
    }

    @Override
    public JsonNode sendMultipart(String method, Map<String, Object> params, InputFile file) {
        MultipartBody.Builder form = new MultipartBody.Builder().setType(MultipartBody.FORM);
        if (params != null) {
            for (Map.Entry<String, Object> e : params.entrySet()) {
                if (e.getValue() != null) {
                    form.addFormDataPart(e.getKey(), formValue(e.getValue()));
                }
            }
        }
        MediaType type = file.mimeType() != null ? MediaType.parse(file.mimeType()) : OCTET_STREAM;
        form.addFormDataPart(file.fieldName(), file.fileName(), RequestBody.create(file.content(), type));

        Request request = new Request.Builder()
                .url(methodUrl(method))
                .post(form.build())
                .build();
        return execute(method, httpClient.newCall(request));
    }

    @Override
    public byte[] download(String filePath) {
        String path = filePath.startsWith("/") ? filePath.substring(1) : filePath;
        Request request = new Request.Builder()
                .url(apiBaseUrl + "/file/bot" + token + "/" + path)
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new TransportException("download of " + path + " failed with HTTP " + response.code());
            }
            return body.bytes();
        } catch (IOException e) {
            throw new TransportException("download of " + path + " failed: "
                    + TokenRedactor.redact(e.getMessage(), token), e);
        }
    }

    @Override
    public void abortFetch() {
        Call call = inFlightFetch.getAndSet(null);
        if (call != null) {
            call.cancel();
        }
    }

    @Override
    public void close() {
        abortFetch();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private Request jsonRequest(String method, Map<String, Object> params) {
        String body;
        try {
            body = objectMapper.writeValueAsString(params != null ? params : Map.of());
        } catch (JsonProcessingException e) {
            throw new TransportException("cannot serialize parameters of " + method + ": " + e.getOriginalMessage(), e);
        }
        return new Request.Builder()
                .url(methodUrl(method))
                .post(RequestBody.create(body, JSON))
                .build();
    }

    private JsonNode execute(String method, Call call) {
        log.debug("-> {}", method);
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            return interpret(method, response.code(), raw);
        } catch (IOException e) {
            String reason = call.isCanceled() ? "canceled" : TokenRedactor.redact(e.getMessage(), token);
            throw new TransportException(method + " failed: " + reason, e);
        }
    }

    JsonNode interpret(String method, int httpCode, String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw invalidBody(method, httpCode, raw, e);
        }
        if (node == null || !node.isObject()) {
            throw invalidBody(method, httpCode, raw, null);
        }
        if (node.path("ok").asBoolean(false)) {
            log.debug("<- {} ok", method);
            return node.get("result");
        }
        int code = node.path("error_code").asInt(httpCode);
        String description = node.path("description").asText("HTTP " + httpCode);
        int retryAfter = node.path("parameters").path("retry_after").asInt(0);
        log.debug("<- {} error {}: {}", method, code, description);
        throw new RemoteApiException(method, code, description, retryAfter);
    }

    private TransportException invalidBody(String method, int httpCode, String raw, Throwable cause) {
        String snippet = raw.length() > 200 ? raw.substring(0, 200) + "…" : raw;
        return new TransportException("The server returned HTTP " + httpCode + " with an invalid JSON body for "
                + method + ": " + TokenRedactor.redact(snippet, token), cause);
    }

    private String methodUrl(String method) {
        return apiBaseUrl + "/bot" + token + "/" + method;
    }

    private String formValue(Object value) {
        if (value instanceof String s)
            return s;
        if (value instanceof Number || value instanceof Boolean)
            return value.toString();
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TransportException("cannot serialize form value: " + e.getOriginalMessage(), e);
        }
    }


    @Override
    public String toString() {
        return "OkHttpBotTransport{" + apiBaseUrl + ", token=" + TokenRedactor.mask(token) + "}";
    }
}

package com.botwire.api.transport;

import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.errors.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpBotTransportTest {

    private static final String TOKEN = "123456789:AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsaw";

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private OkHttpBotTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(5))
                .build();
        transport = new OkHttpBotTransport(TOKEN, server.url("/").toString(), client);
    }

    @AfterEach
    void tearDown() throws Exception {
        transport.close();
        server.shutdown();
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    void send_postsJsonToMethodUrl_returnsResult() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"id\":1,\"is_bot\":true,\"first_name\":\"B\"}}"));

        JsonNode result = transport.send("getMe", Map.of("x", 1));

        assertEquals(1, result.get("id").asInt());
        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", req.getMethod());
        assertEquals("/bot" + TOKEN + "/getMe", req.getPath());
        assertEquals(1, mapper.readTree(req.getBody().readUtf8()).get("x").asInt());
    }

    @Test
    void send_okFalse_throwsRemoteApiException() {
        server.enqueue(json(400, "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}"));

        var ex = assertThrows(RemoteApiException.class, () -> transport.send("sendMessage", Map.of()));
        assertEquals(400, ex.getErrorCode());
        assertEquals("Bad Request: chat not found", ex.getDescription());
        assertEquals("sendMessage", ex.getMethod());
        assertEquals(0, ex.getRetryAfter());
    }

    @Test
    void send_rateLimited_carriesRetryAfter() {
        server.enqueue(json(429, "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests\","
                + "\"parameters\":{\"retry_after\":7}}"));

        var ex = assertThrows(RemoteApiException.class, () -> transport.send("sendMessage", Map.of()));
        assertEquals(7, ex.getRetryAfter());
        assertTrue(ex.isRateLimited());
    }

    @Test
    void send_invalidJson_throwsTransportException_withoutToken() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("<html>bad gateway " + TOKEN + "</html>"));

        var ex = assertThrows(TransportException.class, () -> transport.send("getMe", Map.of()));
        assertTrue(ex.getMessage().contains("502"));
        assertFalse(ex.getMessage().contains(TOKEN));
    }

    @Test
    void send_connectionFailure_throwsTransportException_withoutToken() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String deadUrl = closed.url("/").toString();
        closed.shutdown();
        var deadTransport = new OkHttpBotTransport(TOKEN, deadUrl, new OkHttpClient());

        var ex = assertThrows(TransportException.class, () -> deadTransport.send("getMe", Map.of()));
        assertFalse(ex.getMessage().contains(TOKEN));
        deadTransport.close();
    }

    @Test
    void fetchUpdates_sendsPollParameters_returnsRecords() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":[{\"update_id\":5},{\"update_id\":6}]}"));

        List<JsonNode> records = transport.fetchUpdates(5, 0, 100, List.of("message"));

        assertEquals(2, records.size());
        assertEquals(6, records.get(1).get("update_id").asLong());
        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals(5, body.get("offset").asLong());
        assertEquals(0, body.get("timeout").asInt());
        assertEquals(100, body.get("limit").asInt());
        assertEquals("message", body.get("allowed_updates").get(0).asText());
    }

    @Test
    void fetchUpdates_zeroOffset_omitted() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":[]}"));

        assertTrue(transport.fetchUpdates(0, 0, 10, null).isEmpty());
        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertFalse(body.has("offset"));
        assertFalse(body.has("allowed_updates"));
    }

    @Test
    void sendMultipart_uploadsFileAndFields() throws Exception {
        server.enqueue(json(200, "{\"ok\":true,\"result\":{\"message_id\":3}}"));

        transport.sendMultipart("sendDocument", Map.of("chat_id", 42L),
                new InputFile("document", "notes.txt", "hello".getBytes(), "text/plain"));

        RecordedRequest req = server.takeRequest();
        String contentType = req.getHeader("Content-Type");
        assertTrue(contentType.startsWith("multipart/form-data"));
        String body = req.getBody().readUtf8();
        assertTrue(body.contains("name=\"chat_id\""));
        assertTrue(body.contains("filename=\"notes.txt\""));
        assertTrue(body.contains("hello"));
    }

    @Test
    void download_readsFileEndpoint() throws Exception {
        server.enqueue(new MockResponse().setBody("bytes"));

        byte[] data = transport.download("documents/file_1.txt");

        assertEquals("bytes", new String(data));
        assertEquals("/file/bot" + TOKEN + "/documents/file_1.txt", server.takeRequest().getPath());
    }

    @Test
    void toString_masksToken() {
        assertFalse(transport.toString().contains(TOKEN));
    }

    @Test
    void proxySupport_resolvesConfiguredThenEnvironment() {
        assertEquals("http://cfg:1", ProxySupport.resolveProxyUrl("http://cfg:1", k -> "http://env:2"));
        assertEquals("http://env:2", ProxySupport.resolveProxyUrl(null,
                k -> k.equals("HTTP_PROXY") ? "http://env:2" : null));
        assertNull(ProxySupport.resolveProxyUrl(" ", k -> null));
        assertNotNull(ProxySupport.toProxy("http://127.0.0.1:3128"));
        assertNull(ProxySupport.toProxy("not a url"));
    }
}

package com.botwire.api.client;

import com.botwire.api.binding.BotJson;
import com.botwire.api.binding.JacksonUpdateParser;
import com.botwire.api.binding.UpdateParser;
import com.botwire.api.errors.MalformedUpdateException;
import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.errors.TransportException;
import com.botwire.api.transport.BotTransport;
import com.botwire.api.transport.InputFile;
import com.botwire.api.transport.OkHttpBotTransport;
import com.botwire.api.types.BotCommand;
import com.botwire.api.types.Chat;
import com.botwire.api.types.ChatMember;
import com.botwire.api.types.FileInfo;
import com.botwire.api.types.Message;
import com.botwire.api.types.Update;
import com.botwire.api.types.User;
import com.botwire.api.types.WebhookInfo;
import com.botwire.common.config.BotConfig;
import com.botwire.common.text.TextSplitter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed request methods of the bot API. Each method maps onto one remote method of the same name.
 * <p>
 * {@code chatId} parameters accept a numeric id ({@link Long}) or a {@code @channelusername} string.
 * All methods throw {@link TransportException} or {@link RemoteApiException} on failure.
 */
@Slf4j
public class BotApi implements AutoCloseable {

    private final BotTransport transport;
    private final UpdateParser updateParser;
    private final ObjectMapper objectMapper = BotJson.mapper();
    private final String defaultParseMode;

    public BotApi(BotTransport transport) {
        this(transport, null, new JacksonUpdateParser());
    }

    public BotApi(BotTransport transport, String defaultParseMode, UpdateParser updateParser) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.defaultParseMode = defaultParseMode;
        this.updateParser = updateParser != null ? updateParser : new JacksonUpdateParser();
    }

    /**
     * Client over an {@link OkHttpBotTransport} built from {@code config}.
     */
    public static BotApi create(BotConfig config) {
        return new BotApi(new OkHttpBotTransport(config), config.getParseMode(), new JacksonUpdateParser());
    }

    public BotTransport getTransport() {
        return transport;
    }

    public UpdateParser getUpdateParser() {
        return updateParser;
    }

    // =========================================================================
    // Bot and updates
    // =========================================================================

    public User getMe() {
        return call("getMe", Map.of(), User.class);
    }

    /**
     * One-shot fetch of pending updates. Malformed records are logged and dropped.
     */
    public List<Update> getUpdates(long offset, int limit, int timeoutSeconds, List<String> allowedUpdates) {
        List<JsonNode> records = transport.fetchUpdates(offset, timeoutSeconds, limit, allowedUpdates);
        List<Update> updates = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            try {
                updates.add(updateParser.parse(record));
            } catch (MalformedUpdateException e) {
                log.warn("Dropping malformed update: {}", e.getMessage());
            }
        }
        return updates;
    }

    public boolean logOut() {
        return callBoolean("logOut", Map.of());
    }

    /** Remote {@code close}: releases the bot instance on the server before moving it. */
    public boolean closeRemote() {
        return callBoolean("close", Map.of());
    }

    public boolean setMyCommands(List<BotCommand> commands) {
        return callBoolean("setMyCommands", Map.of("commands", commands));
    }

    public List<BotCommand> getMyCommands() {
        return callList("getMyCommands", Map.of(), new TypeReference<List<BotCommand>>() {
        });
    }

    // =========================================================================
    // Sending
    // =========================================================================

    public Message sendMessage(Object chatId, String text) {
        return sendMessage(chatId, text, null);
    }

    public Message sendMessage(Object chatId, String text, SendOptions options) {
        Map<String, Object> params = params(chatId);
        params.put("text", text);
        applyOptions(params, options, true);
        return call("sendMessage", params, Message.class);
    }

    /**
     * Send {@code text} in as many messages as needed, split with {@link TextSplitter#smartSplit(String)}.
     * Options apply to every part; a reply target applies to the first only.
     */
    public List<Message> sendLongMessage(Object chatId, String text, SendOptions options) {
        List<Message> sent = new ArrayList<>();
        SendOptions current = options;
        for (String part : TextSplitter.smartSplit(text)) {
            sent.add(sendMessage(chatId, part, current));
            if (current != null && current.getReplyToMessageId() != null) {
                current = copyWithoutReply(current);
            }
        }
        return sent;
    }

    /**
     * Reply to {@code message} in its chat.
     */
    public Message replyTo(Message message, String text, SendOptions options) {
        SendOptions base = options != null ? copyWithoutReply(options) : new SendOptions();
        base.setReplyToMessageId(message.getMessageId());
        if (base.getMessageThreadId() == null) {
            base.setMessageThreadId(message.getMessageThreadId());
        }
        return sendMessage(message.getChat().getId(), text, base);
    }

    public Message replyTo(Message message, String text) {
        return replyTo(message, text, null);
    }

    public Message forwardMessage(Object chatId, Object fromChatId, long messageId, boolean disableNotification) {
        Map<String, Object> params = params(chatId);
        params.put("from_chat_id", fromChatId);
        params.put("message_id", messageId);
        if (disableNotification) {
            params.put("disable_notification", true);
        }
        return call("forwardMessage", params, Message.class);
    }

    /**
     * @return id of the copy
     */
    public long copyMessage(Object chatId, Object fromChatId, long messageId, SendOptions options) {
        Map<String, Object> params = params(chatId);
        params.put("from_chat_id", fromChatId);
        params.put("message_id", messageId);
        applyOptions(params, options, options != null && options.getCaption() != null);
        return send("copyMessage", params).path("message_id").asLong();
    }

    /**
     * @param photo file id or HTTP URL of a photo
     */
    public Message sendPhoto(Object chatId, String photo, SendOptions options) {
        Map<String, Object> params = params(chatId);
        params.put("photo", photo);
        applyOptions(params, options, hasCaption(options));
        return call("sendPhoto", params, Message.class);
    }

    public Message sendPhoto(Object chatId, InputFile photo, SendOptions options) {
        Map<String, Object> params = params(chatId);
        applyOptions(params, options, hasCaption(options));
        return upload("sendPhoto", params, photo, "photo");
    }

    /**
     * @param document file id or HTTP URL
     */
    public Message sendDocument(Object chatId, String document, SendOptions options) {
        Map<String, Object> params = params(chatId);
        params.put("document", document);
        applyOptions(params, options, hasCaption(options));
        return call("sendDocument", params, Message.class);
    }

    public Message sendDocument(Object chatId, InputFile document, SendOptions options) {
        Map<String, Object> params = params(chatId);
        applyOptions(params, options, hasCaption(options));
        return upload("sendDocument", params, document, "document");
    }

    public Message sendLocation(Object chatId, double latitude, double longitude, SendOptions options) {
        Map<String, Object> params = params(chatId);
        params.put("latitude", latitude);
        params.put("longitude", longitude);
        applyOptions(params, options, false);
        return call("sendLocation", params, Message.class);
    }

    /**
     * @param action typing, upload_photo, record_video, upload_document, find_location, ...
     */
    public boolean sendChatAction(Object chatId, String action) {
        Map<String, Object> params = params(chatId);
        params.put("action", action);
        return callBoolean("sendChatAction", params);
    }

    // =========================================================================
    // Editing
    // =========================================================================

    /**
     * Edit the text of a message sent by the bot.
     */
    public Message editMessageText(Object chatId, long messageId, String text, SendOptions options) {
        Map<String, Object> params = params(chatId);
        params.put("message_id", messageId);
        params.put("text", text);
        applyOptions(params, options, true);
        JsonNode result = send("editMessageText", params);
        return result != null && result.isObject() ? convert(result, Message.class) : null;
    }

    /**
     * Edit the text of an inline-mode message; the server answers with {@code true}.
     */
    public boolean editMessageText(String inlineMessageId, String text, SendOptions options) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("inline_message_id", inlineMessageId);
        params.put("text", text);
        applyOptions(params, options, true);
        return send("editMessageText", params).asBoolean(false);
    }

    public boolean deleteMessage(Object chatId, long messageId) {
        Map<String, Object> params = params(chatId);
        params.put("message_id", messageId);
        return callBoolean("deleteMessage", params);
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public boolean answerCallbackQuery(String callbackQueryId, String text, boolean showAlert) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("callback_query_id", callbackQueryId);
        if (text != null) {
            params.put("text", text);
        }
        if (showAlert) {
            params.put("show_alert", true);
        }
        return callBoolean("answerCallbackQuery", params);
    }

    /**
     * @param results inline query results, serialized as given (maps or Jackson-serializable objects)
     */
    public boolean answerInlineQuery(String inlineQueryId, List<?> results, Integer cacheTime,
            Boolean isPersonal, String nextOffset) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("inline_query_id", inlineQueryId);
        params.put("results", results);
        if (cacheTime != null) {
            params.put("cache_time", cacheTime);
        }
        if (isPersonal != null) {
            params.put("is_personal", isPersonal);
        }
        if (nextOffset != null) {
            params.put("next_offset", nextOffset);
        }
        return callBoolean("answerInlineQuery", params);
    }

    // =========================================================================
    // Chats
    // =========================================================================

    public Chat getChat(Object chatId) {
        return call("getChat", params(chatId), Chat.class);
    }

    public ChatMember getChatMember(Object chatId, long userId) {
        Map<String, Object> params = params(chatId);
        params.put("user_id", userId);
        return call("getChatMember", params, ChatMember.class);
    }

    public int getChatMemberCount(Object chatId) {
        return send("getChatMemberCount", params(chatId)).asInt();
    }

    public boolean leaveChat(Object chatId) {
        return callBoolean("leaveChat", params(chatId));
    }

    /**
     * @param untilDate unix time when the ban ends; null or 0 bans forever
     */
    public boolean banChatMember(Object chatId, long userId, Long untilDate, boolean revokeMessages) {
        Map<String, Object> params = params(chatId);
        params.put("user_id", userId);
        if (untilDate != null && untilDate > 0) {
            params.put("until_date", untilDate);
        }
        if (revokeMessages) {
            params.put("revoke_messages", true);
        }
        return callBoolean("banChatMember", params);
    }

    public boolean approveChatJoinRequest(Object chatId, long userId) {
        Map<String, Object> params = params(chatId);
        params.put("user_id", userId);
        return callBoolean("approveChatJoinRequest", params);
    }

    public boolean declineChatJoinRequest(Object chatId, long userId) {
        Map<String, Object> params = params(chatId);
        params.put("user_id", userId);
        return callBoolean("declineChatJoinRequest", params);
    }

    // =========================================================================
    // Files
    // =========================================================================

    public FileInfo getFile(String fileId) {
        return call("getFile", Map.of("file_id", fileId), FileInfo.class);
    }

    /**
     * Download the content of a file resolved with {@link #getFile(String)}.
     */
    public byte[] downloadFile(String filePath) {
        return transport.download(filePath);
    }

    // =========================================================================
    // Webhook
    // =========================================================================

    /**
     * @param secretToken    sent back in the {@code X-Telegram-Bot-Api-Secret-Token} header; may be null
     * @param allowedUpdates update kinds by wire name; null keeps the previous setting
     */
    public boolean setWebhook(String url, String secretToken, Integer maxConnections,
            List<String> allowedUpdates, boolean dropPendingUpdates) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("url", url);
        if (secretToken != null) {
            params.put("secret_token", secretToken);
        }
        if (maxConnections != null) {
            params.put("max_connections", maxConnections);
        }
        if (allowedUpdates != null) {
            params.put("allowed_updates", allowedUpdates);
        }
        if (dropPendingUpdates) {
            params.put("drop_pending_updates", true);
        }
        return callBoolean("setWebhook", params);
    }

    public boolean deleteWebhook(boolean dropPendingUpdates) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (dropPendingUpdates) {
            params.put("drop_pending_updates", true);
        }
        return callBoolean("deleteWebhook", params);
    }

    public WebhookInfo getWebhookInfo() {
        return call("getWebhookInfo", Map.of(), WebhookInfo.class);
    }

    @Override
    public void close() {
        transport.close();
    }

    // =========================================================================
    // Generic invocation
    // =========================================================================

    /**
     * Invoke any method and return the raw {@code result}; for methods without a typed wrapper.
     */
    public JsonNode send(String method, Map<String, Object> params) {
        return transport.send(method, params);
    }

    /**
     * Invoke any method and bind its result to {@code type}.
     */
    public <T> T call(String method, Map<String, Object> params, Class<T> type) {
        return convert(send(method, params), type);
    }

    private <T> List<T> callList(String method, Map<String, Object> params, TypeReference<List<T>> type) {
        JsonNode result = send(method, params);
        return objectMapper.convertValue(result, type);
    }

    private boolean callBoolean(String method, Map<String, Object> params) {
        JsonNode result = send(method, params);
        return result != null && result.asBoolean(false);
    }

    private Message upload(String method, Map<String, Object> params, InputFile file, String field) {
        InputFile part = field.equals(file.fieldName()) ? file
                : new InputFile(field, file.fileName(), file.content(), file.mimeType());
        return convert(transport.sendMultipart(method, params, part), Message.class);
    }

    private <T> T convert(JsonNode result, Class<T> type) {
        if (result == null || result.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(result, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransportException("cannot bind result to " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private void applyOptions(Map<String, Object> params, SendOptions options, boolean textBearing) {
        SendOptions effective = options != null ? options : new SendOptions();
        effective.applyTo(params, defaultParseMode, textBearing);
    }

    private static boolean hasCaption(SendOptions options) {
        return options != null && options.getCaption() != null;
    }

    private static Map<String, Object> params(Object chatId) {
        if (!(chatId instanceof Number) && !(chatId instanceof String)) {
            throw new IllegalArgumentException("chatId must be a number or an @username string, got " + chatId);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("chat_id", chatId);
        return params;
    }

    private static SendOptions copyWithoutReply(SendOptions o) {
        return new SendOptions(o.getParseMode(), o.getDisableNotification(), o.getProtectContent(),
                o.getDisableWebPagePreview(), null, o.getAllowSendingWithoutReply(), o.getMessageThreadId(),
                o.getReplyMarkup(), o.getCaption());
    }
}

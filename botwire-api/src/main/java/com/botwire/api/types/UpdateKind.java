package com.botwire.api.types;

import java.util.HashMap;
import java.util.Map;

/**
 * The fourteen kinds of update the platform delivers. Each update carries exactly one payload
 * field, named by {@link #wireName()}.
 */
public enum UpdateKind {

    MESSAGE("message", Message.class),
    EDITED_MESSAGE("edited_message", Message.class),
    CHANNEL_POST("channel_post", Message.class),
    EDITED_CHANNEL_POST("edited_channel_post", Message.class),
    CALLBACK_QUERY("callback_query", CallbackQuery.class),
    INLINE_QUERY("inline_query", InlineQuery.class),
    CHOSEN_INLINE_RESULT("chosen_inline_result", ChosenInlineResult.class),
    SHIPPING_QUERY("shipping_query", ShippingQuery.class),
    PRE_CHECKOUT_QUERY("pre_checkout_query", PreCheckoutQuery.class),
    POLL("poll", Poll.class),
    POLL_ANSWER("poll_answer", PollAnswer.class),
    MY_CHAT_MEMBER("my_chat_member", ChatMemberUpdated.class),
    CHAT_MEMBER("chat_member", ChatMemberUpdated.class),
    CHAT_JOIN_REQUEST("chat_join_request", ChatJoinRequest.class);

    private static final Map<String, UpdateKind> BY_WIRE_NAME = new HashMap<>();

    static {
        for (UpdateKind kind : values()) {
            BY_WIRE_NAME.put(kind.wireName, kind);
        }
    }

    private final String wireName;
    private final Class<?> payloadType;

    UpdateKind(String wireName, Class<?> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    /** JSON field name of the payload, also the value used in {@code allowed_updates}. */
    public String wireName() {
        return wireName;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    /** Message, edited message, channel post, edited channel post. */
    public boolean isMessageKind() {
        return payloadType == Message.class;
    }

    /** Whether an update of this kind can be attributed to a chat. */
    public boolean hasChat() {
        return isMessageKind()
                || this == CALLBACK_QUERY
                || this == MY_CHAT_MEMBER
                || this == CHAT_MEMBER
                || this == CHAT_JOIN_REQUEST;
    }

    /**
     * @return the kind for a payload field name, or null if unknown
     */
    public static UpdateKind fromWireName(String name) {
        return name == null ? null : BY_WIRE_NAME.get(name);
    }
}

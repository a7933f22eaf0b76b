package com.botwire.api.types;

import java.util.Objects;

/**
 * One inbound update: an id plus exactly one payload, tagged by {@link UpdateKind}.
 * Instances are immutable; the payload object is shared, not copied.
 */
public final class Update {

    private final long updateId;
    private final UpdateKind kind;
    private final Object payload;

    private Update(long updateId, UpdateKind kind, Object payload) {
        this.updateId = updateId;
        this.kind = kind;
        this.payload = payload;
    }

    /**
     * @throws IllegalArgumentException if the payload type does not match the kind
     */
    public static Update of(long updateId, UpdateKind kind, Object payload) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        if (!kind.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("payload of " + kind.wireName() + " must be "
                    + kind.payloadType().getSimpleName() + ", got " + payload.getClass().getSimpleName());
        }
        return new Update(updateId, kind, payload);
    }

    public static Update message(long updateId, Message message) {
        return of(updateId, UpdateKind.MESSAGE, message);
    }

    public long getUpdateId() {
        return updateId;
    }

    public UpdateKind getKind() {
        return kind;
    }

    public Object getPayload() {
        return payload;
    }

    /**
     * Payload cast to {@code type}, or null when the payload is of another type.
     */
    public <T> T getPayload(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }

    /** The message for the four message kinds, else null. */
    public Message getMessage() {
        return kind.isMessageKind() ? (Message) payload : null;
    }

    public CallbackQuery getCallbackQuery() {
        return getPayload(CallbackQuery.class);
    }

    public InlineQuery getInlineQuery() {
        return getPayload(InlineQuery.class);
    }

    /**
     * The chat the update originates from: the message's chat, the chat of a callback's message,
     * or the chat of a member change or join request. Null for kinds without a chat.
     */
    public Chat getChat() {
        return switch (kind) {
            case MESSAGE, EDITED_MESSAGE, CHANNEL_POST, EDITED_CHANNEL_POST -> ((Message) payload).getChat();
            case CALLBACK_QUERY -> {
                Message m = ((CallbackQuery) payload).getMessage();
                yield m != null ? m.getChat() : null;
            }
            case MY_CHAT_MEMBER, CHAT_MEMBER -> ((ChatMemberUpdated) payload).getChat();
            case CHAT_JOIN_REQUEST -> ((ChatJoinRequest) payload).getChat();
            default -> null;
        };
    }

    /**
     * The user who caused the update, or null (channel posts, poll state updates).
     */
    public User getFrom() {
        return switch (kind) {
            case MESSAGE, EDITED_MESSAGE, CHANNEL_POST, EDITED_CHANNEL_POST -> ((Message) payload).getFrom();
            case CALLBACK_QUERY -> ((CallbackQuery) payload).getFrom();
            case INLINE_QUERY -> ((InlineQuery) payload).getFrom();
            case CHOSEN_INLINE_RESULT -> ((ChosenInlineResult) payload).getFrom();
            case SHIPPING_QUERY -> ((ShippingQuery) payload).getFrom();
            case PRE_CHECKOUT_QUERY -> ((PreCheckoutQuery) payload).getFrom();
            case POLL_ANSWER -> ((PollAnswer) payload).getUser();
            case MY_CHAT_MEMBER, CHAT_MEMBER -> ((ChatMemberUpdated) payload).getFrom();
            case CHAT_JOIN_REQUEST -> ((ChatJoinRequest) payload).getFrom();
            default -> null;
        };
    }

    @Override
    public String toString() {
        return "Update{id=" + updateId + ", kind=" + kind.wireName() + "}";
    }
}

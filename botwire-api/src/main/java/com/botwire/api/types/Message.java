package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A message, channel post, or an edited version of either.
 * Only the fields the dispatch layer and common handlers read are bound; the rest are ignored.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    @JsonProperty("message_id")
    private long messageId;

    @JsonProperty("message_thread_id")
    private Integer messageThreadId;

    private User from;

    @JsonProperty("sender_chat")
    private Chat senderChat;

    /** Unix time in seconds. */
    private long date;

    @JsonProperty("edit_date")
    private Long editDate;

    private Chat chat;

    private String text;

    private List<MessageEntity> entities;

    private String caption;

    @JsonProperty("caption_entities")
    private List<MessageEntity> captionEntities;

    @JsonProperty("media_group_id")
    private String mediaGroupId;

    // ---- forwarding / replies ----

    @JsonProperty("forward_from")
    private User forwardFrom;

    @JsonProperty("forward_from_chat")
    private Chat forwardFromChat;

    @JsonProperty("forward_date")
    private Long forwardDate;

    @JsonProperty("forward_origin")
    private JsonNode forwardOrigin;

    @JsonProperty("reply_to_message")
    private Message replyToMessage;

    // ---- content ----

    /** Available sizes, smallest first. */
    private List<MediaFile> photo;
    private MediaFile audio;
    private MediaFile document;
    private MediaFile video;
    private MediaFile voice;
    private MediaFile sticker;
    private Location location;
    private Contact contact;
    private Poll poll;

    // ---- service messages ----

    @JsonProperty("new_chat_members")
    private List<User> newChatMembers;

    @JsonProperty("left_chat_member")
    private User leftChatMember;

    @JsonProperty("new_chat_title")
    private String newChatTitle;

    @JsonIgnore
    public ContentType getContentType() {
        return ContentType.of(this);
    }

    /** Whether this message was forwarded from another chat or user. */
    @JsonIgnore
    public boolean isForwarded() {
        return forwardOrigin != null || forwardDate != null || forwardFrom != null || forwardFromChat != null;
    }

    /** Text if present, else the caption, else null. */
    @JsonIgnore
    public String textOrCaption() {
        return text != null ? text : caption;
    }
}

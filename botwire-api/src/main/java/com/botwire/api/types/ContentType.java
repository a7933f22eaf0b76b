package com.botwire.api.types;

/**
 * Content type of a message, derived from which payload field is present.
 * When several are present the first in declaration order wins.
 */
public enum ContentType {
    TEXT("text"),
    PHOTO("photo"),
    AUDIO("audio"),
    DOCUMENT("document"),
    VIDEO("video"),
    VOICE("voice"),
    STICKER("sticker"),
    LOCATION("location"),
    CONTACT("contact"),
    POLL("poll"),
    NEW_CHAT_MEMBERS("new_chat_members"),
    LEFT_CHAT_MEMBER("left_chat_member"),
    NEW_CHAT_TITLE("new_chat_title"),
    UNKNOWN("unknown");

    private final String tag;

    ContentType(String tag) {
        this.tag = tag;
    }

    /** Lower-case tag used in filter arguments, e.g. {@code "photo"}. */
    public String tag() {
        return tag;
    }

    /**
     * @return the matching content type, or null for an unknown tag
     */
    public static ContentType fromTag(String tag) {
        if (tag == null)
            return null;
        for (ContentType t : values()) {
            if (t.tag.equalsIgnoreCase(tag.trim()))
                return t;
        }
        return null;
    }

    static ContentType of(Message m) {
        if (m.getText() != null)
            return TEXT;
        if (m.getPhoto() != null && !m.getPhoto().isEmpty())
            return PHOTO;
        if (m.getAudio() != null)
            return AUDIO;
        if (m.getDocument() != null)
            return DOCUMENT;
        if (m.getVideo() != null)
            return VIDEO;
        if (m.getVoice() != null)
            return VOICE;
        if (m.getSticker() != null)
            return STICKER;
        if (m.getLocation() != null)
            return LOCATION;
        if (m.getContact() != null)
            return CONTACT;
        if (m.getPoll() != null)
            return POLL;
        if (m.getNewChatMembers() != null && !m.getNewChatMembers().isEmpty())
            return NEW_CHAT_MEMBERS;
        if (m.getLeftChatMember() != null)
            return LEFT_CHAT_MEMBER;
        if (m.getNewChatTitle() != null)
            return NEW_CHAT_TITLE;
        return UNKNOWN;
    }
}

package com.botwire.api.types;

/**
 * Type of a chat, as carried in {@code chat.type}.
 */
public enum ChatType {
    PRIVATE("private"),
    GROUP("group"),
    SUPERGROUP("supergroup"),
    CHANNEL("channel");

    private final String wireName;

    ChatType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching type, or null for an unknown or missing value
     */
    public static ChatType fromWireName(String name) {
        if (name == null)
            return null;
        for (ChatType t : values()) {
            if (t.wireName.equalsIgnoreCase(name))
                return t;
        }
        return null;
    }
}

package com.botwire.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Change of a chat member's status; payload of both {@code my_chat_member} and {@code chat_member}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMemberUpdated {
    private Chat chat;
    private User from;
    private long date;
    @JsonProperty("old_chat_member")
    private ChatMember oldChatMember;
    @JsonProperty("new_chat_member")
    private ChatMember newChatMember;
    @JsonProperty("invite_link")
    private JsonNode inviteLink;
}

package com.botwire.api.markup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * Asks the client to open a reply to the bot's message.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForceReply implements ReplyMarkup {

    @JsonProperty("force_reply")
    private final boolean forceReply = true;

    private final Boolean selective;

    @JsonProperty("input_field_placeholder")
    private final String inputFieldPlaceholder;

    public ForceReply() {
        this(false, null);
    }

    public ForceReply(boolean selective, String inputFieldPlaceholder) {
        this.selective = selective ? Boolean.TRUE : null;
        this.inputFieldPlaceholder = inputFieldPlaceholder;
    }
}

package com.botwire.api.markup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * Hides the current reply keyboard.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyKeyboardRemove implements ReplyMarkup {

    @JsonProperty("remove_keyboard")
    private final boolean removeKeyboard = true;

    private final Boolean selective;

    public ReplyKeyboardRemove() {
        this(false);
    }

    public ReplyKeyboardRemove(boolean selective) {
        this.selective = selective ? Boolean.TRUE : null;
    }
}

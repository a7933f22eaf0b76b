package com.botwire.api.markup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Inline keyboard attached to a message.
 */
public class InlineKeyboardMarkup implements ReplyMarkup {

    public static final int DEFAULT_ROW_WIDTH = 3;
    /** The platform rejects wider inline rows. */
    public static final int MAX_ROW_WIDTH = 8;

    private final int rowWidth;
    private final List<List<InlineKeyboardButton>> keyboard = new ArrayList<>();

    public InlineKeyboardMarkup() {
        this(DEFAULT_ROW_WIDTH);
    }

    public InlineKeyboardMarkup(int rowWidth) {
        this.rowWidth = Math.max(1, Math.min(MAX_ROW_WIDTH, rowWidth));
    }

    /**
     * Append buttons, starting a new row every {@code rowWidth} buttons.
     */
    public InlineKeyboardMarkup add(InlineKeyboardButton... buttons) {
        List<InlineKeyboardButton> row = new ArrayList<>(rowWidth);
        for (InlineKeyboardButton b : buttons) {
            row.add(b);
            if (row.size() == rowWidth) {
                keyboard.add(row);
                row = new ArrayList<>(rowWidth);
            }
        }
        if (!row.isEmpty()) {
            keyboard.add(row);
        }
        return this;
    }

    /**
     * Append one row regardless of the row width.
     */
    public InlineKeyboardMarkup row(InlineKeyboardButton... buttons) {
        keyboard.add(new ArrayList<>(Arrays.asList(buttons)));
        return this;
    }

    @JsonProperty("inline_keyboard")
    public List<List<InlineKeyboardButton>> getKeyboard() {
        return Collections.unmodifiableList(keyboard);
    }

    @JsonIgnore
    public int getRowWidth() {
        return rowWidth;
    }
}

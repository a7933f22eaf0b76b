package com.botwire.api.markup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Custom reply keyboard shown in place of the system keyboard.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyKeyboardMarkup implements ReplyMarkup {

    public static final int DEFAULT_ROW_WIDTH = 3;
    public static final int MAX_ROW_WIDTH = 12;

    private final int rowWidth;
    private final List<List<KeyboardButton>> keyboard = new ArrayList<>();

    @JsonProperty("resize_keyboard")
    private Boolean resizeKeyboard;
    @JsonProperty("one_time_keyboard")
    private Boolean oneTimeKeyboard;
    private Boolean selective;
    @JsonProperty("input_field_placeholder")
    private String inputFieldPlaceholder;

    public ReplyKeyboardMarkup() {
        this(DEFAULT_ROW_WIDTH);
    }

    public ReplyKeyboardMarkup(int rowWidth) {
        this.rowWidth = Math.max(1, Math.min(MAX_ROW_WIDTH, rowWidth));
    }

    /**
     * Append plain-text buttons, {@code rowWidth} per row.
     * {@code add("A", "B", "C")} with width 2 yields {@code [["A","B"],["C"]]}.
     */
    public ReplyKeyboardMarkup add(String... texts) {
        KeyboardButton[] buttons = new KeyboardButton[texts.length];
        for (int i = 0; i < texts.length; i++) {
            buttons[i] = new KeyboardButton(texts[i]);
        }
        return add(buttons);
    }

    public ReplyKeyboardMarkup add(KeyboardButton... buttons) {
        List<KeyboardButton> row = new ArrayList<>(rowWidth);
        for (KeyboardButton b : buttons) {
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
    public ReplyKeyboardMarkup row(String... texts) {
        List<KeyboardButton> row = new ArrayList<>(texts.length);
        for (String t : texts) {
            row.add(new KeyboardButton(t));
        }
        keyboard.add(row);
        return this;
    }

    public ReplyKeyboardMarkup resize(boolean value) {
        this.resizeKeyboard = value ? Boolean.TRUE : null;
        return this;
    }

    public ReplyKeyboardMarkup oneTime(boolean value) {
        this.oneTimeKeyboard = value ? Boolean.TRUE : null;
        return this;
    }

    public ReplyKeyboardMarkup selective(boolean value) {
        this.selective = value ? Boolean.TRUE : null;
        return this;
    }

    public ReplyKeyboardMarkup placeholder(String text) {
        this.inputFieldPlaceholder = text;
        return this;
    }

    public List<List<KeyboardButton>> getKeyboard() {
        return Collections.unmodifiableList(keyboard);
    }

    public Boolean getResizeKeyboard() {
        return resizeKeyboard;
    }

    public Boolean getOneTimeKeyboard() {
        return oneTimeKeyboard;
    }

    public Boolean getSelective() {
        return selective;
    }

    public String getInputFieldPlaceholder() {
        return inputFieldPlaceholder;
    }

    @JsonIgnore
    public int getRowWidth() {
        return rowWidth;
    }
}

package com.botwire.api.markup;

import java.util.Map;

/**
 * Shortcuts for building keyboards.
 */
public final class Markups {

    private Markups() {
    }

    /**
     * Build an inline keyboard from button text to button attributes, in map iteration order.
     * <pre>{@code
     * Map<String, Map<String, String>> buttons = new LinkedHashMap<>();
     * buttons.put("Twitter", Map.of("url", "https://twitter.com"));
     * buttons.put("Back", Map.of("callback_data", "back"));
     * Markups.quickInline(buttons, 2);
     * }</pre>
     * Recognised attributes: {@code url}, {@code callback_data}, {@code switch_inline_query},
     * {@code switch_inline_query_current_chat}.
     *
     * @throws IllegalArgumentException for an unknown attribute
     */
    public static InlineKeyboardMarkup quickInline(Map<String, Map<String, String>> values, int rowWidth) {
        InlineKeyboardButton[] buttons = new InlineKeyboardButton[values.size()];
        int i = 0;
        for (Map.Entry<String, Map<String, String>> e : values.entrySet()) {
            buttons[i++] = toButton(e.getKey(), e.getValue());
        }
        return new InlineKeyboardMarkup(rowWidth).add(buttons);
    }

    public static InlineKeyboardMarkup quickInline(Map<String, Map<String, String>> values) {
        return quickInline(values, 2);
    }

    private static InlineKeyboardButton toButton(String text, Map<String, String> attrs) {
        InlineKeyboardButton.InlineKeyboardButtonBuilder b = InlineKeyboardButton.builder().text(text);
        if (attrs == null)
            return b.build();
        for (Map.Entry<String, String> a : attrs.entrySet()) {
            switch (a.getKey()) {
                case "url" -> b.url(a.getValue());
                case "callback_data" -> b.callbackData(a.getValue());
                case "switch_inline_query" -> b.switchInlineQuery(a.getValue());
                case "switch_inline_query_current_chat" -> b.switchInlineQueryCurrentChat(a.getValue());
                default -> throw new IllegalArgumentException("unknown inline button attribute: " + a.getKey());
            }
        }
        return b.build();
    }
}

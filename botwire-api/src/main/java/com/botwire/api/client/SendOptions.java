package com.botwire.api.client;

import com.botwire.api.markup.ReplyMarkup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Optional parameters shared by the send and edit methods. Unset values are not sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendOptions {

    /** "HTML", "MarkdownV2", "Markdown"; null uses the bot's default. */
    private String parseMode;
    private Boolean disableNotification;
    private Boolean protectContent;
    private Boolean disableWebPagePreview;
    private Long replyToMessageId;
    private Boolean allowSendingWithoutReply;
    private Integer messageThreadId;
    private ReplyMarkup replyMarkup;
    /** Photo and document captions. */
    private String caption;

    void applyTo(Map<String, Object> params, String defaultParseMode, boolean textBearing) {
        String mode = parseMode != null ? parseMode : defaultParseMode;
        if (textBearing && mode != null && !mode.isBlank()) {
            params.put("parse_mode", mode);
        }
        putIfSet(params, "disable_notification", disableNotification);
        putIfSet(params, "protect_content", protectContent);
        putIfSet(params, "disable_web_page_preview", disableWebPagePreview);
        putIfSet(params, "reply_to_message_id", replyToMessageId);
        putIfSet(params, "allow_sending_without_reply", allowSendingWithoutReply);
        putIfSet(params, "message_thread_id", messageThreadId);
        putIfSet(params, "reply_markup", replyMarkup);
        putIfSet(params, "caption", caption);
    }

    private static void putIfSet(Map<String, Object> params, String key, Object value) {
        if (value != null) {
            params.put(key, value);
        }
    }
}

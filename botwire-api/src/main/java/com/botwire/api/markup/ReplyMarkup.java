package com.botwire.api.markup;

/**
 * Anything accepted as {@code reply_markup}: inline keyboard, reply keyboard, keyboard removal, force reply.
 */
public interface ReplyMarkup {
}

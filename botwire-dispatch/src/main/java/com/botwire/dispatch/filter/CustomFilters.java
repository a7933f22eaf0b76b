package com.botwire.dispatch.filter;

import com.botwire.api.client.BotApi;
import com.botwire.api.types.CallbackQuery;
import com.botwire.api.types.Chat;
import com.botwire.api.types.ChatMember;
import com.botwire.api.types.Message;
import com.botwire.api.types.Update;
import com.botwire.api.types.User;
import com.botwire.common.errors.ConfigurationException;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Ready-made custom filters. None is active until registered:
 * <pre>{@code
 * CustomFilters.registerDefaults(filterRegistry);
 * bot.onMessage(handler, Filters.custom("text_contains", List.of("price", "cost")));
 * }</pre>
 */
public final class CustomFilters {

    private CustomFilters() {
    }

    /**
     * Register every filter here except {@code is_chat_admin}, which needs an API client.
     */
    public static void registerDefaults(FilterRegistry registry) {
        registry.registerCustomFilter(new TextMatch());
        registry.registerCustomFilter(new TextContains());
        registry.registerCustomFilter(new TextStartsWith());
        registry.registerCustomFilter(new ChatId());
        registry.registerCustomFilter(new LanguageCode());
        registry.registerCustomFilter(new IsForwarded());
        registry.registerCustomFilter(new IsReply());
        registry.registerCustomFilter(new IsDigit());
    }

    // =========================================================================
    // Text
    // =========================================================================

    /**
     * {@code text}: a {@link TextFilter}, a list of accepted texts, or one exact text.
     */
    public static class TextMatch implements AdvancedCustomFilter {
        @Override
        public String key() {
            return "text";
        }

        @Override
        public void validate(Object value) {
            if (!(value instanceof TextFilter) && !(value instanceof Collection) && !(value instanceof String)) {
                throw new ConfigurationException("text: expected a TextFilter, a list or a string, got "
                        + BuiltinFilters.describe(value));
            }
        }

        @Override
        public boolean check(Update update, Object value) {
            if (value instanceof TextFilter filter)
                return filter.check(update);
            String text = TextFilter.textOf(update);
            if (value instanceof Collection<?> accepted)
                return text != null && accepted.contains(text);
            return value.equals(text);
        }
    }

    /** {@code text_contains}: any of the given strings occurs in the text. */
    public static class TextContains implements AdvancedCustomFilter {
        @Override
        public String key() {
            return "text_contains";
        }

        @Override
        public void validate(Object value) {
            BuiltinFilters.stringSet(key(), value, false);
        }

        @Override
        public boolean check(Update update, Object value) {
            String text = TextFilter.textOf(update);
            if (text == null)
                return false;
            return BuiltinFilters.stringSet(key(), value, false).stream().anyMatch(text::contains);
        }
    }

    /** {@code text_startswith}: the text starts with the given string. */
    public static class TextStartsWith implements AdvancedCustomFilter {
        @Override
        public String key() {
            return "text_startswith";
        }

        @Override
        public void validate(Object value) {
            if (!(value instanceof String)) {
                throw new ConfigurationException("text_startswith: expected a string, got "
                        + BuiltinFilters.describe(value));
            }
        }

        @Override
        public boolean check(Update update, Object value) {
            String text = TextFilter.textOf(update);
            return text != null && text.startsWith((String) value);
        }
    }

    // =========================================================================
    // Chat and sender
    // =========================================================================

    /** {@code chat_id}: the originating chat id is one of the given ids. */
    public static class ChatId implements AdvancedCustomFilter {
        @Override
        public String key() {
            return "chat_id";
        }

        @Override
        public void validate(Object value) {
            if (value instanceof Number)
                return;
            if (value instanceof Collection<?> ids && ids.stream().allMatch(Number.class::isInstance))
                return;
            throw new ConfigurationException("chat_id: expected a number or a list of numbers, got "
                    + BuiltinFilters.describe(value));
        }

        @Override
        public boolean check(Update update, Object value) {
            Chat chat = update.getChat();
            if (chat == null)
                return false;
            if (value instanceof Number n)
                return n.longValue() == chat.getId();
            return ((Collection<?>) value).stream()
                    .anyMatch(id -> ((Number) id).longValue() == chat.getId());
        }
    }

    /** {@code language_code}: the sender's language code equals the value or is in the list. */
    public static class LanguageCode implements AdvancedCustomFilter {
        @Override
        public String key() {
            return "language_code";
        }

        @Override
        public void validate(Object value) {
            BuiltinFilters.stringSet(key(), value, false);
        }

        @Override
        public boolean check(Update update, Object value) {
            User from = update.getFrom();
            if (from == null || from.getLanguageCode() == null)
                return false;
            Set<String> codes = BuiltinFilters.stringSet(key(), value, false);
            return codes.contains(from.getLanguageCode());
        }
    }

    /** {@code is_forwarded}. */
    public static class IsForwarded implements SimpleCustomFilter {
        @Override
        public String key() {
            return "is_forwarded";
        }

        @Override
        public boolean check(Update update) {
            Message m = messageOf(update);
            return m != null && m.isForwarded();
        }
    }

    /** {@code is_reply}: the message, or the message under a callback button, replies to another one. */
    public static class IsReply implements SimpleCustomFilter {
        @Override
        public String key() {
            return "is_reply";
        }

        @Override
        public boolean check(Update update) {
            Message m = messageOf(update);
            return m != null && m.getReplyToMessage() != null;
        }
    }

    /** {@code is_digit}: the text is non-empty and all digits. */
    public static class IsDigit implements SimpleCustomFilter {
        @Override
        public String key() {
            return "is_digit";
        }

        @Override
        public boolean check(Update update) {
            String text = TextFilter.textOf(update);
            return text != null && !text.isEmpty() && text.chars().allMatch(Character::isDigit);
        }
    }

    /**
     * {@code is_chat_admin}: the sender is the creator or an administrator of the chat.
     * Costs one {@code getChatMember} call per check.
     */
    public static class IsChatAdmin implements SimpleCustomFilter {
        private final BotApi api;

        public IsChatAdmin(BotApi api) {
            this.api = Objects.requireNonNull(api, "api");
        }

        @Override
        public String key() {
            return "is_chat_admin";
        }

        @Override
        public boolean check(Update update) {
            Chat chat = update.getChat();
            User from = update.getFrom();
            if (chat == null || from == null)
                return false;
            ChatMember member = api.getChatMember(chat.getId(), from.getId());
            return member != null
                    && ("creator".equals(member.getStatus()) || "administrator".equals(member.getStatus()));
        }
    }

    private static Message messageOf(Update update) {
        Message m = update.getMessage();
        if (m != null)
            return m;
        CallbackQuery cb = update.getCallbackQuery();
        return cb != null ? cb.getMessage() : null;
    }
}

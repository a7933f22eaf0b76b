package com.botwire.dispatch.filter;

import com.botwire.api.types.Chat;
import com.botwire.api.types.ChatType;
import com.botwire.api.types.ContentType;
import com.botwire.api.types.Message;
import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.common.errors.ConfigurationException;
import com.botwire.common.text.Commands;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Factories for the five built-in filters.
 */
final class BuiltinFilters {

    private BuiltinFilters() {
    }

    // =========================================================================
    // content_types
    // =========================================================================

    static UpdateFilter contentTypes(UpdateKind kind, Object argument) {
        requireMessageKind(Filters.CONTENT_TYPES, kind);
        Set<ContentType> accepted = EnumSet.noneOf(ContentType.class);
        for (String tag : stringSet(Filters.CONTENT_TYPES, argument, true)) {
            ContentType type = ContentType.fromTag(tag);
            if (type == null) {
                throw new ConfigurationException("content_types: unknown content type '" + tag + "'");
            }
            accepted.add(type);
        }
        if (accepted.isEmpty()) {
            accepted.add(ContentType.TEXT);
        }
        return update -> {
            Message m = update.getMessage();
            return m != null && accepted.contains(m.getContentType());
        };
    }

    // =========================================================================
    // commands
    // =========================================================================

    static UpdateFilter commands(UpdateKind kind, Object argument) {
        requireMessageKind(Filters.COMMANDS, kind);
        Set<String> commands = new LinkedHashSet<>();
        for (String c : stringSet(Filters.COMMANDS, argument, false)) {
            commands.add(c.startsWith("/") ? c.substring(1) : c);
        }
        return update -> {
            Message m = update.getMessage();
            if (m == null || m.getContentType() != ContentType.TEXT)
                return false;
            String command = Commands.extractCommand(m.getText());
            return command != null && commands.contains(command);
        };
    }

    // =========================================================================
    // regexp
    // =========================================================================

    static UpdateFilter regexp(UpdateKind kind, Object argument) {
        requireMessageKind(Filters.REGEXP, kind);
        Pattern pattern;
        if (argument instanceof Pattern p) {
            pattern = p;
        } else if (argument instanceof String s) {
            try {
                pattern = Pattern.compile(s, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("regexp: invalid pattern '" + s + "': " + e.getDescription(), e);
            }
        } else {
            throw new ConfigurationException("regexp: expected a pattern string, got " + describe(argument));
        }
        return update -> {
            Message m = update.getMessage();
            return m != null && m.getContentType() == ContentType.TEXT && pattern.matcher(m.getText()).find();
        };
    }

    // =========================================================================
    // chat_types
    // =========================================================================

    static UpdateFilter chatTypes(UpdateKind kind, Object argument) {
        if (!kind.hasChat()) {
            throw new ConfigurationException("chat_types cannot be used for " + kind.wireName()
                    + " updates: they carry no chat");
        }
        Set<ChatType> accepted = EnumSet.noneOf(ChatType.class);
        for (String tag : stringSet(Filters.CHAT_TYPES, argument, false)) {
            ChatType type = ChatType.fromWireName(tag);
            if (type == null) {
                throw new ConfigurationException("chat_types: unknown chat type '" + tag + "'");
            }
            accepted.add(type);
        }
        return update -> {
            Chat chat = update.getChat();
            return chat != null && accepted.contains(chat.chatType());
        };
    }

    // =========================================================================
    // func
    // =========================================================================

    @SuppressWarnings("unchecked")
    static UpdateFilter func(UpdateKind kind, Object argument) {
        if (argument instanceof Predicate<?> p) {
            Predicate<Update> predicate = (Predicate<Update>) p;
            return predicate::test;
        }
        if (argument instanceof UpdateFilter f) {
            return f;
        }
        throw new ConfigurationException("func: expected a Predicate<Update>, got " + describe(argument));
    }

    // =========================================================================
    // Argument helpers
    // =========================================================================

    static void requireMessageKind(String filter, UpdateKind kind) {
        if (!kind.isMessageKind()) {
            throw new ConfigurationException(filter + " cannot be used for " + kind.wireName()
                    + " updates: only messages and channel posts have content");
        }
    }

    /**
     * A single string or a collection of strings. Null is accepted only when {@code nullable}.
     */
    static Set<String> stringSet(String filter, Object argument, boolean nullable) {
        Set<String> out = new LinkedHashSet<>();
        if (argument == null) {
            if (nullable)
                return out;
            throw new ConfigurationException(filter + ": an argument is required");
        }
        if (argument instanceof String s) {
            out.add(s);
            return out;
        }
        if (argument instanceof Collection<?> values) {
            for (Object v : values) {
                if (v instanceof String s) {
                    out.add(s);
                } else if (v instanceof Enum<?> e) {
                    out.add(e.name().toLowerCase());
                } else {
                    throw new ConfigurationException(filter + ": expected strings, got " + describe(v));
                }
            }
            if (out.isEmpty() && !nullable) {
                throw new ConfigurationException(filter + ": at least one value is required");
            }
            return out;
        }
        throw new ConfigurationException(filter + ": expected a string or a collection of strings, got "
                + describe(argument));
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}

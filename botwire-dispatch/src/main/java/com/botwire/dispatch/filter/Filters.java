package com.botwire.dispatch.filter;

import com.botwire.api.types.ChatType;
import com.botwire.api.types.ContentType;
import com.botwire.api.types.Update;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Shorthands for the filters accepted by the registration methods.
 * <pre>{@code
 * bot.onMessage(handler, Filters.commands("start", "help"));
 * bot.onMessage(handler, Filters.contentTypes(ContentType.PHOTO), Filters.chatTypes(ChatType.PRIVATE));
 * }</pre>
 */
public final class Filters {

    public static final String CONTENT_TYPES = "content_types";
    public static final String COMMANDS = "commands";
    public static final String REGEXP = "regexp";
    public static final String CHAT_TYPES = "chat_types";
    public static final String FUNC = "func";
    public static final String STATE = "state";

    private Filters() {
    }

    /** Content-type tags such as {@code "text"} or {@code "photo"}; none means {@code text}. */
    public static FilterSpec contentTypes(String... tags) {
        return new FilterSpec(CONTENT_TYPES, List.of(tags));
    }

    public static FilterSpec contentTypes(ContentType... types) {
        return new FilterSpec(CONTENT_TYPES, Arrays.stream(types).map(ContentType::tag).toList());
    }

    /** Command names without the slash. */
    public static FilterSpec commands(String... commands) {
        return new FilterSpec(COMMANDS, List.of(commands));
    }

    /** Case-insensitive search in the message text. */
    public static FilterSpec regexp(String pattern) {
        return new FilterSpec(REGEXP, Objects.requireNonNull(pattern, "pattern"));
    }

    public static FilterSpec regexp(Pattern pattern) {
        return new FilterSpec(REGEXP, Objects.requireNonNull(pattern, "pattern"));
    }

    public static FilterSpec chatTypes(String... types) {
        return new FilterSpec(CHAT_TYPES, List.of(types));
    }

    public static FilterSpec chatTypes(ChatType... types) {
        return new FilterSpec(CHAT_TYPES, Arrays.stream(types).map(ChatType::wireName).toList());
    }

    public static FilterSpec func(Predicate<Update> predicate) {
        return new FilterSpec(FUNC, Objects.requireNonNull(predicate, "predicate"));
    }

    public static FilterSpec callbackData(CallbackDataFilter filter) {
        return new FilterSpec(FUNC, Objects.requireNonNull(filter, "filter"));
    }

    /**
     * The sender's conversation state is one of {@code states}; {@code "*"} matches any update.
     * Resolved by the {@code state} custom filter a {@code Bot} registers for its state storage.
     */
    public static FilterSpec state(String... states) {
        if (states.length == 1)
            return new FilterSpec(STATE, states[0]);
        return new FilterSpec(STATE, List.of(states));
    }

    /** A filter registered with {@link FilterRegistry#registerFilter} or {@code registerCustomFilter}. */
    public static FilterSpec custom(String key, Object value) {
        return new FilterSpec(key, value);
    }
}

package com.botwire.dispatch.filter;

import com.botwire.api.types.CallbackQuery;
import com.botwire.api.types.InlineQuery;
import com.botwire.api.types.Message;
import com.botwire.api.types.Poll;
import com.botwire.api.types.Update;
import com.botwire.common.errors.ConfigurationException;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Locale;

/**
 * Text test for the {@code text} custom filter. Matches when any configured mode matches.
 * <p>
 * The text is the message text (or caption), the callback data, the inline query or the poll
 * question, depending on the update.
 * <pre>{@code
 * Filters.custom("text", TextFilter.builder().startsWith(List.of("hi", "hello")).ignoreCase(true).build())
 * }</pre>
 */
@Getter
public class TextFilter {

    private final String equalTo;
    private final List<String> contains;
    private final List<String> startsWith;
    private final List<String> endsWith;
    private final boolean ignoreCase;

    @Builder
    public TextFilter(String equalTo, List<String> contains, List<String> startsWith, List<String> endsWith,
            boolean ignoreCase) {
        if (equalTo == null && contains == null && startsWith == null && endsWith == null) {
            throw new ConfigurationException("TextFilter: none of equalTo, contains, startsWith, endsWith given");
        }
        this.ignoreCase = ignoreCase;
        this.equalTo = equalTo != null ? prepare(equalTo) : null;
        this.contains = prepareAll(contains);
        this.startsWith = prepareAll(startsWith);
        this.endsWith = prepareAll(endsWith);
    }

    public boolean check(Update update) {
        String text = textOf(update);
        if (text == null)
            return false;
        String t = prepare(text);
        if (equalTo != null && equalTo.equals(t))
            return true;
        if (contains.stream().anyMatch(t::contains))
            return true;
        if (startsWith.stream().anyMatch(t::startsWith))
            return true;
        return endsWith.stream().anyMatch(t::endsWith);
    }

    /**
     * The text a text filter looks at, or null when the update has none.
     */
    public static String textOf(Update update) {
        Message message = update.getMessage();
        if (message != null)
            return message.textOrCaption();
        Object payload = update.getPayload();
        if (payload instanceof CallbackQuery cb)
            return cb.getData();
        if (payload instanceof InlineQuery q)
            return q.getQuery();
        if (payload instanceof Poll p)
            return p.getQuestion();
        return null;
    }

    private String prepare(String s) {
        return ignoreCase ? s.toLowerCase(Locale.ROOT) : s;
    }

    private List<String> prepareAll(List<String> values) {
        if (values == null)
            return List.of();
        return values.stream().map(this::prepare).toList();
    }
}

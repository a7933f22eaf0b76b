package com.botwire.dispatch.state;

import com.botwire.api.types.Chat;
import com.botwire.api.types.Update;
import com.botwire.api.types.User;
import com.botwire.common.errors.ConfigurationException;
import com.botwire.dispatch.filter.AdvancedCustomFilter;

import java.util.Collection;
import java.util.Objects;

/**
 * {@code state}: the sender's current state in the chat is the given state or one of a list.
 * {@value #ANY} matches every update, with or without a state.
 * <pre>{@code
 * bot.onMessage(askAge, Filters.state("waiting_name"));
 * }</pre>
 */
public class StateFilter implements AdvancedCustomFilter {

    public static final String KEY = "state";
    public static final String ANY = "*";

    private final StateStorage storage;

    public StateFilter(StateStorage storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public void validate(Object value) {
        if (value instanceof String)
            return;
        if (value instanceof Collection<?> states && !states.isEmpty()
                && states.stream().allMatch(String.class::isInstance))
            return;
        throw new ConfigurationException("state: expected a state name or a non-empty list of names, got "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    @Override
    public boolean check(Update update, Object value) {
        if (ANY.equals(value))
            return true;
        Chat chat = update.getChat();
        User from = update.getFrom();
        if (chat == null || from == null)
            return false;
        String current = storage.getState(chat.getId(), from.getId());
        if (current == null)
            return false;
        if (value instanceof Collection<?> states)
            return states.contains(current);
        return current.equals(value);
    }
}

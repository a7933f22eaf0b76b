package com.botwire.dispatch.filter;

import com.botwire.api.types.CallbackQuery;
import com.botwire.api.types.Update;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Filter produced by {@link CallbackData#filter}; use with {@link Filters#callbackData}.
 */
public final class CallbackDataFilter implements Predicate<Update> {

    private final CallbackData factory;
    private final Map<String, Set<String>> accepted;

    CallbackDataFilter(CallbackData factory, Map<String, Set<String>> accepted) {
        this.factory = factory;
        this.accepted = Map.copyOf(accepted);
    }

    /**
     * True for a callback query update whose data parses and carries the accepted part values.
     */
    @Override
    public boolean test(Update update) {
        CallbackQuery query = update.getCallbackQuery();
        return query != null && check(query);
    }

    public boolean check(CallbackQuery query) {
        Optional<Map<String, String>> data = factory.tryParse(query.getData());
        if (data.isEmpty())
            return false;
        for (Map.Entry<String, Set<String>> e : accepted.entrySet()) {
            if (!e.getValue().contains(data.get().get(e.getKey())))
                return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return factory.toString() + accepted;
    }
}

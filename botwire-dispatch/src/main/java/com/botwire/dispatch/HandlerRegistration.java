package com.botwire.dispatch;

import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.dispatch.filter.ResolvedFilter;
import lombok.Getter;

import java.util.List;

/**
 * One handler registered for one update kind. Immutable; also the handle for
 * {@link HandlerRegistry#unregister(HandlerRegistration)}.
 */
@Getter
public final class HandlerRegistration {

    /** Registration order, increasing across all kinds of one registry. */
    private final long ordinal;
    private final UpdateKind kind;
    /** AND-combined; empty matches every update of {@link #kind}. */
    private final List<ResolvedFilter> filters;
    private final UpdateHandler handler;
    /** The object the caller registered; may differ from {@link #handler} when it was adapted. */
    private final Object callback;
    private final boolean continueHandling;

    HandlerRegistration(long ordinal, UpdateKind kind, List<ResolvedFilter> filters, UpdateHandler handler,
            Object callback, boolean continueHandling) {
        this.ordinal = ordinal;
        this.kind = kind;
        this.filters = List.copyOf(filters);
        this.handler = handler;
        this.callback = callback;
        this.continueHandling = continueHandling;
    }

    /**
     * Evaluate the filters in order, stopping at the first that does not match.
     */
    public boolean matches(Update update) {
        for (ResolvedFilter filter : filters) {
            if (!filter.test(update)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "HandlerRegistration{#" + ordinal + " " + kind.wireName() + " " + filters
                + (continueHandling ? " continue" : "") + "}";
    }
}

package com.botwire.dispatch.filter;

import com.botwire.api.types.Update;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A filter bound to a registration. A failing predicate counts as no match.
 */
@Slf4j
@Getter
public final class ResolvedFilter implements UpdateFilter {

    private final FilterSpec spec;
    private final UpdateFilter predicate;

    public ResolvedFilter(FilterSpec spec, UpdateFilter predicate) {
        this.spec = spec;
        this.predicate = predicate;
    }

    @Override
    public boolean test(Update update) {
        try {
            return predicate.test(update);
        } catch (Exception e) {
            log.warn("Filter {} failed on update {}: {}", spec.name(), update.getUpdateId(), e.toString());
            return false;
        }
    }

    public String name() {
        return spec.name();
    }

    @Override
    public String toString() {
        return spec.toString();
    }
}

package com.botwire.dispatch.filter;

import java.util.Objects;

/**
 * A filter as written at registration: the name it is registered under plus its argument.
 * Resolved to an {@link UpdateFilter} by {@link FilterRegistry#resolve}.
 */
public record FilterSpec(String name, Object argument) {

    public FilterSpec {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name + "=" + argument;
    }
}

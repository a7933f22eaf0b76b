package com.botwire.dispatch.filter;

import com.botwire.api.types.Update;

/**
 * One resolved condition on an update.
 */
@FunctionalInterface
public interface UpdateFilter {

    boolean test(Update update);
}

package com.botwire.dispatch.filter;

import com.botwire.api.types.Update;

/**
 * Custom filter with a yes/no check. A registration passes {@code key=true} or {@code key=false};
 * the filter matches when {@link #check} returns that value.
 */
public interface SimpleCustomFilter {

    /** Name the filter is referenced by in {@link Filters#custom(String, Object)}. */
    String key();

    boolean check(Update update);
}

package com.botwire.dispatch.filter;

import com.botwire.api.types.Update;

/**
 * Custom filter that receives the registration's argument, e.g. {@code chat_id=[1, 2]}.
 */
public interface AdvancedCustomFilter {

    String key();

    boolean check(Update update, Object value);

    /**
     * Called once per registration so an unusable argument fails there instead of at dispatch.
     *
     * @throws com.botwire.common.errors.ConfigurationException if {@code value} cannot be used
     */
    default void validate(Object value) {
    }
}

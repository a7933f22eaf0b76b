package com.botwire.dispatch.filter;

import com.botwire.api.types.UpdateKind;

/**
 * Builds the filter for one registration.
 */
@FunctionalInterface
public interface FilterFactory {

    /**
     * @param kind     kind of the registration the filter is attached to
     * @param argument argument given at registration, may be null
     * @throws com.botwire.common.errors.ConfigurationException if the argument or kind is not acceptable
     */
    UpdateFilter create(UpdateKind kind, Object argument);
}

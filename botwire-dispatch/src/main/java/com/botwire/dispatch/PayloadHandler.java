package com.botwire.dispatch;

/**
 * Callback that receives the typed payload instead of the whole update, e.g. the {@code Message}
 * of a message update.
 */
@FunctionalInterface
public interface PayloadHandler<T> {

    void handle(T payload, DispatchContext context) throws Exception;
}

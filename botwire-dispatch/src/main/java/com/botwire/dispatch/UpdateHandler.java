package com.botwire.dispatch;

import com.botwire.api.types.Update;

/**
 * Callback of a handler registration. Exceptions are caught by the dispatcher and sent to the
 * {@link ErrorSink}.
 */
@FunctionalInterface
public interface UpdateHandler {

    void handle(Update update, DispatchContext context) throws Exception;
}

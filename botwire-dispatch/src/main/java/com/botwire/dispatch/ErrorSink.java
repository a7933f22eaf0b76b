package com.botwire.dispatch;

import com.botwire.api.types.Update;

/**
 * Receives handler failures. Called on the thread that ran the handler.
 */
@FunctionalInterface
public interface ErrorSink {

    void onHandlerError(Update update, HandlerException error);
}

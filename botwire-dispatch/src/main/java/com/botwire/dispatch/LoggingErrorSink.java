package com.botwire.dispatch;

import com.botwire.api.types.Update;
import lombok.extern.slf4j.Slf4j;

/**
 * Default sink: log and carry on.
 */
@Slf4j
public class LoggingErrorSink implements ErrorSink {

    @Override
    public void onHandlerError(Update update, HandlerException error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        log.error("Handler error on update {} ({}): {}", update.getUpdateId(), update.getKind().wireName(),
                cause.getMessage(), cause);
    }
}

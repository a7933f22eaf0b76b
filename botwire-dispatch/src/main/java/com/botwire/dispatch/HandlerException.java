package com.botwire.dispatch;

import com.botwire.api.types.Update;
import com.botwire.common.errors.BotException;

/**
 * A handler (or middleware) failed while processing an update.
 */
public class HandlerException extends BotException {

    private final transient Update update;

    public HandlerException(Update update, Throwable cause) {
        super("Handler failed for update " + update.getUpdateId() + " (" + update.getKind().wireName() + "): "
                + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
        this.update = update;
    }

    public Update getUpdate() {
        return update;
    }
}

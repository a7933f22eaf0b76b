package com.botwire.api.errors;

import com.botwire.common.errors.BotException;

/**
 * A raw update record could not be turned into an {@link com.botwire.api.types.Update}.
 * Poll and webhook loops log and skip such records.
 */
public class MalformedUpdateException extends BotException {

    /** The {@code update_id} if it could be read, else -1. */
    private final long updateId;

    public MalformedUpdateException(long updateId, String message) {
        super(message);
        this.updateId = updateId;
    }

    public MalformedUpdateException(long updateId, String message, Throwable cause) {
        super(message, cause);
        this.updateId = updateId;
    }

    public long getUpdateId() {
        return updateId;
    }
}

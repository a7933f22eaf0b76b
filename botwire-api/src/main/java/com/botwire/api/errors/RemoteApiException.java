package com.botwire.api.errors;

import com.botwire.common.errors.BotException;
import lombok.Getter;

/**
 * The platform answered with {@code ok: false}.
 */
@Getter
public class RemoteApiException extends BotException {

    private final String method;
    private final int errorCode;
    private final String description;
    /** Seconds the server asked us to wait (HTTP 429), or 0. */
    private final int retryAfter;

    public RemoteApiException(String method, int errorCode, String description, int retryAfter) {
        super("A request to the bot API was unsuccessful. Method " + method + " failed with error code "
                + errorCode + ": " + description);
        this.method = method;
        this.errorCode = errorCode;
        this.description = description;
        this.retryAfter = Math.max(0, retryAfter);
    }

    public boolean isRateLimited() {
        return errorCode == 429 || retryAfter > 0;
    }

    /** 409: another getUpdates consumer or an active webhook is in the way. */
    public boolean isConflict() {
        return errorCode == 409;
    }
}

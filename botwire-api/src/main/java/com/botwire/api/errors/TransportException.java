package com.botwire.api.errors;

import com.botwire.common.errors.BotException;

/**
 * Network failure, non-JSON response, or any other failure to complete an HTTP exchange.
 * The poll loop retries these according to its policy.
 */
public class TransportException extends BotException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.botwire.common.errors;

/**
 * Root of the library's unchecked exception hierarchy.
 */
public class BotException extends RuntimeException {

    public BotException(String message) {
        super(message);
    }

    public BotException(String message, Throwable cause) {
        super(message, cause);
    }
}

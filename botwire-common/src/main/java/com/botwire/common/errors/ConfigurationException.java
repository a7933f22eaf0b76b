package com.botwire.common.errors;

/**
 * Invalid configuration or handler registration. Raised before polling starts.
 */
public class ConfigurationException extends BotException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

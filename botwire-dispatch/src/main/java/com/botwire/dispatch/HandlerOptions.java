package com.botwire.dispatch;

/**
 * Per-registration dispatch options.
 *
 * @param continueHandling after this handler runs, keep looking for further matching registrations
 *                         instead of stopping at the first match
 */
public record HandlerOptions(boolean continueHandling) {

    public static final HandlerOptions DEFAULT = new HandlerOptions(false);
    public static final HandlerOptions CONTINUE = new HandlerOptions(true);
}

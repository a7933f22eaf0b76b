package com.botwire.dispatch.middleware;

/**
 * Outcome of {@link Middleware#preProcess}.
 */
public enum MiddlewareResult {
    /** Continue normally. */
    PROCEED,
    /** Run no handler for this update; post-processing still runs. */
    SKIP_HANDLER,
    /** Drop the update: no handler, no post-processing. */
    CANCEL_UPDATE
}

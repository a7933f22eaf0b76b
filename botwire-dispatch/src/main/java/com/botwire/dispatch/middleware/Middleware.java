package com.botwire.dispatch.middleware;

import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.dispatch.DispatchContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * Hooks around handler invocation. Pre-processing runs in registration order before any filter is
 * evaluated; post-processing runs in reverse registration order after the handlers.
 * <pre>{@code
 * dispatcher.addMiddleware(new Middleware() {
 *     public MiddlewareResult preProcess(Update update, DispatchContext ctx) {
 *         ctx.put("startedAt", System.nanoTime());
 *         return MiddlewareResult.PROCEED;
 *     }
 *
 *     public void postProcess(Update update, DispatchContext ctx, Exception error) {
 *         long took = System.nanoTime() - ctx.get("startedAt", Long.class);
 *     }
 * });
 * }</pre>
 */
public interface Middleware {

    /** Kinds this middleware applies to; all kinds by default. */
    default Set<UpdateKind> updateKinds() {
        return EnumSet.allOf(UpdateKind.class);
    }

    MiddlewareResult preProcess(Update update, DispatchContext context) throws Exception;

    /**
     * @param error the first handler failure of this dispatch, or null when none failed
     */
    default void postProcess(Update update, DispatchContext context, Exception error) throws Exception {
    }
}

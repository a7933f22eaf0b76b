package com.botwire.dispatch;

import com.botwire.api.types.Message;
import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.botwire.common.config.BotConfig;
import com.botwire.dispatch.middleware.Middleware;
import com.botwire.dispatch.middleware.MiddlewareResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes updates to handler registrations.
 * <p>
 * For each update: run the pre-process middlewares, walk the registrations of the update's kind in
 * registration order, invoke the first whose filters all match (and any later match when that
 * registration has {@code continueHandling}), then run the post-process middlewares in reverse
 * order. A failing handler is reported to the {@link ErrorSink} and never stops dispatch.
 * <p>
 * A message in a chat with pending {@linkplain NextStepRegistry next-step handlers} goes to those
 * handlers instead of the message registrations; middlewares still run around them.
 * <p>
 * In {@link DispatchMode#POOLED} mode each update is processed on a fixed worker pool and
 * {@link #dispatch} returns as soon as it is submitted, so submission order equals arrival order
 * while completion order is not guaranteed.
 */
@Slf4j
public class Dispatcher implements AutoCloseable {

    private static final ErrorSink DEFAULT_SINK = new LoggingErrorSink();

    private final HandlerRegistry registry;
    private final DispatchMode mode;
    private final boolean middlewareEnabled;
    private final boolean strict;
    private final ExecutorService pool;
    private final List<Middleware> middlewares = new CopyOnWriteArrayList<>();
    private final List<UpdateListener> listeners = new CopyOnWriteArrayList<>();
    private final NextStepRegistry nextSteps = new NextStepRegistry();
    private volatile ErrorSink errorSink;

    public Dispatcher(HandlerRegistry registry) {
        this(registry, DispatchMode.INLINE, 1, true, false);
    }

    public Dispatcher(HandlerRegistry registry, BotConfig.DispatchConfig config) {
        this(registry, DispatchMode.fromConfig(config.getMode()), config.getPoolSize(),
                config.isMiddlewareEnabled(), config.isStrict());
    }

    /**
     * @param strict with no error sink set, rethrow handler failures from {@link #dispatch} (inline
     *               mode) instead of logging them
     */
    public Dispatcher(HandlerRegistry registry, DispatchMode mode, int poolSize, boolean middlewareEnabled,
            boolean strict) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.middlewareEnabled = middlewareEnabled;
        this.strict = strict;
        this.pool = mode == DispatchMode.POOLED ? newPool(Math.max(1, poolSize)) : null;
    }

    private static ExecutorService newPool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "botwire-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // =========================================================================
    // Configuration
    // =========================================================================

    public void addMiddleware(Middleware middleware) {
        middlewares.add(Objects.requireNonNull(middleware, "middleware"));
    }

    public void addUpdateListener(UpdateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @param sink receiver of handler failures; null restores the default (log, or rethrow when strict)
     */
    public void setErrorSink(ErrorSink sink) {
        this.errorSink = sink;
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    public DispatchMode getMode() {
        return mode;
    }

    public NextStepRegistry getNextSteps() {
        return nextSteps;
    }

    // =========================================================================
    // Dispatch
    // =========================================================================

    /**
     * Hand a parsed batch to the update listeners, then dispatch each update in order. A failure in
     * one update is logged and does not affect the rest of the batch.
     */
    public void dispatchBatch(List<Update> updates) {
        if (updates.isEmpty())
            return;
        notifyListeners(updates);
        for (Update update : updates) {
            try {
                dispatch(update);
            } catch (Exception e) {
                log.error("Dispatch failed for update {}: {}", update.getUpdateId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Dispatch one update. Inline: returns when all handlers and middlewares are done. Pooled:
     * returns once the update is queued.
     *
     * @throws HandlerException in strict inline mode without an error sink, after post-processing
     */
    public void dispatch(Update update) {
        Objects.requireNonNull(update, "update");
        if (pool == null) {
            process(update);
            return;
        }
        try {
            pool.execute(() -> {
                try {
                    process(update);
                } catch (HandlerException e) {
                    log.error("Handler error on update {} (strict): {}", update.getUpdateId(), e.getMessage(), e);
                } catch (RuntimeException e) {
                    log.error("Dispatch failed for update {}: {}", update.getUpdateId(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher is shut down; dropping update {}", update.getUpdateId());
        }
    }

    private void process(Update update) {
        List<HandlerRegistration> candidates = registry.lookup(update.getKind());
        List<Middleware> active = middlewareEnabled ? applicableMiddlewares(update) : List.of();
        Long stepChat = nextStepChat(update);
        if (candidates.isEmpty() && active.isEmpty() && stepChat == null) {
            log.debug("No handler for {}", update);
            return;
        }

        DispatchContext context = new DispatchContext();
        HandlerException firstError = null;
        boolean runHandlers = true;

        for (Middleware m : active) {
            MiddlewareResult result;
            try {
                result = m.preProcess(update, context);
            } catch (Exception e) {
                HandlerException error = new HandlerException(update, e);
                firstError = error;
                report(update, error);
                runHandlers = false;
                break;
            }
            if (result == MiddlewareResult.CANCEL_UPDATE) {
                log.debug("Update {} cancelled by {}", update.getUpdateId(), m.getClass().getSimpleName());
                return;
            }
            if (result == MiddlewareResult.SKIP_HANDLER) {
                runHandlers = false;
            }
        }

        if (runHandlers) {
            List<PayloadHandler<Message>> steps = stepChat != null ? nextSteps.take(stepChat) : List.of();
            HandlerException error = steps.isEmpty()
                    ? runRegistrations(update, candidates, context)
                    : runNextSteps(update, steps, context);
            if (firstError == null)
                firstError = error;
        }

        for (int i = active.size() - 1; i >= 0; i--) {
            Middleware m = active.get(i);
            try {
                m.postProcess(update, context, firstError != null ? (Exception) firstError.getCause() : null);
            } catch (Exception e) {
                log.error("Middleware {} post-process failed on update {}: {}",
                        m.getClass().getSimpleName(), update.getUpdateId(), e.getMessage(), e);
            }
        }

        if (firstError != null && errorSink == null && strict) {
            throw firstError;
        }
    }

    /**
     * @return the first handler failure, or null
     */
    private HandlerException runRegistrations(Update update, List<HandlerRegistration> candidates,
            DispatchContext context) {
        HandlerException firstError = null;
        for (HandlerRegistration registration : candidates) {
            if (!registration.matches(update))
                continue;
            try {
                registration.getHandler().handle(update, context);
            } catch (Exception e) {
                HandlerException error = new HandlerException(update, e);
                if (firstError == null)
                    firstError = error;
                report(update, error);
            }
            if (!registration.isContinueHandling())
                break;
        }
        return firstError;
    }

    private HandlerException runNextSteps(Update update, List<PayloadHandler<Message>> steps,
            DispatchContext context) {
        log.debug("Update {} goes to {} next-step handler(s)", update.getUpdateId(), steps.size());
        HandlerException firstError = null;
        for (PayloadHandler<Message> step : steps) {
            try {
                step.handle(update.getMessage(), context);
            } catch (Exception e) {
                HandlerException error = new HandlerException(update, e);
                if (firstError == null)
                    firstError = error;
                report(update, error);
            }
        }
        return firstError;
    }

    private Long nextStepChat(Update update) {
        if (update.getKind() != UpdateKind.MESSAGE || update.getMessage().getChat() == null)
            return null;
        long chatId = update.getMessage().getChat().getId();
        return nextSteps.hasPending(chatId) ? chatId : null;
    }

    private List<Middleware> applicableMiddlewares(Update update) {
        if (middlewares.isEmpty())
            return List.of();
        List<Middleware> out = new ArrayList<>(middlewares.size());
        for (Middleware m : middlewares) {
            if (m.updateKinds().contains(update.getKind())) {
                out.add(m);
            }
        }
        return out;
    }

    private void report(Update update, HandlerException error) {
        ErrorSink sink = errorSink;
        if (sink == null) {
            if (strict)
                return;
            sink = DEFAULT_SINK;
        }
        try {
            sink.onHandlerError(update, error);
        } catch (Exception e) {
            log.error("Error sink failed on update {}: {}", update.getUpdateId(), e.getMessage(), e);
        }
    }

    private void notifyListeners(List<Update> updates) {
        List<Update> view = List.copyOf(updates);
        for (UpdateListener listener : listeners) {
            try {
                listener.onUpdates(view);
            } catch (Exception e) {
                log.error("Update listener failed: {}", e.getMessage(), e);
            }
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Stop accepting updates; queued and running updates still complete.
     */
    public void shutdown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    /**
     * Stop accepting updates and interrupt running handlers; queued updates are abandoned.
     *
     * @return number of updates that never started
     */
    public int shutdownNow() {
        if (pool == null)
            return 0;
        int abandoned = pool.shutdownNow().size();
        if (abandoned > 0) {
            log.warn("Abandoned {} queued update(s)", abandoned);
        }
        return abandoned;
    }

    /**
     * @return true if all work finished within the timeout (always true inline)
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return pool == null || pool.awaitTermination(timeout, unit);
    }

    /**
     * Drain for up to 30 seconds, then abandon what is left.
     */
    @Override
    public void close() {
        shutdown();
        try {
            if (!awaitTermination(30, TimeUnit.SECONDS)) {
                shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownNow();
        }
    }
}

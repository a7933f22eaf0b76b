package com.botwire.dispatch;

import com.botwire.api.types.UpdateKind;
import com.botwire.dispatch.filter.ResolvedFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handler registrations partitioned by update kind, in registration order.
 * <p>
 * Each partition is an immutable list replaced on every change, so {@link #lookup} hands out a
 * snapshot without copying and registration while dispatching is safe.
 */
@Slf4j
public class HandlerRegistry {

    private final Map<UpdateKind, List<HandlerRegistration>> partitions = new ConcurrentHashMap<>();
    private final AtomicLong nextOrdinal = new AtomicLong();

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Append a registration to the partition of {@code kind}. The same handler may be registered
     * any number of times; each registration is evaluated on its own.
     *
     * @param callback the caller's object, used by {@link #unregister(Object)}; defaults to {@code handler}
     */
    public HandlerRegistration register(UpdateKind kind, UpdateHandler handler, Object callback,
            List<ResolvedFilter> filters, HandlerOptions options) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        HandlerOptions opts = options != null ? options : HandlerOptions.DEFAULT;
        HandlerRegistration registration = new HandlerRegistration(nextOrdinal.getAndIncrement(), kind,
                filters != null ? filters : List.of(), handler, callback != null ? callback : handler,
                opts.continueHandling());
        partitions.compute(kind, (k, current) -> {
            List<HandlerRegistration> next = new ArrayList<>(current != null ? current.size() + 1 : 1);
            if (current != null) {
                next.addAll(current);
            }
            next.add(registration);
            return List.copyOf(next);
        });
        log.debug("Registered {}", registration);
        return registration;
    }

    public HandlerRegistration register(UpdateKind kind, UpdateHandler handler, List<ResolvedFilter> filters) {
        return register(kind, handler, null, filters, HandlerOptions.DEFAULT);
    }

    /**
     * @return true if the registration was present
     */
    public boolean unregister(HandlerRegistration registration) {
        AtomicBoolean removed = new AtomicBoolean();
        partitions.computeIfPresent(registration.getKind(), (k, current) -> {
            List<HandlerRegistration> next = new ArrayList<>(current);
            removed.set(next.remove(registration));
            return next.isEmpty() ? null : List.copyOf(next);
        });
        return removed.get();
    }

    /**
     * Remove every registration, of any kind, whose callback is {@code callback} (by identity).
     *
     * @return number of registrations removed
     */
    public int unregister(Object callback) {
        AtomicInteger removed = new AtomicInteger();
        for (UpdateKind kind : UpdateKind.values()) {
            partitions.computeIfPresent(kind, (k, current) -> {
                List<HandlerRegistration> next = new ArrayList<>(current.size());
                for (HandlerRegistration r : current) {
                    if (r.getCallback() == callback || r.getHandler() == callback) {
                        removed.incrementAndGet();
                    } else {
                        next.add(r);
                    }
                }
                return next.isEmpty() ? null : List.copyOf(next);
            });
        }
        if (removed.get() > 0) {
            log.debug("Unregistered {} registration(s) of {}", removed.get(), callback);
        }
        return removed.get();
    }

    public void clear() {
        partitions.clear();
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    /**
     * Registrations for {@code kind} in registration order; empty when none. The returned list is an
     * immutable snapshot.
     */
    public List<HandlerRegistration> lookup(UpdateKind kind) {
        return partitions.getOrDefault(kind, List.of());
    }

    public int size() {
        return partitions.values().stream().mapToInt(List::size).sum();
    }
}

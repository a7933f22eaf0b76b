package com.botwire.dispatch;

import com.botwire.api.types.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One-shot handlers waiting for the next message in a chat.
 * <p>
 * When a message arrives in a chat with pending handlers, the {@link Dispatcher} takes all of them
 * and runs them in registration order instead of the regular message registrations. A handler that
 * wants to see the following message as well registers itself again.
 */
@Slf4j
public class NextStepRegistry {

    private final Map<Long, List<PayloadHandler<Message>>> pending = new ConcurrentHashMap<>();

    public void register(long chatId, PayloadHandler<Message> handler) {
        Objects.requireNonNull(handler, "handler");
        pending.compute(chatId, (k, current) -> {
            List<PayloadHandler<Message>> next = new ArrayList<>(current != null ? current.size() + 1 : 1);
            if (current != null) {
                next.addAll(current);
            }
            next.add(handler);
            return List.copyOf(next);
        });
        log.debug("Next-step handler registered for chat {}", chatId);
    }

    /**
     * @return number of handlers dropped
     */
    public int clear(long chatId) {
        List<PayloadHandler<Message>> removed = pending.remove(chatId);
        return removed != null ? removed.size() : 0;
    }

    public boolean hasPending(long chatId) {
        return pending.containsKey(chatId);
    }

    /**
     * Remove and return the handlers of {@code chatId}; empty if there are none.
     */
    public List<PayloadHandler<Message>> take(long chatId) {
        List<PayloadHandler<Message>> handlers = pending.remove(chatId);
        return handlers != null ? handlers : List.of();
    }
}

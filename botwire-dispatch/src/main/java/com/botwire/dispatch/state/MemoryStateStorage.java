package com.botwire.dispatch.state;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory state storage. Lost on restart.
 */
@Slf4j
public class MemoryStateStorage implements StateStorage {

    private record Key(long chatId, long userId) {
    }

    private static final class Entry {
        private String state;
        private Map<String, Object> data = new LinkedHashMap<>();
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void setState(long chatId, long userId, String state) {
        Objects.requireNonNull(state, "state");
        entries.compute(new Key(chatId, userId), (k, current) -> {
            Entry entry = current != null ? current : new Entry();
            synchronized (entry) {
                entry.state = state;
            }
            return entry;
        });
        log.debug("State of user {} in chat {} set to {}", userId, chatId, state);
    }

    @Override
    public String getState(long chatId, long userId) {
        Entry entry = entries.get(new Key(chatId, userId));
        if (entry == null)
            return null;
        synchronized (entry) {
            return entry.state;
        }
    }

    @Override
    public boolean deleteState(long chatId, long userId) {
        boolean removed = entries.remove(new Key(chatId, userId)) != null;
        if (removed) {
            log.debug("State of user {} in chat {} deleted", userId, chatId);
        }
        return removed;
    }

    @Override
    public void setData(long chatId, long userId, String key, Object value) {
        Objects.requireNonNull(key, "key");
        updateData(chatId, userId, data -> data.put(key, value));
    }

    @Override
    public Map<String, Object> getData(long chatId, long userId) {
        Entry entry = entries.get(new Key(chatId, userId));
        if (entry == null)
            return Map.of();
        synchronized (entry) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(entry.data));
        }
    }

    @Override
    public boolean resetData(long chatId, long userId) {
        Entry entry = entries.get(new Key(chatId, userId));
        if (entry == null)
            return false;
        synchronized (entry) {
            entry.data = new LinkedHashMap<>();
        }
        return true;
    }

    @Override
    public void updateData(long chatId, long userId, Consumer<Map<String, Object>> editor) {
        Objects.requireNonNull(editor, "editor");
        Entry entry = entries.get(new Key(chatId, userId));
        if (entry == null) {
            throw new IllegalStateException("No state for user " + userId + " in chat " + chatId
                    + "; set a state before storing data");
        }
        synchronized (entry) {
            Map<String, Object> copy = new LinkedHashMap<>(entry.data);
            editor.accept(copy);
            entry.data = copy;
        }
    }

    /** Number of users with a state. */
    public int size() {
        return entries.size();
    }
}

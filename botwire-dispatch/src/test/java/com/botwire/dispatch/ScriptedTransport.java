package com.botwire.dispatch;

import com.botwire.api.errors.TransportException;
import com.botwire.api.transport.BotTransport;
import com.botwire.api.transport.InputFile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport double for poll loops: returns scripted batches or throws scripted errors, and once the
 * script is exhausted answers every fetch with an empty long poll.
 */
public class ScriptedTransport implements BotTransport {

    /** Each entry is a {@code List<JsonNode>} batch or a RuntimeException to throw. */
    public final ConcurrentLinkedDeque<Object> script = new ConcurrentLinkedDeque<>();
    public final List<Long> offsets = new CopyOnWriteArrayList<>();
    public final List<Integer> limits = new CopyOnWriteArrayList<>();
    public final AtomicInteger aborted = new AtomicInteger();

    @Override
    @SuppressWarnings("unchecked")
    public List<JsonNode> fetchUpdates(long offset, int timeoutSeconds, int limit, List<String> allowedUpdates) {
        offsets.add(offset);
        limits.add(limit);
        Object next = script.poll();
        if (next == null) {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted", e);
            }
            return List.of();
        }
        if (next instanceof RuntimeException e) {
            throw e;
        }
        return (List<JsonNode>) next;
    }

    @Override
    public JsonNode send(String method, Map<String, Object> params) {
        throw new UnsupportedOperationException(method);
    }

    @Override
    public JsonNode sendMultipart(String method, Map<String, Object> params, InputFile file) {
        throw new UnsupportedOperationException(method);
    }

    @Override
    public byte[] download(String filePath) {
        throw new UnsupportedOperationException(filePath);
    }

    @Override
    public void abortFetch() {
        aborted.incrementAndGet();
    }

    @Override
    public void close() {
    }
}

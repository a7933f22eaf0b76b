package com.botwire.api.transport;

import com.botwire.api.errors.RemoteApiException;
import com.botwire.api.errors.TransportException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Request/response channel to the bot API. Implementations must be safe for concurrent use.
 */
public interface BotTransport extends AutoCloseable {

    /**
     * Long-poll for pending updates.
     *
     * @param offset         first update id to return; 0 lets the server decide, negative values count back from the newest
     * @param timeoutSeconds server-side wait when nothing is pending
     * @param limit          maximum records (1..100)
     * @param allowedUpdates update kinds by wire name, or null to keep the server setting
     * @return raw update records in server order, possibly empty
     * @throws TransportException on network failure or an unreadable response
     * @throws RemoteApiException when the server answers {@code ok: false}
     */
    List<JsonNode> fetchUpdates(long offset, int timeoutSeconds, int limit, List<String> allowedUpdates);

    /**
     * Invoke {@code method} with JSON parameters.
     *
     * @return the {@code result} field of a successful response
     * @throws TransportException on network failure or an unreadable response
     * @throws RemoteApiException when the server answers {@code ok: false}
     */
    JsonNode send(String method, Map<String, Object> params);

    /**
     * Invoke {@code method} with form fields plus one uploaded file.
     */
    JsonNode sendMultipart(String method, Map<String, Object> params, InputFile file);

    /**
     * Download a file previously resolved with {@code getFile}.
     *
     * @param filePath the {@code file_path} from the getFile result
     */
    byte[] download(String filePath);

    /**
     * Cancel an in-flight {@link #fetchUpdates} so a stopping poll loop does not wait out the long poll.
     */
    default void abortFetch() {
    }

    @Override
    void close();
}

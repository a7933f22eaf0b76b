package com.botwire.dispatch.state;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Conversation state per user in a chat: a state name plus a small data map.
 * <p>
 * A record is created by {@link #setState} and removed by {@link #deleteState}. Data can only be
 * written while a record exists. For a user talking to the bot privately, chat id and user id are
 * the same.
 */
public interface StateStorage {

    /**
     * Create the record or replace its state; existing data is kept.
     */
    void setState(long chatId, long userId, String state);

    /**
     * @return the current state, or null when the user has no record
     */
    String getState(long chatId, long userId);

    /**
     * Remove the record together with its data.
     *
     * @return true if a record existed
     */
    boolean deleteState(long chatId, long userId);

    /**
     * @throws IllegalStateException if the user has no record
     */
    void setData(long chatId, long userId, String key, Object value);

    /**
     * @return a read-only copy of the data; empty when the user has no record
     */
    Map<String, Object> getData(long chatId, long userId);

    /**
     * Clear the data and keep the state.
     *
     * @return true if a record existed
     */
    boolean resetData(long chatId, long userId);

    /**
     * Edit the data in one step. The editor works on a copy that replaces the stored data when it
     * returns; if it throws, the stored data is left as it was.
     *
     * @throws IllegalStateException if the user has no record
     */
    void updateData(long chatId, long userId, Consumer<Map<String, Object>> editor);
}

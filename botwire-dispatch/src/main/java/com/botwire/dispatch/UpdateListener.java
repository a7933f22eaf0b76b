package com.botwire.dispatch;

import com.botwire.api.types.Update;

import java.util.List;

/**
 * Sees every parsed batch before it is dispatched. Failures are logged and ignored.
 */
@FunctionalInterface
public interface UpdateListener {

    void onUpdates(List<Update> updates) throws Exception;
}

package com.botwire.api.binding;

import com.botwire.api.errors.MalformedUpdateException;
import com.botwire.api.types.Update;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns one raw update record into a typed {@link Update}.
 */
public interface UpdateParser {

    /**
     * @throws MalformedUpdateException if the record has no usable {@code update_id}, no payload,
     *                                  more than one payload, or a payload of the wrong shape
     */
    Update parse(JsonNode record);
}

package com.botwire.api.binding;

import com.botwire.api.errors.MalformedUpdateException;
import com.botwire.api.types.Update;
import com.botwire.api.types.UpdateKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link UpdateParser} binding payloads with Jackson.
 * Fields for update kinds this library does not know are ignored.
 */
public class JacksonUpdateParser implements UpdateParser {

    private final ObjectMapper objectMapper;

    public JacksonUpdateParser() {
        this(BotJson.mapper());
    }

    public JacksonUpdateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Update parse(JsonNode record) {
        if (record == null || !record.isObject()) {
            throw new MalformedUpdateException(-1, "update record is not a JSON object");
        }
        long updateId = resolveUpdateId(record);
        if (updateId < 0) {
            throw new MalformedUpdateException(-1, "update record has no numeric update_id");
        }

        List<UpdateKind> present = new ArrayList<>(1);
        for (UpdateKind kind : UpdateKind.values()) {
            JsonNode field = record.get(kind.wireName());
            if (field != null && !field.isNull()) {
                present.add(kind);
            }
        }
        if (present.isEmpty()) {
            throw new MalformedUpdateException(updateId, "update " + updateId + " carries no known payload");
        }
        if (present.size() > 1) {
            throw new MalformedUpdateException(updateId, "update " + updateId + " carries "
                    + present.size() + " payloads: " + present);
        }

        UpdateKind kind = present.get(0);
        JsonNode payloadNode = record.get(kind.wireName());
        if (!payloadNode.isObject()) {
            throw new MalformedUpdateException(updateId, "update " + updateId + ": "
                    + kind.wireName() + " is not an object");
        }
        try {
            Object payload = objectMapper.treeToValue(payloadNode, kind.payloadType());
            return Update.of(updateId, kind, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedUpdateException(updateId, "update " + updateId + ": cannot bind "
                    + kind.wireName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a raw JSON document (webhook body).
     */
    public Update parse(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedUpdateException(-1, "update body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(node);
    }

    /**
     * @return the update id, or -1 when absent or not an integral number
     */
    public static long resolveUpdateId(JsonNode record) {
        if (record == null)
            return -1;
        JsonNode id = record.get("update_id");
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber())
            return -1;
        return id.asLong();
    }
}

package com.tradejournal.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;

/**
 * JSON text stored alongside trades. A trade keeps its contributing fill ids as a compact
 * JSON array in the {@code fill_ids} column, e.g. {@code [101,102,105]}.
 */
public final class JsonHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private JsonHelper() {}

    /** Fill ids in the given order as a JSON array. An empty list renders as {@code []}. */
    public static String fillIdsToJson(List<Long> fillIds) {
        try {
            return OBJECT_MAPPER.writeValueAsString(fillIds);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render fill ids " + fillIds, e);
        }
    }
}

package com.eventmirror.server;

import com.eventmirror.core.model.EventRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of {@link EventRecord}s on the collector's query endpoint.
 *
 * <pre>
 * {"sequence":1,"name":"view_item","receivedAt":"2026-01-01T10:00:00.123Z",
 *  "sourceBatchId":1,"payload":{...}}
 * </pre>
 *
 * @since 1.0.0
 */
public final class EventJson {

    private static final ObjectMapper MAPPER = newObjectMapper();

    private EventJson() {
        // utility class, not instantiable
    }

    /**
     * @return the shared mapper; configured with {@link JavaTimeModule} and
     *         ISO-8601 dates
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toJson(EventRecord record) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("sequence", record.getSequence());
        node.put("name", record.getName());
        node.set("receivedAt", MAPPER.valueToTree(record.getReceivedAt()));
        node.put("sourceBatchId", record.getSourceBatchId());
        node.set("payload", record.getPayload());
        return node;
    }

    public static ArrayNode toJson(List<EventRecord> records) {
        ArrayNode array = MAPPER.createArrayNode();
        records.forEach(record -> array.add(toJson(record)));
        return array;
    }

    /**
     * Rebuild a record from its wire form.
     *
     * @param node object produced by {@link #toJson(EventRecord)}
     * @return the decoded record
     * @throws IllegalArgumentException if a required field is missing or
     *                                  malformed
     */
    public static EventRecord fromJson(JsonNode node) {
        if (node == null || !node.isObject() || !node.hasNonNull("name") || !node.hasNonNull("receivedAt")) {
            throw new IllegalArgumentException("Not an event record: " + node);
        }
        try {
            return EventRecord.builder()
                    .sequence(node.path("sequence").asLong())
                    .name(node.get("name").asText())
                    .receivedAt(MAPPER.treeToValue(node.get("receivedAt"), Instant.class))
                    .sourceBatchId(node.path("sourceBatchId").asLong())
                    .payload(node.get("payload"))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed receivedAt in event record: " + node, e);
        }
    }

    public static List<EventRecord> fromJsonArray(JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of event records, got: " + array);
        }
        List<EventRecord> records = new ArrayList<>(array.size());
        array.forEach(node -> records.add(fromJson(node)));
        return records;
    }

    private static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        return mapper;
    }
}

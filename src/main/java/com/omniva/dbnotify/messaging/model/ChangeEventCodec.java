package com.omniva.dbnotify.messaging.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniva.dbnotify.engine.fault.ChangeEventDecodeException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes notification payloads into {@link ChangeEvent}.
 * <p>
 * All five fields are required and type checked; {@code timestamp} must be an
 * integral JSON number, the other fields JSON strings. Anything else is a
 * decode failure and is reported as {@link ChangeEventDecodeException}.
 * {@code table} must be non-empty and not {@code *}.
 */
@RequiredArgsConstructor
public class ChangeEventCodec {
    private static final Logger log = LoggerFactory.getLogger(ChangeEventCodec.class);

    static final String FIELD_TABLE = "table";
    static final String FIELD_SCHEMA = "schema";
    static final String FIELD_OPERATION = "operation";
    static final String FIELD_ID = "id";
    static final String FIELD_TIMESTAMP = "timestamp";

    // reserved for the every-table subscription key
    private static final String WILDCARD_TABLE = "*";

    private final ObjectMapper objectMapper;

    public ChangeEvent decode(String payload) {
        if (payload == null || payload.isEmpty()) {
            throw new ChangeEventDecodeException(String.valueOf(payload), "empty payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable notification payload: {}", e.getOriginalMessage());
            throw new ChangeEventDecodeException(payload, "malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ChangeEventDecodeException(payload, "payload is not a JSON object");
        }

        String table = getRequiredString(root, FIELD_TABLE, payload);
        if (table.isEmpty() || WILDCARD_TABLE.equals(table)) {
            throw new ChangeEventDecodeException(payload, "invalid table name '" + table + "'");
        }
        String schema = getRequiredString(root, FIELD_SCHEMA, payload);
        String operationValue = getRequiredString(root, FIELD_OPERATION, payload);
        String id = getRequiredString(root, FIELD_ID, payload);
        long timestamp = getRequiredEpochSeconds(root, payload);

        ChangeOperation operation = ChangeOperation.fromWire(operationValue);
        if (operation == null) {
            throw new ChangeEventDecodeException(payload, "unknown operation '" + operationValue + "'");
        }

        return ChangeEvent.builder()
                .table(table)
                .schema(schema)
                .operation(operation)
                .id(id)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Encode an event back to its wire form (used by tests and tooling)
     */
    public String encode(ChangeEvent event) {
        try {
            return objectMapper.writeValueAsString(objectMapper.createObjectNode()
                    .put(FIELD_TABLE, event.getTable())
                    .put(FIELD_SCHEMA, event.getSchema())
                    .put(FIELD_OPERATION, event.getOperation().name())
                    .put(FIELD_ID, event.getId())
                    .put(FIELD_TIMESTAMP, event.getTimestamp()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode change event " + event, e);
        }
    }

    // PRIVATE HELPER METHODS

    private String getRequiredString(JsonNode root, String fieldName, String payload) {
        JsonNode fieldNode = root.get(fieldName);
        if (fieldNode == null || fieldNode.isNull()) {
            throw new ChangeEventDecodeException(payload, fieldName + " is missing");
        }
        if (!fieldNode.isTextual()) {
            throw new ChangeEventDecodeException(payload, fieldName + " must be a string");
        }
        return fieldNode.textValue();
    }

    private long getRequiredEpochSeconds(JsonNode root, String payload) {
        JsonNode fieldNode = root.get(FIELD_TIMESTAMP);
        if (fieldNode == null || fieldNode.isNull()) {
            throw new ChangeEventDecodeException(payload, FIELD_TIMESTAMP + " is missing");
        }
        if (!fieldNode.isIntegralNumber() || !fieldNode.canConvertToLong()) {
            throw new ChangeEventDecodeException(payload, FIELD_TIMESTAMP + " must be an integer");
        }
        return fieldNode.longValue();
    }
}

package com.omniva.dbnotify.messaging.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A single row change on the notification channel.
 * <p>
 * Wire JSON:
 * {
 * "table": "User",
 * "schema": "public",
 * "operation": "UPDATE",
 * "id": "cm3abc123",
 * "timestamp": 1739936400
 * }
 */
@Value
@Builder
public class ChangeEvent {
    @NonNull String table;
    @NonNull String schema;
    @NonNull ChangeOperation operation;
    /** Primary key of the affected row */
    @NonNull String id;
    /** Epoch seconds */
    long timestamp;

    public Instant getOccurredAt() {
        return Instant.ofEpochSecond(timestamp);
    }

    public boolean isTable(String tableName) {
        return table.equals(tableName);
    }
}

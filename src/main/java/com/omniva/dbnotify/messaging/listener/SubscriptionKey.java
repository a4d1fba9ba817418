package com.omniva.dbnotify.messaging.listener;

import com.omniva.dbnotify.messaging.model.ChangeEvent;
import com.omniva.dbnotify.messaging.model.ChangeOperation;

import java.util.List;
import java.util.Objects;

/**
 * Registry key at one of three granularities:
 * <ul>
 *     <li>{@code *} - every event</li>
 *     <li>{@code <table>} - every operation on one table</li>
 *     <li>{@code <table>:<OPERATION>} - one operation on one table</li>
 * </ul>
 * {@code table} and {@code operation} are null where the granularity does not use them.
 */
public record SubscriptionKey(String table, ChangeOperation operation) {

    public static final String ALL = "*";

    private static final SubscriptionKey ALL_KEY = new SubscriptionKey(null, null);

    public SubscriptionKey {
        if (table == null && operation != null) {
            throw new IllegalArgumentException("An operation key requires a table");
        }
        if (table != null && (table.isEmpty() || ALL.equals(table))) {
            throw new IllegalArgumentException("Invalid table name: '" + table + "'");
        }
    }

    public static SubscriptionKey all() {
        return ALL_KEY;
    }

    public static SubscriptionKey table(String table) {
        return new SubscriptionKey(Objects.requireNonNull(table, "table"), null);
    }

    public static SubscriptionKey operation(String table, ChangeOperation operation) {
        return new SubscriptionKey(Objects.requireNonNull(table, "table"),
                Objects.requireNonNull(operation, "operation"));
    }

    /**
     * The three keys an event is dispatched under, in dispatch order
     */
    public static List<SubscriptionKey> forEvent(ChangeEvent event) {
        return List.of(all(), table(event.getTable()), operation(event.getTable(), event.getOperation()));
    }

    public boolean isAll() {
        return table == null;
    }

    /**
     * String discriminator: {@code *}, {@code User} or {@code User:DELETE}
     */
    public String value() {
        if (table == null) {
            return ALL;
        }
        return operation == null ? table : table + ":" + operation.name();
    }

    @Override
    public String toString() {
        return value();
    }
}

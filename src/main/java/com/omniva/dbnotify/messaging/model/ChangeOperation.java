package com.omniva.dbnotify.messaging.model;

/**
 * Row-level operation reported by the change trigger.
 */
public enum ChangeOperation {
    INSERT, UPDATE, DELETE;

    /**
     * Strict lookup: the wire value must match the constant name exactly.
     *
     * @return the operation, or null when the value is unknown
     */
    public static ChangeOperation fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (ChangeOperation operation : values()) {
            if (operation.name().equals(value)) {
                return operation;
            }
        }
        return null;
    }
}

package com.omniva.dbnotify.engine.fault;

import lombok.Getter;

/**
 * Exception thrown when a notification payload is not a valid change event.
 * The payload is dropped, it is never retried.
 */
@Getter
public class ChangeEventDecodeException extends DbNotifyRuntimeException {
    private final String payload;

    public ChangeEventDecodeException(String payload, String reason) {
        super(String.format("Invalid table change payload (%s): %s", reason, payload));
        this.payload = payload;
    }

    public ChangeEventDecodeException(String payload, String reason, Throwable cause) {
        super(String.format("Invalid table change payload (%s): %s", reason, payload), cause);
        this.payload = payload;
    }
}

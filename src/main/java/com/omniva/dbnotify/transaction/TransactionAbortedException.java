package com.omniva.dbnotify.transaction;

import com.omniva.dbnotify.engine.fault.DbNotifyRuntimeException;

/**
 * The transaction was rolled back because its {@link CancellationSignal} fired,
 * not because of a business failure.
 */
public class TransactionAbortedException extends DbNotifyRuntimeException {

    private static final String DEFAULT_MESSAGE = "Transaction aborted";

    private final String reason;

    public TransactionAbortedException(String reason) {
        super(reason != null ? reason : DEFAULT_MESSAGE);
        this.reason = reason;
    }

    public TransactionAbortedException(String reason, Throwable cause) {
        super(reason != null ? reason : DEFAULT_MESSAGE, cause);
        this.reason = reason;
    }

    /**
     * @return the signal's reason, or null when it was aborted without one
     */
    public String getReason() {
        return reason;
    }
}

package com.omniva.dbnotify.transaction;

/**
 * Pooled side of a {@link DbClient}: can open a transaction.
 * Commits when the callback returns normally, rolls back when it throws.
 */
public interface TransactionalEngine extends DbClient {

    <T> T inTransaction(TransactionCallback<T> callback) throws Exception;
}

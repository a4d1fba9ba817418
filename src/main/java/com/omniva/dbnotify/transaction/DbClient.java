package com.omniva.dbnotify.transaction;

/**
 * A database handle accepted by {@link ActorTransactions}.
 * <p>
 * Exactly two kinds exist: a {@link TransactionalEngine} that can begin a
 * transaction, and a {@link TransactionHandle} that is already inside one.
 * Nesting is decided on that distinction alone.
 */
public interface DbClient {
}

package com.omniva.dbnotify.transaction;

import com.omniva.dbnotify.engine.crankshaft.DbNotifyThreadFactory;
import com.omniva.dbnotify.engine.fault.DbNotifyRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Actor-tracked, cancellable transactions.
 * <p>
 * {@code withActor} opens a transaction, stamps the actor id into a
 * transaction-local setting that audit triggers read, and runs the callback.
 * Passing a {@link TransactionHandle} instead of an engine reuses the
 * surrounding transaction, so calls nest:
 * <pre>
 * transactions.withActor(engine, "user-7", tx -&gt;
 *         transactions.withActor(tx, "user-7", inner -&gt; inner.update(...)));   // one transaction
 * </pre>
 * With a {@link CancellationSignal} the callback runs on a transaction worker
 * thread and loses to the signal if it fires first. The in-flight statement is
 * cancelled, the caller waits for the callback thread to let go of the
 * connection, and the transaction rolls back on the caller thread, whether or
 * not the callback itself checks the signal.
 */
public class ActorTransactions implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActorTransactions.class);

    public static final String DEFAULT_ACTOR_SETTING = "app.current_user_id";

    // is_local = true: the setting is discarded at commit or rollback
    static final String SET_ACTOR_SQL = "SELECT set_config(?, ?, true)";

    static final Duration DEFAULT_WORKER_SETTLE_TIMEOUT = Duration.ofSeconds(30);

    private final String actorSettingName;
    private final ExecutorService transactionExecutor;
    private final Duration workerSettleTimeout;

    public ActorTransactions() {
        this(DEFAULT_ACTOR_SETTING);
    }

    public ActorTransactions(String actorSettingName) {
        this(actorSettingName, Executors.newCachedThreadPool(new DbNotifyThreadFactory("DbNotify-tx", true)));
    }

    public ActorTransactions(String actorSettingName, ExecutorService transactionExecutor) {
        this(actorSettingName, transactionExecutor, DEFAULT_WORKER_SETTLE_TIMEOUT);
    }

    /**
     * @param workerSettleTimeout how long an abort waits for the callback thread to leave
     *                            the connection before rolling back
     */
    public ActorTransactions(String actorSettingName, ExecutorService transactionExecutor,
                             Duration workerSettleTimeout) {
        if (actorSettingName == null || actorSettingName.isBlank()) {
            throw new IllegalArgumentException("Actor setting name cannot be null or empty");
        }
        this.actorSettingName = actorSettingName;
        this.transactionExecutor = Objects.requireNonNull(transactionExecutor, "transactionExecutor");
        this.workerSettleTimeout = Objects.requireNonNull(workerSettleTimeout, "workerSettleTimeout");
    }

    public <T> T withActor(DbClient client, String actorId, TransactionCallback<T> fn) throws Exception {
        return withActor(client, actorId, fn, null);
    }

    /**
     * Run {@code fn} inside a transaction attributed to {@code actorId}.
     *
     * @param actorId null skips the actor statement; triggers fall back to their own default
     * @param signal  optional; null runs {@code fn} on the calling thread without racing
     * @throws TransactionAbortedException when the signal fired first
     * @throws Exception                   whatever {@code fn} threw, after rollback
     */
    public <T> T withActor(DbClient client, String actorId, TransactionCallback<T> fn,
                           CancellationSignal signal) throws Exception {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(fn, "fn");

        if (client instanceof TransactionHandle) {
            // nested: the outer transaction already carries the actor
            return invoke((TransactionHandle) client, fn, signal);
        }
        if (client instanceof TransactionalEngine) {
            return runInTransaction((TransactionalEngine) client, actorId, fn, signal);
        }
        throw new IllegalArgumentException("Unsupported DbClient type: " + client.getClass().getName());
    }

    /**
     * Cancellable transaction without actor attribution. Always opens a new
     * transaction, so {@code client} must be able to begin one.
     */
    public <T> T abortable(DbClient client, CancellationSignal signal, TransactionCallback<T> fn) throws Exception {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(fn, "fn");

        if (!(client instanceof TransactionalEngine)) {
            throw new IllegalArgumentException(
                    "abortable requires a TransactionalEngine, got " + client.getClass().getName());
        }
        return runInTransaction((TransactionalEngine) client, null, fn, signal);
    }

    private <T> T runInTransaction(TransactionalEngine engine, String actorId, TransactionCallback<T> fn,
                                   CancellationSignal signal) throws Exception {
        throwIfAborted(signal);

        return engine.inTransaction(tx -> {
            throwIfAborted(signal);
            if (actorId != null) {
                tx.execute(SET_ACTOR_SQL, actorSettingName, actorId);
                // may have fired during the round-trip
                throwIfAborted(signal);
            }
            return invoke(tx, fn, signal);
        });
    }

    private <T> T invoke(TransactionHandle tx, TransactionCallback<T> fn, CancellationSignal signal) throws Exception {
        if (signal == null) {
            return fn.doInTransaction(tx);
        }
        throwIfAborted(signal);

        CompletableFuture<T> operation = new CompletableFuture<>();
        // set by whichever side gets there first: the worker starting fn, or the caller giving up on it
        AtomicBoolean claimed = new AtomicBoolean(false);
        Future<?> task;
        try {
            task = transactionExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return;
                }
                try {
                    operation.complete(fn.doInTransaction(tx));
                } catch (Throwable t) {
                    operation.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Transaction executor is shut down", e);
        }

        try {
            return AbortRace.race(operation, signal).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransactionAbortedException) {
                stopWorker(task, tx, claimed, operation);
                log.info("Transaction aborted: {}", cause.getMessage());
            }
            throw asException(cause);
        } catch (InterruptedException e) {
            stopWorker(task, tx, claimed, operation);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * Cancel the callback and wait until it no longer uses the connection,
     * so the rollback that follows cannot interleave with its statements.
     */
    private void stopWorker(Future<?> task, TransactionHandle tx, AtomicBoolean claimed,
                            CompletableFuture<?> operation) {
        tx.abortInFlight();
        if (claimed.compareAndSet(false, true)) {
            // fn never started
            task.cancel(false);
            return;
        }
        task.cancel(true);

        boolean interrupted = Thread.interrupted();
        long deadline = System.nanoTime() + workerSettleTimeout.toNanos();
        CompletableFuture<?> settled = operation.handle((value, error) -> null);
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Aborted transaction callback still running after {}ms - rolling back anyway",
                        workerSettleTimeout.toMillis());
                break;
            }
            try {
                settled.get(remaining, TimeUnit.NANOSECONDS);
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            } catch (TimeoutException e) {
                // deadline reached, reported on the next pass
            } catch (ExecutionException e) {
                break;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void throwIfAborted(CancellationSignal signal) {
        if (signal != null && signal.isAborted()) {
            throw new TransactionAbortedException(signal.getReasonText());
        }
    }

    private static Exception asException(Throwable cause) {
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new DbNotifyRuntimeException("Transaction callback failed", cause);
    }

    public String getActorSettingName() {
        return actorSettingName;
    }

    @Override
    public void close() {
        transactionExecutor.shutdownNow();
    }
}

package com.omniva.dbnotify.transaction;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Races a future against a {@link CancellationSignal}.
 * <p>
 * Whichever settles first decides the outcome. The abort listener is detached
 * on every path so repeated races on one signal do not accumulate listeners.
 */
public final class AbortRace {

    private AbortRace() {
    }

    public static <T> CompletableFuture<T> race(CompletableFuture<T> operation, CancellationSignal signal) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(signal, "signal");

        if (signal.isAborted()) {
            return CompletableFuture.failedFuture(new TransactionAbortedException(signal.getReasonText()));
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable onAbort = () -> result.completeExceptionally(
                new TransactionAbortedException(signal.getReasonText()));

        if (!signal.addAbortListener(onAbort)) {
            // fired between the check and the registration
            onAbort.run();
            return result;
        }
        result.whenComplete((value, error) -> signal.removeAbortListener(onAbort));

        operation.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}

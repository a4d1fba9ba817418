package com.omniva.dbnotify.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag with listeners.
 * <p>
 * {@link #abort(Object)} records the reason and runs every registered listener
 * exactly once, outside the signal's lock. Later calls are ignored.
 */
public class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean aborted;
    private Object reason;

    /**
     * A signal that is already fired.
     */
    public static CancellationSignal aborted(Object reason) {
        CancellationSignal signal = new CancellationSignal();
        signal.abort(reason);
        return signal;
    }

    public void abort() {
        abort(null);
    }

    public void abort(Object reason) {
        List<Runnable> toNotify;
        synchronized (lock) {
            if (aborted) {
                return;
            }
            aborted = true;
            this.reason = reason;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }

        for (Runnable listener : toNotify) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Abort listener failed: {}", e.getMessage());
            }
        }
    }

    /**
     * Fire this signal after {@code delay} on the given scheduler.
     */
    public ScheduledFuture<?> abortAfter(Duration delay, ScheduledExecutorService scheduler) {
        return scheduler.schedule(
                () -> abort("Timed out after " + delay.toMillis() + "ms"),
                delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isAborted() {
        synchronized (lock) {
            return aborted;
        }
    }

    public Object getReason() {
        synchronized (lock) {
            return reason;
        }
    }

    /**
     * Strings verbatim, throwables by message, anything else via {@code String.valueOf}.
     * Null when no reason was given.
     */
    public String getReasonText() {
        Object current = getReason();
        if (current == null) {
            return null;
        }
        if (current instanceof String) {
            return (String) current;
        }
        if (current instanceof Throwable) {
            return ((Throwable) current).getMessage();
        }
        return String.valueOf(current);
    }

    /**
     * @return false if the signal already fired; the listener is then not registered
     */
    public boolean addAbortListener(Runnable listener) {
        synchronized (lock) {
            if (aborted) {
                return false;
            }
            listeners.add(listener);
            return true;
        }
    }

    public boolean removeAbortListener(Runnable listener) {
        synchronized (lock) {
            return listeners.removeIf(registered -> registered == listener);
        }
    }

    public int getListenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return aborted ? "CancellationSignal[aborted: " + reason + "]" : "CancellationSignal[active]";
        }
    }
}

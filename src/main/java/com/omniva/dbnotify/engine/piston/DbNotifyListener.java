package com.omniva.dbnotify.engine.piston;

import com.omniva.dbnotify.config.DbNotifyConfig;
import com.omniva.dbnotify.engine.crankshaft.DbNotifyThreadFactory;
import com.omniva.dbnotify.engine.fault.ChangeEventDecodeException;
import com.omniva.dbnotify.engine.fault.ChangeHandlerException;
import com.omniva.dbnotify.engine.fault.ErrorTracker;
import com.omniva.dbnotify.engine.fault.ListenerConnectionException;
import com.omniva.dbnotify.engine.fault.ReconnectExhaustedException;
import com.omniva.dbnotify.engine.fuelsystem.DbNotifyConnectionManager;
import com.omniva.dbnotify.engine.fuelsystem.NotificationConnection;
import com.omniva.dbnotify.engine.fuelsystem.NotificationConnectionFactory;
import com.omniva.dbnotify.engine.sensors.ListenerSensor;
import com.omniva.dbnotify.engine.sensors.ListenerSensorProbe;
import com.omniva.dbnotify.engine.valvetrain.ListenerState;
import com.omniva.dbnotify.engine.valvetrain.ReconnectBackoff;
import com.omniva.dbnotify.engine.valvetrain.ReconnectOptions;
import com.omniva.dbnotify.messaging.listener.ChangeHandler;
import com.omniva.dbnotify.messaging.listener.ErrorHandler;
import com.omniva.dbnotify.messaging.listener.Subscription;
import com.omniva.dbnotify.messaging.listener.SubscriptionKey;
import com.omniva.dbnotify.messaging.listener.SubscriptionRegistry;
import com.omniva.dbnotify.messaging.model.ChangeEvent;
import com.omniva.dbnotify.messaging.model.ChangeEventCodec;
import com.omniva.dbnotify.messaging.model.ChangeOperation;
import com.omniva.dbnotify.messaging.model.ChannelNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Change Listener - The Engine Piston
 * <p>
 * Holds one dedicated connection subscribed to the change channel and fans
 * decoded {@link ChangeEvent}s out to handlers registered at three
 * granularities:
 * <pre>
 * listener.onChange(handler);                                  // every change
 * listener.onTable("User", handler);                           // one table
 * listener.onOperation("User", ChangeOperation.DELETE, handler); // one operation on one table
 * </pre>
 * A dropped connection is re-established in the background with exponential
 * backoff and full jitter. Subscriptions survive reconnection, callers never
 * re-subscribe.
 * <p>
 * Threads:
 * - one poll thread per connection (DbNotify-listener-N), replaced on reconnect
 * - one reconnect timer thread (DbNotify-reconnect-0), at most one pending attempt
 * - a handler pool (DbNotify-handler-N); handlers never run on the poll thread
 * <p>
 * {@code lock} guards the connection state and both handler registries.
 * {@code lifecycleLock} serializes connect, reconnect attempts and disconnect.
 */
public class DbNotifyListener implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DbNotifyListener.class);

    private static final long HANDLER_SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final String channel;
    private final NotificationConnectionFactory connectionFactory;
    private final ChangeEventCodec codec;
    private final ErrorTracker errorTracker;
    private final ReconnectOptions reconnectOptions;
    private final ReconnectBackoff backoff;
    private final int pollTimeoutMs;

    private final ScheduledExecutorService reconnectScheduler;
    private final ExecutorService handlerExecutor;
    private final ThreadFactory pollThreadFactory;
    private final ListenerSensorProbe sensorProbe;

    private final Object lock = new Object();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    // guarded by lock
    private final ListenerState state = new ListenerState();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final Set<ErrorHandler> errorHandlers = Collections.newSetFromMap(new IdentityHashMap<>());
    private long registryGeneration = 0;
    private NotificationConnection connection;
    private ScheduledFuture<?> reconnectTimer;

    public DbNotifyListener(DbNotifyConfig config,
                            NotificationConnectionFactory connectionFactory,
                            ChangeEventCodec codec,
                            ErrorTracker errorTracker) {
        this(config.getChannel(),
                connectionFactory,
                codec,
                errorTracker,
                config.getReconnectOptions(),
                new ReconnectBackoff(config.getReconnectOptions()),
                config.getPollTimeoutMs(),
                config.getHandlerThreads());
    }

    public DbNotifyListener(String channel,
                            NotificationConnectionFactory connectionFactory,
                            ChangeEventCodec codec,
                            ErrorTracker errorTracker,
                            ReconnectOptions reconnectOptions,
                            ReconnectBackoff backoff,
                            int pollTimeoutMs,
                            int handlerThreads) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("Channel cannot be null or empty");
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("pollTimeoutMs must be positive: " + pollTimeoutMs);
        }
        if (handlerThreads <= 0) {
            throw new IllegalArgumentException("handlerThreads must be positive: " + handlerThreads);
        }

        this.channel = channel;
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.errorTracker = Objects.requireNonNull(errorTracker, "errorTracker");
        this.reconnectOptions = Objects.requireNonNull(reconnectOptions, "reconnectOptions");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.pollTimeoutMs = pollTimeoutMs;

        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(
                new DbNotifyThreadFactory("DbNotify-reconnect", true));
        this.handlerExecutor = Executors.newFixedThreadPool(handlerThreads,
                new DbNotifyThreadFactory("DbNotify-handler", true));
        this.pollThreadFactory = new DbNotifyThreadFactory("DbNotify-listener", false);
        this.sensorProbe = new ListenerSensorProbe(channel);
    }

    // ===== CONNECTION LIFECYCLE =====

    /**
     * Open the dedicated connection and LISTEN on the channel.
     * No-op when already connected. Connection errors propagate to the caller.
     */
    public void connect() throws SQLException {
        lifecycleLock.lock();
        try {
            synchronized (lock) {
                if (state.isConnected()) {
                    return;
                }
                state.clearIntentionalDisconnect();
            }

            NotificationConnection fresh = connectionFactory.open();
            try {
                fresh.listen(channel);
            } catch (SQLException | RuntimeException e) {
                DbNotifyConnectionManager.safeClose(fresh);
                throw e;
            }

            NotificationConnection stale;
            synchronized (lock) {
                cancelPendingReconnect();
                stale = connection;
                connection = fresh;
                state.markConnected();
            }
            DbNotifyConnectionManager.safeClose(stale);

            sensorProbe.recordConnected();
            startPolling(fresh);
            log.info("Listener connected - watching channel '{}'", channel);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Connect, or report the failure through the error channel and keep
     * retrying in the background.
     *
     * @return true if connected on this call
     */
    public boolean connectOrRetry() {
        try {
            connect();
            return true;
        } catch (SQLException | RuntimeException e) {
            log.error("Initial listener connection to channel '{}' failed: {}", channel, e.getMessage());
            sensorProbe.recordConnectionError();
            dispatchError(new ListenerConnectionException(
                    "Initial connection to channel '" + channel + "' failed: " + e.getMessage(), e));
            scheduleReconnect();
            return false;
        }
    }

    /**
     * UNLISTEN, close the connection, cancel any pending reconnect and drop
     * every change and error subscription. Teardown errors are ignored.
     */
    public void disconnect() {
        synchronized (lock) {
            state.beginIntentionalDisconnect();
            cancelPendingReconnect();
        }

        lifecycleLock.lock();
        try {
            NotificationConnection current;
            synchronized (lock) {
                current = connection;
                connection = null;
            }

            if (current != null) {
                DbNotifyConnectionManager.safeUnlisten(current, channel);
                DbNotifyConnectionManager.safeClose(current);
            }

            synchronized (lock) {
                state.markDisconnected();
                registry.clear();
                errorHandlers.clear();
                registryGeneration++;
            }
            log.info("Listener disconnected from channel '{}'", channel);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Disconnect and release the listener's threads. The instance cannot be reused.
     */
    @Override
    public void close() {
        disconnect();
        reconnectScheduler.shutdownNow();
        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(HANDLER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Change handlers still running after {}s - interrupting", HANDLER_SHUTDOWN_TIMEOUT_SECONDS);
                handlerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ===== SUBSCRIPTIONS =====

    /** Every change event. */
    public Subscription onChange(ChangeHandler handler) {
        return subscribe(SubscriptionKey.all(), handler);
    }

    /** Every change on one table. */
    public Subscription onTable(String table, ChangeHandler handler) {
        return subscribe(SubscriptionKey.table(table), handler);
    }

    /** One operation on one table. */
    public Subscription onOperation(String table, ChangeOperation operation, ChangeHandler handler) {
        return subscribe(SubscriptionKey.operation(table, operation), handler);
    }

    public Subscription subscribe(SubscriptionKey key, ChangeHandler handler) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(handler, "handler");

        long generation;
        synchronized (lock) {
            registry.add(key, handler);
            generation = registryGeneration;
        }

        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                synchronized (lock) {
                    if (generation == registryGeneration) {
                        registry.remove(key, handler);
                    }
                }
            }
        };
    }

    /**
     * Decode failures, connection errors, reconnection exhaustion and handler failures.
     */
    public Subscription onError(ErrorHandler handler) {
        Objects.requireNonNull(handler, "handler");

        long generation;
        synchronized (lock) {
            errorHandlers.add(handler);
            generation = registryGeneration;
        }

        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                synchronized (lock) {
                    if (generation == registryGeneration) {
                        errorHandlers.remove(handler);
                    }
                }
            }
        };
    }

    // ===== POLLING =====

    private void startPolling(NotificationConnection pollConnection) {
        Thread pollThread = pollThreadFactory.newThread(() -> pollLoop(pollConnection));
        pollThread.start();
    }

    private void pollLoop(NotificationConnection pollConnection) {
        log.debug("Poll loop started on {}", Thread.currentThread().getName());
        try {
            while (isCurrent(pollConnection) && !Thread.currentThread().isInterrupted()) {
                List<ChannelNotification> notifications = pollConnection.poll(pollTimeoutMs);
                for (ChannelNotification notification : notifications) {
                    try {
                        handleNotification(notification);
                    } catch (RuntimeException e) {
                        // a bad notification never costs the connection
                        sensorProbe.recordDecodeFailure();
                        log.error("Failed to process notification on channel '{}': {}", channel, e.getMessage(), e);
                        dispatchError(new ChangeEventDecodeException(String.valueOf(notification.payload()),
                                e.getMessage(), e));
                    }
                }
                if (notifications.isEmpty() && pollConnection.isClosed()) {
                    onConnectionEnd(pollConnection);
                    return;
                }
            }
        } catch (SQLException | RuntimeException e) {
            onConnectionError(pollConnection, e);
        }
        log.debug("Poll loop finished on {}", Thread.currentThread().getName());
    }

    private boolean isCurrent(NotificationConnection candidate) {
        synchronized (lock) {
            return connection == candidate && !state.isIntentionalDisconnect();
        }
    }

    private void handleNotification(ChannelNotification notification) {
        // other channels and empty keepalives share the connection
        if (!channel.equals(notification.channel()) || !notification.hasPayload()) {
            return;
        }
        sensorProbe.recordNotification();

        ChangeEvent event;
        try {
            event = codec.decode(notification.payload());
        } catch (ChangeEventDecodeException e) {
            sensorProbe.recordDecodeFailure();
            log.error("Dropping notification on channel '{}': {}", channel, e.getMessage());
            dispatchError(e);
            return;
        }

        sensorProbe.recordEventDispatched();
        for (SubscriptionKey key : SubscriptionKey.forEvent(event)) {
            dispatchChange(key, event);
        }
    }

    // ===== DISPATCH =====

    private void dispatchChange(SubscriptionKey key, ChangeEvent event) {
        List<ChangeHandler> handlers;
        synchronized (lock) {
            handlers = registry.handlersFor(key);
        }

        for (ChangeHandler handler : handlers) {
            try {
                handlerExecutor.execute(() -> invokeHandler(key, handler, event));
            } catch (RejectedExecutionException e) {
                log.warn("Handler pool rejected {} for '{}' - listener is shutting down", handler.getHandlerName(), key);
            }
        }
    }

    private void invokeHandler(SubscriptionKey key, ChangeHandler handler, ChangeEvent event) {
        try {
            handler.onChange(event);
        } catch (Throwable e) {
            sensorProbe.recordHandlerFailure();
            log.error("Change handler {} failed for '{}' (id {}): {}",
                    handler.getHandlerName(), key, event.getId(), e.getMessage(), e);
            dispatchError(new ChangeHandlerException(key, event, e));
        }
    }

    private void dispatchError(Throwable error) {
        errorTracker.addError("Listener error on channel '" + channel + "'", error);

        List<ErrorHandler> handlers;
        synchronized (lock) {
            handlers = List.copyOf(errorHandlers);
        }

        for (ErrorHandler handler : handlers) {
            try {
                handler.onError(error);
            } catch (Throwable e) {
                // an error handler must never take the listener down
                log.debug("Error handler {} threw: {}", handler.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    // ===== RECONNECTION =====

    private void onConnectionError(NotificationConnection failed, Exception cause) {
        synchronized (lock) {
            if (connection != failed || state.isIntentionalDisconnect()) {
                log.debug("Ignoring error from a retired connection: {}", cause.getMessage());
                return;
            }
            state.markConnectionLost();
        }

        sensorProbe.recordConnectionError();
        log.warn("Notification connection error on channel '{}': {}", channel, cause.getMessage());
        dispatchError(new ListenerConnectionException(
                "Notification connection error on channel '" + channel + "': " + cause.getMessage(), cause));
        scheduleReconnect();
    }

    private void onConnectionEnd(NotificationConnection ended) {
        synchronized (lock) {
            if (connection != ended || state.isIntentionalDisconnect()) {
                return;
            }
            state.markConnectionLost();
        }

        log.warn("Notification connection on channel '{}' closed unexpectedly", channel);
        scheduleReconnect();
    }

    /**
     * Schedule one attempt with full-jitter backoff. Ignored while an attempt
     * is pending, after an intentional disconnect, or when reconnection is disabled.
     */
    private void scheduleReconnect() {
        int exhaustedAfter = -1;
        int attempt = 0;
        long delay = 0;

        synchronized (lock) {
            if (!reconnectOptions.enabled() || state.isIntentionalDisconnect() || state.isReconnecting()) {
                return;
            }

            if (reconnectOptions.isExhausted(state.getReconnectAttempt())) {
                state.markGivenUp();
                exhaustedAfter = state.getReconnectAttempt();
            } else {
                attempt = state.getReconnectAttempt();
                delay = backoff.delayFor(attempt);
                try {
                    reconnectTimer = reconnectScheduler.schedule(this::attemptReconnect, delay, TimeUnit.MILLISECONDS);
                    state.beginReconnecting();
                } catch (RejectedExecutionException e) {
                    log.warn("Reconnect scheduler is shut down - not reconnecting channel '{}'", channel);
                    return;
                }
            }
        }

        if (exhaustedAfter >= 0) {
            log.error("Listener on channel '{}' giving up after {} reconnection attempts", channel, exhaustedAfter);
            dispatchError(new ReconnectExhaustedException(exhaustedAfter));
            return;
        }

        log.info("Connection lost - reconnecting in {}ms (attempt {})", delay, attempt + 1);
    }

    private void attemptReconnect() {
        lifecycleLock.lock();
        try {
            int attempt;
            NotificationConnection stale;
            synchronized (lock) {
                reconnectTimer = null;
                if (state.isIntentionalDisconnect() || state.isConnected()) {
                    return;
                }
                attempt = state.recordAttempt();
                stale = connection;
                connection = null;
            }

            // stale poll thread sees it is no longer current and exits quietly
            DbNotifyConnectionManager.safeClose(stale);

            NotificationConnection fresh;
            try {
                fresh = connectionFactory.open();
            } catch (SQLException | RuntimeException e) {
                failAttempt("Reconnection attempt " + attempt + " failed: " + e.getMessage(), e);
                return;
            }

            try {
                fresh.listen(channel);
            } catch (SQLException | RuntimeException e) {
                DbNotifyConnectionManager.safeClose(fresh);
                failAttempt("LISTEN failed after reconnect: " + e.getMessage(), e);
                return;
            }

            boolean discard;
            synchronized (lock) {
                discard = state.isIntentionalDisconnect();
                if (!discard) {
                    connection = fresh;
                    state.markConnected();
                }
            }
            if (discard) {
                DbNotifyConnectionManager.safeClose(fresh);
                return;
            }

            sensorProbe.recordReconnected();
            startPolling(fresh);
            log.info("Listener reconnected to channel '{}' after {} attempt(s)", channel, attempt);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void failAttempt(String message, Exception cause) {
        log.warn(message);
        sensorProbe.recordConnectionError();
        dispatchError(new ListenerConnectionException(message, cause));
        synchronized (lock) {
            state.endReconnecting();
        }
        scheduleReconnect();
    }

    private void cancelPendingReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    // ===== OBSERVABLES =====

    public String getChannel() {
        return channel;
    }

    public boolean isConnected() {
        synchronized (lock) {
            return state.isConnected();
        }
    }

    public boolean isReconnecting() {
        synchronized (lock) {
            return state.isReconnecting();
        }
    }

    /**
     * Failed reconnection attempts since the last successful connection.
     * Health checks poll this to decide when an outage lasted too long.
     */
    public int getConsecutiveFailures() {
        synchronized (lock) {
            return state.getReconnectAttempt();
        }
    }

    public ListenerState.Phase getPhase() {
        synchronized (lock) {
            return state.getPhase();
        }
    }

    public int getSubscriptionCount() {
        synchronized (lock) {
            return registry.getHandlerCount();
        }
    }

    public ListenerSensor getSensor() {
        ListenerState.Phase phase;
        int failures;
        int subscriptions;
        synchronized (lock) {
            phase = state.getPhase();
            failures = state.getReconnectAttempt();
            subscriptions = registry.getHandlerCount();
        }

        return ListenerSensor.builder()
                .channel(channel)
                .phase(phase)
                .consecutiveFailures(failures)
                .subscriptionCount(subscriptions)
                .startTime(sensorProbe.getStartTime())
                .lastEventTime(sensorProbe.getLastEventTime())
                .uptime(sensorProbe.getUptime())
                .notificationsReceived(sensorProbe.getNotificationsReceived())
                .eventsDispatched(sensorProbe.getEventsDispatched())
                .decodeFailures(sensorProbe.getDecodeFailures())
                .handlerFailures(sensorProbe.getHandlerFailures())
                .connectionErrors(sensorProbe.getConnectionErrors())
                .reconnects(sensorProbe.getReconnects())
                .build();
    }

    @Override
    public String toString() {
        return String.format("DbNotifyListener[channel=%s, phase=%s, failures=%d]",
                channel, getPhase(), getConsecutiveFailures());
    }
}

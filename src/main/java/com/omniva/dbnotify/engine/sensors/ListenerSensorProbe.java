package com.omniva.dbnotify.engine.sensors;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Listener Sensor Probe
 * <p>
 * Counts what happens on the notification channel:
 * - notifications received and events dispatched
 * - decode and handler failures
 * - connection errors and successful reconnects
 * <p>
 * Written from the poll, reconnect and handler threads; read through {@link ListenerSensor} snapshots.
 */
public class ListenerSensorProbe {

    @Getter
    private final String channel;

    @Getter
    private volatile Instant startTime;
    @Getter
    private volatile Instant lastEventTime;
    @Getter
    private volatile Instant lastConnectedTime;

    private final AtomicLong notificationsReceived = new AtomicLong(0);
    private final AtomicLong eventsDispatched = new AtomicLong(0);
    private final AtomicLong decodeFailures = new AtomicLong(0);
    private final AtomicLong handlerFailures = new AtomicLong(0);
    private final AtomicLong connectionErrors = new AtomicLong(0);
    private final AtomicLong reconnects = new AtomicLong(0);

    public ListenerSensorProbe(String channel) {
        this.channel = channel;
    }

    // === Sensor Probe Events ===
    public void recordConnected() {
        Instant now = Instant.now();
        if (startTime == null) {
            startTime = now;
        }
        lastConnectedTime = now;
    }

    public void recordReconnected() {
        reconnects.incrementAndGet();
        recordConnected();
    }

    public void recordNotification() {
        notificationsReceived.incrementAndGet();
    }

    public void recordEventDispatched() {
        eventsDispatched.incrementAndGet();
        lastEventTime = Instant.now();
    }

    public void recordDecodeFailure() {
        decodeFailures.incrementAndGet();
    }

    public void recordHandlerFailure() {
        handlerFailures.incrementAndGet();
    }

    public void recordConnectionError() {
        connectionErrors.incrementAndGet();
    }

    // === Core Sensor Readings ===
    public Duration getUptime() {
        return startTime != null ? Duration.between(startTime, Instant.now()) : Duration.ZERO;
    }

    public long getNotificationsReceived() { return notificationsReceived.get(); }
    public long getEventsDispatched() { return eventsDispatched.get(); }
    public long getDecodeFailures() { return decodeFailures.get(); }
    public long getHandlerFailures() { return handlerFailures.get(); }
    public long getConnectionErrors() { return connectionErrors.get(); }
    public long getReconnects() { return reconnects.get(); }
}

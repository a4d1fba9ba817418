package com.omniva.dbnotify.engine.sensors;

import com.omniva.dbnotify.engine.valvetrain.ListenerState;
import com.omniva.dbnotify.util.DateTimeUtils;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time health snapshot of a listener, for health checks and logs.
 */
@Builder
@Value
public class ListenerSensor {
    String channel;
    ListenerState.Phase phase;
    int consecutiveFailures;
    int subscriptionCount;

    Instant startTime;
    Instant lastEventTime;
    Duration uptime;

    long notificationsReceived;
    long eventsDispatched;
    long decodeFailures;
    long handlerFailures;
    long connectionErrors;
    long reconnects;

    public boolean isConnected() {
        return phase == ListenerState.Phase.CONNECTED;
    }

    public boolean isReconnecting() {
        return phase == ListenerState.Phase.RECONNECTING;
    }

    /**
     * {@code ok}, {@code reconnecting (n failures)}, {@code gave up (n failures)} or {@code disconnected}
     */
    public String status() {
        return switch (phase) {
            case CONNECTED -> "ok";
            case RECONNECTING -> "reconnecting (" + consecutiveFailures + " failures)";
            case GIVING_UP -> "gave up (" + consecutiveFailures + " failures)";
            case DISCONNECTED -> "disconnected";
        };
    }

    public String getUptimeFormatted() {
        return DateTimeUtils.formatDuration(uptime);
    }

    public boolean hasRecentActivity() {
        return lastEventTime != null &&
                Duration.between(lastEventTime, Instant.now()).toMinutes() < 5;
    }
}

package com.omniva.dbnotify.messaging.model;

/**
 * Raw notification as delivered by the database: channel name, payload text
 * and the backend process id that sent it.
 */
public record ChannelNotification(String channel, String payload, int processId) {

    public static ChannelNotification of(String channel, String payload) {
        return new ChannelNotification(channel, payload, 0);
    }

    public boolean hasPayload() {
        return payload != null && !payload.isEmpty();
    }
}

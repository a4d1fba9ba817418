package com.omniva.dbnotify.engine.valvetrain;

/**
 * Mutable lifecycle state of one listener.
 * <p>
 * Invariants: {@code connected} and {@code reconnecting} are never both true;
 * {@code reconnectAttempt} is 0 after every successful (re)connection and grows
 * by one per failed reconnection attempt.
 * <p>
 * NOT thread-safe; guarded by the owning listener's lock.
 */
public class ListenerState {

    public enum Phase {
        DISCONNECTED, CONNECTED, RECONNECTING, GIVING_UP
    }

    private boolean connected;
    private boolean reconnecting;
    private boolean intentionalDisconnect;
    private boolean givenUp;
    private int reconnectAttempt;

    public void markConnected() {
        connected = true;
        reconnecting = false;
        givenUp = false;
        reconnectAttempt = 0;
    }

    /**
     * The connection reported an error or ended unexpectedly
     */
    public void markConnectionLost() {
        connected = false;
    }

    public void beginReconnecting() {
        connected = false;
        reconnecting = true;
    }

    /**
     * A reconnection attempt started; counts it as failed until it succeeds
     */
    public int recordAttempt() {
        return ++reconnectAttempt;
    }

    public void endReconnecting() {
        reconnecting = false;
    }

    public void markGivenUp() {
        connected = false;
        reconnecting = false;
        givenUp = true;
    }

    public void beginIntentionalDisconnect() {
        intentionalDisconnect = true;
    }

    public void clearIntentionalDisconnect() {
        intentionalDisconnect = false;
    }

    public void markDisconnected() {
        connected = false;
        reconnecting = false;
    }

    public Phase getPhase() {
        if (connected) {
            return Phase.CONNECTED;
        }
        if (reconnecting) {
            return Phase.RECONNECTING;
        }
        return givenUp ? Phase.GIVING_UP : Phase.DISCONNECTED;
    }

    public boolean isConnected() {
        return connected;
    }

    public boolean isReconnecting() {
        return reconnecting;
    }

    public boolean isIntentionalDisconnect() {
        return intentionalDisconnect;
    }

    public int getReconnectAttempt() {
        return reconnectAttempt;
    }
}

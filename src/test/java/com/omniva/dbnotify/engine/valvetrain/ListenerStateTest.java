package com.omniva.dbnotify.engine.valvetrain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListenerStateTest {

    private final ListenerState state = new ListenerState();

    @Test
    void startsDisconnected() {
        assertThat(state.getPhase()).isEqualTo(ListenerState.Phase.DISCONNECTED);
        assertThat(state.getReconnectAttempt()).isZero();
    }

    @Test
    void connectedAndReconnectingAreExclusive() {
        state.markConnected();
        state.markConnectionLost();
        state.beginReconnecting();

        assertThat(state.isConnected()).isFalse();
        assertThat(state.isReconnecting()).isTrue();
        assertThat(state.getPhase()).isEqualTo(ListenerState.Phase.RECONNECTING);

        state.markConnected();
        assertThat(state.isReconnecting()).isFalse();
        assertThat(state.getPhase()).isEqualTo(ListenerState.Phase.CONNECTED);
    }

    @Test
    void successfulConnectionResetsAttempts() {
        state.beginReconnecting();
        assertThat(state.recordAttempt()).isEqualTo(1);
        assertThat(state.recordAttempt()).isEqualTo(2);

        state.markConnected();

        assertThat(state.getReconnectAttempt()).isZero();
    }

    @Test
    void givingUpIsTerminalUntilConnected() {
        state.recordAttempt();
        state.markGivenUp();

        assertThat(state.getPhase()).isEqualTo(ListenerState.Phase.GIVING_UP);

        state.markConnected();
        assertThat(state.getPhase()).isEqualTo(ListenerState.Phase.CONNECTED);
    }

    @Test
    void intentionalDisconnectFlag() {
        state.beginIntentionalDisconnect();
        assertThat(state.isIntentionalDisconnect()).isTrue();

        state.clearIntentionalDisconnect();
        assertThat(state.isIntentionalDisconnect()).isFalse();
    }
}

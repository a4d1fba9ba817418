package com.omniva.dbnotify.engine.valvetrain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectOptionsTest {

    @Test
    void defaultsAreUnbounded() {
        ReconnectOptions options = ReconnectOptions.defaults();

        assertThat(options.enabled()).isTrue();
        assertThat(options.baseDelayMs()).isEqualTo(1000);
        assertThat(options.maxDelayMs()).isEqualTo(30000);
        assertThat(options.isUnbounded()).isTrue();
        assertThat(options.isExhausted(Integer.MAX_VALUE)).isFalse();
    }

    @Test
    void exhaustedOnceAttemptsReachTheMaximum() {
        ReconnectOptions options = new ReconnectOptions(true, 100, 1000, 3);

        assertThat(options.isExhausted(2)).isFalse();
        assertThat(options.isExhausted(3)).isTrue();
    }

    @Test
    void rejectsInconsistentDelays() {
        assertThatThrownBy(() -> new ReconnectOptions(true, 0, 1000, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectOptions(true, 2000, 1000, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

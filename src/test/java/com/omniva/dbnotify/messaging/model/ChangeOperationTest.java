package com.omniva.dbnotify.messaging.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeOperationTest {

    @Test
    void fromWireMatchesExactNames() {
        assertThat(ChangeOperation.fromWire("INSERT")).isEqualTo(ChangeOperation.INSERT);
        assertThat(ChangeOperation.fromWire("UPDATE")).isEqualTo(ChangeOperation.UPDATE);
        assertThat(ChangeOperation.fromWire("DELETE")).isEqualTo(ChangeOperation.DELETE);
    }

    @Test
    void fromWireRejectsEverythingElse() {
        assertThat(ChangeOperation.fromWire("delete")).isNull();
        assertThat(ChangeOperation.fromWire("TRUNCATE")).isNull();
        assertThat(ChangeOperation.fromWire(null)).isNull();
    }
}

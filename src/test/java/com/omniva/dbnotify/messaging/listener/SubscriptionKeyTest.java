package com.omniva.dbnotify.messaging.listener;

import com.omniva.dbnotify.messaging.model.ChangeEvent;
import com.omniva.dbnotify.messaging.model.ChangeOperation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionKeyTest {

    @Test
    void valuesUseTheStringDiscriminator() {
        assertThat(SubscriptionKey.all().value()).isEqualTo("*");
        assertThat(SubscriptionKey.table("User").value()).isEqualTo("User");
        assertThat(SubscriptionKey.operation("User", ChangeOperation.DELETE).value()).isEqualTo("User:DELETE");
    }

    @Test
    void forEventYieldsAllTableAndOperationKeysInOrder() {
        ChangeEvent event = ChangeEvent.builder()
                .table("User").schema("public").operation(ChangeOperation.UPDATE).id("u1").timestamp(1L)
                .build();

        assertThat(SubscriptionKey.forEvent(event))
                .extracting(SubscriptionKey::value)
                .containsExactly("*", "User", "User:UPDATE");
    }

    @Test
    void keysAreValueEqual() {
        assertThat(SubscriptionKey.table("User")).isEqualTo(SubscriptionKey.table("User"));
        assertThat(SubscriptionKey.operation("User", ChangeOperation.INSERT))
                .isNotEqualTo(SubscriptionKey.operation("User", ChangeOperation.DELETE));
        assertThat(SubscriptionKey.all().isAll()).isTrue();
        assertThat(SubscriptionKey.table("User").isAll()).isFalse();
    }

    @Test
    void rejectsInvalidTables() {
        assertThatThrownBy(() -> SubscriptionKey.table("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SubscriptionKey.table("*")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SubscriptionKey(null, ChangeOperation.INSERT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

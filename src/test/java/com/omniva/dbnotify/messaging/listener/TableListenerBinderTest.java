package com.omniva.dbnotify.messaging.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniva.dbnotify.engine.fault.ErrorTracker;
import com.omniva.dbnotify.engine.fuelsystem.FakeConnectionFactory;
import com.omniva.dbnotify.engine.piston.DbNotifyListener;
import com.omniva.dbnotify.engine.valvetrain.ReconnectBackoff;
import com.omniva.dbnotify.engine.valvetrain.ReconnectOptions;
import com.omniva.dbnotify.messaging.model.ChangeEvent;
import com.omniva.dbnotify.messaging.model.ChangeEventCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TableListenerBinder Tests")
class TableListenerBinderTest {

    private AnnotationConfigApplicationContext context;
    private DbNotifyListener listener;

    @BeforeEach
    void setUp() {
        ReconnectOptions options = ReconnectOptions.defaults();
        listener = new DbNotifyListener("table_change", new FakeConnectionFactory(),
                new ChangeEventCodec(new ObjectMapper()), new ErrorTracker(), options,
                new ReconnectBackoff(options), 50, 1);
    }

    @AfterEach
    void tearDown() {
        listener.close();
        if (context != null) {
            context.close();
        }
    }

    @Test
    @DisplayName("Binds every enabled ChangeHandler bean and skips the rest")
    void bindsAnnotatedHandlers() {
        context = new AnnotationConfigApplicationContext(
                UserDeleteHandler.class, EverythingHandler.class, OrderHandler.class,
                DisabledHandler.class, NotAHandler.class, BrokenHandler.class);
        TableListenerBinder binder = new TableListenerBinder(context);

        int bound = binder.bind(listener);

        assertThat(bound).isEqualTo(3);
        assertThat(binder.getSubscriptionCount()).isEqualTo(3);
        assertThat(listener.getSubscriptionCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("unbind removes the subscriptions it created")
    void unbindRemovesSubscriptions() {
        context = new AnnotationConfigApplicationContext(UserDeleteHandler.class, OrderHandler.class);
        TableListenerBinder binder = new TableListenerBinder(context);
        binder.bind(listener);
        listener.onChange(event -> { });

        binder.unbind();

        assertThat(binder.getSubscriptionCount()).isZero();
        assertThat(listener.getSubscriptionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Annotation maps to subscription keys")
    void keysFromAnnotation() {
        assertThat(TableListenerBinder.keysFor(annotationOf(UserDeleteHandler.class)))
                .extracting(SubscriptionKey::value)
                .containsExactly("User:DELETE");
        assertThat(TableListenerBinder.keysFor(annotationOf(EverythingHandler.class)))
                .containsExactly(SubscriptionKey.all());
        assertThat(TableListenerBinder.keysFor(annotationOf(OrderHandler.class)))
                .containsExactly(SubscriptionKey.table("Order"));
    }

    @Test
    @DisplayName("Operations without a table are rejected")
    void operationsRequireTable() {
        assertThatThrownBy(() -> TableListenerBinder.keysFor(annotationOf(BrokenHandler.class)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("require a table");
    }

    @Test
    @DisplayName("Unknown operations are rejected")
    void unknownOperation() {
        assertThatThrownBy(() -> TableListenerBinder.keysFor(annotationOf(TruncateHandler.class)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TRUNCATE");
    }

    private static TableChangeListener annotationOf(Class<?> type) {
        return type.getAnnotation(TableChangeListener.class);
    }

    @TableChangeListener(table = "User", operations = {"DELETE", "delete"})
    static class UserDeleteHandler implements ChangeHandler {
        @Override
        public void onChange(ChangeEvent event) {
        }
    }

    @TableChangeListener
    static class EverythingHandler implements ChangeHandler {
        @Override
        public void onChange(ChangeEvent event) {
        }
    }

    @TableChangeListener(table = "Order")
    static class OrderHandler implements ChangeHandler {
        @Override
        public void onChange(ChangeEvent event) {
        }
    }

    @TableChangeListener(table = "User", enabled = false)
    static class DisabledHandler implements ChangeHandler {
        @Override
        public void onChange(ChangeEvent event) {
        }
    }

    @TableChangeListener(table = "User")
    static class NotAHandler {
    }

    @TableChangeListener(operations = "INSERT")
    static class BrokenHandler implements ChangeHandler {
        @Override
        public void onChange(ChangeEvent event) {
        }
    }

    @TableChangeListener(table = "User", operations = "TRUNCATE")
    static class TruncateHandler implements ChangeHandler {
        @Override
        public void onChange(ChangeEvent event) {
        }
    }
}

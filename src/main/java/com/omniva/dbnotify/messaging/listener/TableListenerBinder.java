package com.omniva.dbnotify.messaging.listener;

import com.omniva.dbnotify.engine.piston.DbNotifyListener;
import com.omniva.dbnotify.messaging.model.ChangeOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Subscribes every {@link TableChangeListener} bean to the listener.
 * Keeps the returned subscriptions so the binding can be undone.
 */
public class TableListenerBinder {

    private static final Logger log = LoggerFactory.getLogger(TableListenerBinder.class);

    private final ApplicationContext applicationContext;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public TableListenerBinder(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    /**
     * Discover annotated handlers and subscribe them.
     *
     * @return number of handler beans bound
     */
    public synchronized int bind(DbNotifyListener listener) {
        log.info("Starting table change listener discovery...");

        Map<String, Object> annotatedBeans = applicationContext.getBeansWithAnnotation(TableChangeListener.class);

        int boundCount = 0;
        for (Map.Entry<String, Object> entry : annotatedBeans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ChangeHandler handler)) {
                log.warn("Bean {} is annotated with @TableChangeListener but doesn't implement ChangeHandler", beanName);
                continue;
            }

            TableChangeListener annotation = applicationContext.findAnnotationOnBean(beanName, TableChangeListener.class);
            if (annotation == null) {
                log.warn("ChangeHandler {} missing @TableChangeListener annotation", beanName);
                continue;
            }

            if (!annotation.enabled()) {
                log.warn("ChangeHandler {} is disabled", beanName);
                continue;
            }

            try {
                List<SubscriptionKey> keys = keysFor(annotation);
                for (SubscriptionKey key : keys) {
                    subscriptions.add(subscribe(listener, key, handler));
                }
                boundCount++;
                log.info("  {} -> {}", beanName, keys);
            } catch (IllegalArgumentException e) {
                log.error("Failed to bind change handler {}: {}", beanName, e.getMessage());
            }
        }

        log.info("Successfully bound {} table change listeners", boundCount);
        return boundCount;
    }

    /**
     * Remove every subscription created by {@link #bind}
     */
    public synchronized void unbind() {
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
    }

    public synchronized int getSubscriptionCount() {
        return subscriptions.size();
    }

    static List<SubscriptionKey> keysFor(TableChangeListener annotation) {
        String table = annotation.table().trim();
        String[] operations = annotation.operations();

        if (table.isEmpty() || SubscriptionKey.ALL.equals(table)) {
            if (operations.length > 0) {
                throw new IllegalArgumentException("operations " + Arrays.toString(operations) + " require a table");
            }
            return List.of(SubscriptionKey.all());
        }

        if (operations.length == 0) {
            return List.of(SubscriptionKey.table(table));
        }

        List<SubscriptionKey> keys = new ArrayList<>();
        for (String value : operations) {
            ChangeOperation operation = ChangeOperation.fromWire(value.trim().toUpperCase());
            if (operation == null) {
                throw new IllegalArgumentException("unknown operation '" + value + "'");
            }
            SubscriptionKey key = SubscriptionKey.operation(table, operation);
            if (!keys.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private Subscription subscribe(DbNotifyListener listener, SubscriptionKey key, ChangeHandler handler) {
        if (key.isAll()) {
            return listener.onChange(handler);
        }
        if (key.operation() == null) {
            return listener.onTable(key.table(), handler);
        }
        return listener.onOperation(key.table(), key.operation(), handler);
    }
}

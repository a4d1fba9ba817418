package com.omniva.dbnotify.engine;

import com.omniva.dbnotify.config.DbNotifyConfig;
import com.omniva.dbnotify.engine.fault.DbNotifyFatalError;
import com.omniva.dbnotify.engine.fault.ErrorTracker;
import com.omniva.dbnotify.engine.ignition.EnvironmentValidator;
import com.omniva.dbnotify.engine.piston.DbNotifyListener;
import com.omniva.dbnotify.messaging.listener.TableListenerBinder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.lang.NonNull;

import java.sql.SQLException;

/**
 * DB Notify Engine - startup and shutdown of the change listener
 * <p>
 * start():
 * ├── EnvironmentValidator (channel identifier, datasource URL)
 * ├── default subscriptions (DEBUG change log, ERROR error log)
 * ├── TableListenerBinder (@TableChangeListener beans)
 * └── DbNotifyListener.connect() when fail-fast, connectOrRetry() otherwise
 * <p>
 * stop(): unbind annotated listeners, close the listener and its threads.
 */
@RequiredArgsConstructor
public class DbNotifyEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DbNotifyEngine.class);

    private final DbNotifyConfig config;
    private final DbNotifyListener listener;
    private final TableListenerBinder listenerBinder;
    private final EnvironmentValidator environmentValidator;
    private final ErrorTracker errorTracker;

    private volatile boolean running = false;

    @Override
    public void start() {
        if (running) {
            log.warn("DbNotifyEngine is already running");
            return;
        }

        environmentValidator.validateEnvironment();

        if (config.isLogChanges()) {
            installLoggingSubscriptions();
        }

        int bound = listenerBinder.bind(listener);
        if (bound == 0) {
            log.warn("No @TableChangeListener beans registered - changes are only visible to programmatic subscribers");
        }

        if (config.isFailFast()) {
            try {
                listener.connect();
            } catch (SQLException e) {
                errorTracker.addError("Initial listener connection failed", e);
                throw new DbNotifyFatalError("Could not connect to channel '" + config.getChannel() + "': "
                        + e.getMessage(), e);
            }
        } else {
            listener.connectOrRetry();
        }

        running = true;
        log.info("DbNotifyEngine started - channel '{}', {} bound listeners, connected: {}",
                config.getChannel(), bound, listener.isConnected());
    }

    private void installLoggingSubscriptions() {
        listener.onChange(event -> log.debug("{} {}.{} id={}",
                event.getOperation(), event.getSchema(), event.getTable(), event.getId()));
        listener.onError(error -> log.error("Change listener error: {}", error.getMessage()));
    }

    @Override
    public void stop() {
        if (!running) {
            log.info("DbNotifyEngine is not running");
            return;
        }

        log.info("Stopping DbNotifyEngine...");
        try {
            listenerBinder.unbind();
            listener.close();
        } catch (RuntimeException e) {
            errorTracker.addError("Error stopping DbNotifyEngine", e);
            log.error("Error stopping DbNotifyEngine: {}", e.getMessage(), e);
        } finally {
            running = false;
        }
        log.info("DbNotifyEngine stopped");
    }

    @Override
    public void stop(@NonNull Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return config.isAutoStartup();
    }

    @Override
    public int getPhase() {
        return 1000;
    }
}

package com.omniva.dbnotify.config;

import com.omniva.dbnotify.engine.valvetrain.ReconnectOptions;

/**
 * Configuration interface for the DB Notify listener and transaction coordinator
 * This interface abstracts the configuration details from the implementation
 */
public interface DbNotifyConfig {

    String getChannel();
    String getDatasourceUrl();
    boolean isAutoStartup();

    // Validation methods
    boolean isValidChannel(String channel);

    // Listener
    int getPollTimeoutMs();
    int getHandlerThreads();
    boolean isFailFast();
    boolean isLogChanges();

    // Reconnection
    ReconnectOptions getReconnectOptions();

    // Transactions
    String getActorSettingName();
}

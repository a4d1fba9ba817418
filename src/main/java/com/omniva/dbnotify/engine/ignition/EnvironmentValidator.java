package com.omniva.dbnotify.engine.ignition;

import com.omniva.dbnotify.config.DbNotifyConfig;
import com.omniva.dbnotify.engine.fault.DbNotifyFatalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EnvironmentValidator {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final DbNotifyConfig config;

    public EnvironmentValidator(DbNotifyConfig config) {
        this.config = config;
    }

    /**
     * Validates the listener configuration before the first connection.
     *
     * @throws DbNotifyFatalError when the channel or datasource cannot work at all
     */
    public void validateEnvironment() {
        String channel = config.getChannel();
        if (!config.isValidChannel(channel)) {
            log.error("Invalid channel name: {}", channel);
            throw new DbNotifyFatalError("Invalid channel configuration: " + channel
                    + " (expected an unquoted SQL identifier of at most 63 characters)");
        }

        String url = config.getDatasourceUrl();
        if (url == null || url.isBlank()) {
            log.error("No datasource URL configured for channel {}", channel);
            throw new DbNotifyFatalError("Missing datasource configuration: db-notify.datasource.url is required");
        }

        log.debug("Environment valid - channel '{}' on {}", channel, url);
    }
}

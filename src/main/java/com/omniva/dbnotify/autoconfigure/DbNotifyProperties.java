package com.omniva.dbnotify.autoconfigure;

import com.omniva.dbnotify.transaction.ActorTransactions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

@Data
@ConfigurationProperties(prefix = "db-notify")
public class DbNotifyProperties {

    // unquoted PostgreSQL identifier; NAMEDATALEN - 1
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int MAX_CHANNEL_NAME_LENGTH = 63;

    private boolean enabled = true;
    private String channel = "table_change";
    private boolean autoStartup = true;

    @NestedConfigurationProperty
    private DataSourceConfig datasource = new DataSourceConfig();

    @NestedConfigurationProperty
    private ListenerConfig listener = new ListenerConfig();

    @NestedConfigurationProperty
    private ReconnectConfig reconnect = new ReconnectConfig();

    @NestedConfigurationProperty
    private ActorConfig actor = new ActorConfig();

    public boolean isValidChannel(String channel) {
        return channel != null &&
                channel.length() <= MAX_CHANNEL_NAME_LENGTH &&
                CHANNEL_PATTERN.matcher(channel).matches();
    }

    @Data
    public static class DataSourceConfig {
        private String url;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";

        @NestedConfigurationProperty
        private HikariProperties hikari = new HikariProperties();

        @Data
        public static class HikariProperties {
            private int maximumPoolSize = 10;
            private int minimumIdle = 2;
            private long connectionTimeout = 30000; // 30 seconds
            private long idleTimeout = 600000; // 10 minutes
            private long maxLifetime = 1800000; // 30 minutes
            private String poolName = "DbNotifyPool";
            private boolean autoCommit = true; // transactions switch it off per connection
            private long leakDetectionThreshold = 0;
            private Map<String, String> dataSourceProperties = getDefaultDataSourceProperties();

            private static Map<String, String> getDefaultDataSourceProperties() {
                Map<String, String> defaults = new HashMap<>();
                defaults.put("ApplicationName", "DbNotify");
                defaults.put("reWriteBatchedInserts", "true");
                defaults.put("prepareThreshold", "5");
                return defaults;
            }
        }
    }

    @Data
    public static class ListenerConfig {
        private int pollTimeoutMs = 500;
        private int handlerThreads = 4;
        private boolean failFast = false;
        private boolean logChanges = true;
    }

    @Data
    public static class ReconnectConfig {
        private boolean enabled = true;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private int maxAttempts = -1; // negative = unbounded
    }

    @Data
    public static class ActorConfig {
        private String settingName = ActorTransactions.DEFAULT_ACTOR_SETTING;
    }
}

package com.omniva.dbnotify.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omniva.dbnotify.config.DbNotifyConfig;
import com.omniva.dbnotify.engine.DbNotifyEngine;
import com.omniva.dbnotify.engine.fault.ErrorTracker;
import com.omniva.dbnotify.engine.fuelsystem.DbNotifyConnectionManager;
import com.omniva.dbnotify.engine.fuelsystem.NotificationConnectionFactory;
import com.omniva.dbnotify.engine.ignition.EnvironmentValidator;
import com.omniva.dbnotify.engine.piston.DbNotifyListener;
import com.omniva.dbnotify.engine.valvetrain.ReconnectOptions;
import com.omniva.dbnotify.messaging.listener.TableListenerBinder;
import com.omniva.dbnotify.messaging.model.ChangeEventCodec;
import com.omniva.dbnotify.transaction.ActorTransactions;
import com.omniva.dbnotify.transaction.TransactionalEngine;
import com.omniva.dbnotify.transaction.jdbc.JdbcTransactionalEngine;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.postgresql.ds.PGSimpleDataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the DB Notify change listener and transaction coordinator
 * Enabled by default, can be disabled with: db-notify.enabled=false
 */
@AutoConfiguration
@ConditionalOnClass(DbNotifyEngine.class)
@ConditionalOnProperty(prefix = "db-notify", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DbNotifyProperties.class)
public class DbNotifyAutoConfiguration {

    // 1. Data layer

    @Bean("dbNotifyHikariConfig")
    @ConditionalOnMissingBean(name = "dbNotifyHikariConfig")
    public HikariConfig dbNotifyHikariConfig(DbNotifyProperties properties) {
        HikariConfig hikariConfig = new HikariConfig();
        DbNotifyProperties.DataSourceConfig datasource = properties.getDatasource();
        DbNotifyProperties.DataSourceConfig.HikariProperties hikariProps = datasource.getHikari();

        // Basic connection settings
        hikariConfig.setJdbcUrl(datasource.getUrl());
        hikariConfig.setUsername(datasource.getUsername());
        hikariConfig.setPassword(datasource.getPassword());
        hikariConfig.setDriverClassName(datasource.getDriverClassName());

        // Pool settings
        hikariConfig.setMaximumPoolSize(hikariProps.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(hikariProps.getMinimumIdle());
        hikariConfig.setConnectionTimeout(hikariProps.getConnectionTimeout());
        hikariConfig.setIdleTimeout(hikariProps.getIdleTimeout());
        hikariConfig.setMaxLifetime(hikariProps.getMaxLifetime());
        hikariConfig.setPoolName(hikariProps.getPoolName());
        hikariConfig.setAutoCommit(hikariProps.isAutoCommit());
        hikariConfig.setLeakDetectionThreshold(hikariProps.getLeakDetectionThreshold());

        // Pool is created lazily so a database outage does not fail startup
        hikariConfig.setInitializationFailTimeout(-1);

        if (hikariProps.getDataSourceProperties() != null) {
            hikariProps.getDataSourceProperties().forEach(hikariConfig::addDataSourceProperty);
        }
        return hikariConfig;
    }

    @Bean("dbNotifyDataSource")
    @ConditionalOnMissingBean(name = "dbNotifyDataSource")
    public DataSource dbNotifyDataSource(@Qualifier("dbNotifyHikariConfig") HikariConfig config) {
        return new HikariDataSource(config);
    }

    /**
     * Dedicated, non-pooled connections for LISTEN. A pooled connection would
     * lose its subscription when returned to the pool.
     */
    @Bean("dbNotifyListenerConnectionFactory")
    @ConditionalOnMissingBean(name = "dbNotifyListenerConnectionFactory")
    public NotificationConnectionFactory dbNotifyListenerConnectionFactory(DbNotifyProperties properties) {
        DbNotifyProperties.DataSourceConfig datasource = properties.getDatasource();

        PGSimpleDataSource listenerDataSource = new PGSimpleDataSource();
        listenerDataSource.setURL(datasource.getUrl());
        listenerDataSource.setUser(datasource.getUsername());
        listenerDataSource.setPassword(datasource.getPassword());
        listenerDataSource.setApplicationName("DbNotify-listener");
        listenerDataSource.setOptions("-c timezone=UTC");
        return new DbNotifyConnectionManager(listenerDataSource);
    }

    // 2. Configuration

    @Bean
    @ConditionalOnMissingBean
    public DbNotifyConfig dbNotifyConfig(DbNotifyProperties properties) {
        return new DbNotifyConfigAdapter(properties);
    }

    // 3. Core infrastructure

    @Bean
    @ConditionalOnMissingBean
    public ErrorTracker errorTracker() {
        return new ErrorTracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeEventCodec changeEventCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new ChangeEventCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentValidator environmentValidator(DbNotifyConfig config) {
        return new EnvironmentValidator(config);
    }

    // 4. Transactions

    @Bean
    @ConditionalOnMissingBean
    public TransactionalEngine dbNotifyTransactionalEngine(@Qualifier("dbNotifyDataSource") DataSource dataSource) {
        return new JdbcTransactionalEngine(dataSource);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ActorTransactions actorTransactions(DbNotifyConfig config) {
        return new ActorTransactions(config.getActorSettingName());
    }

    // 5. Listener and Engine (depends on everything)

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DbNotifyListener dbNotifyListener(DbNotifyConfig config,
                                             @Qualifier("dbNotifyListenerConnectionFactory")
                                             NotificationConnectionFactory connectionFactory,
                                             ChangeEventCodec codec,
                                             ErrorTracker errorTracker) {
        return new DbNotifyListener(config, connectionFactory, codec, errorTracker);
    }

    @Bean
    @ConditionalOnMissingBean
    public TableListenerBinder tableListenerBinder(ApplicationContext applicationContext) {
        return new TableListenerBinder(applicationContext);
    }

    @Bean
    @ConditionalOnMissingBean
    public DbNotifyEngine dbNotifyEngine(DbNotifyConfig config,
                                         DbNotifyListener listener,
                                         TableListenerBinder listenerBinder,
                                         EnvironmentValidator environmentValidator,
                                         ErrorTracker errorTracker) {
        return new DbNotifyEngine(config, listener, listenerBinder, environmentValidator, errorTracker);
    }

    /**
     * Adapter to convert properties to config interface
     */
    private record DbNotifyConfigAdapter(DbNotifyProperties properties) implements DbNotifyConfig {

        @Override
        public String getChannel() {
            return properties.getChannel();
        }

        @Override
        public String getDatasourceUrl() {
            return properties.getDatasource().getUrl();
        }

        @Override
        public boolean isAutoStartup() {
            return properties.isAutoStartup();
        }

        @Override
        public boolean isValidChannel(String channel) {
            return properties.isValidChannel(channel);
        }

        @Override
        public int getPollTimeoutMs() {
            return properties.getListener().getPollTimeoutMs();
        }

        @Override
        public int getHandlerThreads() {
            return properties.getListener().getHandlerThreads();
        }

        @Override
        public boolean isFailFast() {
            return properties.getListener().isFailFast();
        }

        @Override
        public boolean isLogChanges() {
            return properties.getListener().isLogChanges();
        }

        @Override
        public ReconnectOptions getReconnectOptions() {
            DbNotifyProperties.ReconnectConfig reconnect = properties.getReconnect();
            return new ReconnectOptions(reconnect.isEnabled(), reconnect.getBaseDelayMs(),
                    reconnect.getMaxDelayMs(), reconnect.getMaxAttempts());
        }

        @Override
        public String getActorSettingName() {
            return properties.getActor().getSettingName();
        }
    }
}

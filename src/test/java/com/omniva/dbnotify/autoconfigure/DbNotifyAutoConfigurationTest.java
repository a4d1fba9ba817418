package com.omniva.dbnotify.autoconfigure;

import com.omniva.dbnotify.config.DbNotifyConfig;
import com.omniva.dbnotify.engine.DbNotifyEngine;
import com.omniva.dbnotify.engine.fault.ErrorTracker;
import com.omniva.dbnotify.engine.piston.DbNotifyListener;
import com.omniva.dbnotify.engine.valvetrain.ReconnectOptions;
import com.omniva.dbnotify.messaging.listener.TableListenerBinder;
import com.omniva.dbnotify.messaging.model.ChangeEventCodec;
import com.omniva.dbnotify.transaction.ActorTransactions;
import com.omniva.dbnotify.transaction.TransactionalEngine;
import com.omniva.dbnotify.transaction.jdbc.JdbcTransactionalEngine;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DbNotifyAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DbNotifyAutoConfiguration.class))
            .withPropertyValues(
                    "db-notify.datasource.url=jdbc:postgresql://localhost:5432/app",
                    "db-notify.datasource.username=app",
                    "db-notify.auto-startup=false")
            .withBean("dbNotifyDataSource", DataSource.class, () -> mock(DataSource.class));

    @Test
    void registersListenerAndTransactionBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(DbNotifyEngine.class);
            assertThat(context).hasSingleBean(DbNotifyListener.class);
            assertThat(context).hasSingleBean(TableListenerBinder.class);
            assertThat(context).hasSingleBean(ChangeEventCodec.class);
            assertThat(context).hasSingleBean(ErrorTracker.class);
            assertThat(context).hasSingleBean(ActorTransactions.class);
            assertThat(context.getBean(TransactionalEngine.class)).isInstanceOf(JdbcTransactionalEngine.class);

            DbNotifyListener listener = context.getBean(DbNotifyListener.class);
            assertThat(listener.getChannel()).isEqualTo("table_change");
            assertThat(listener.isConnected()).isFalse();
            assertThat(context.getBean(DbNotifyEngine.class).isRunning()).isFalse();
        });
    }

    @Test
    void bindsPropertiesIntoConfig() {
        contextRunner
                .withPropertyValues(
                        "db-notify.channel=audit_events",
                        "db-notify.listener.poll-timeout-ms=250",
                        "db-notify.listener.handler-threads=2",
                        "db-notify.listener.fail-fast=true",
                        "db-notify.reconnect.base-delay-ms=200",
                        "db-notify.reconnect.max-delay-ms=5000",
                        "db-notify.reconnect.max-attempts=5",
                        "db-notify.actor.setting-name=audit.actor_id")
                .run(context -> {
                    DbNotifyConfig config = context.getBean(DbNotifyConfig.class);
                    assertThat(config.getChannel()).isEqualTo("audit_events");
                    assertThat(config.getPollTimeoutMs()).isEqualTo(250);
                    assertThat(config.getHandlerThreads()).isEqualTo(2);
                    assertThat(config.isFailFast()).isTrue();
                    assertThat(config.isAutoStartup()).isFalse();
                    assertThat(config.getReconnectOptions()).isEqualTo(new ReconnectOptions(true, 200, 5000, 5));
                    assertThat(context.getBean(ActorTransactions.class).getActorSettingName())
                            .isEqualTo("audit.actor_id");
                    assertThat(context.getBean(DbNotifyListener.class).getChannel()).isEqualTo("audit_events");
                });
    }

    @Test
    void defaultsPoolSettings() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(DbNotifyAutoConfiguration.class))
                .withPropertyValues("db-notify.datasource.url=jdbc:postgresql://localhost:5432/app",
                        "db-notify.auto-startup=false")
                .withBean("dbNotifyDataSource", DataSource.class, () -> mock(DataSource.class))
                .run(context -> {
                    HikariConfig hikariConfig = context.getBean("dbNotifyHikariConfig", HikariConfig.class);
                    assertThat(hikariConfig.getPoolName()).isEqualTo("DbNotifyPool");
                    assertThat(hikariConfig.getJdbcUrl()).isEqualTo("jdbc:postgresql://localhost:5432/app");
                    assertThat(hikariConfig.getInitializationFailTimeout()).isEqualTo(-1);
                    assertThat(hikariConfig.getDataSourceProperties())
                            .containsEntry("ApplicationName", "DbNotify");
                });
    }

    @Test
    void disabledByProperty() {
        contextRunner
                .withPropertyValues("db-notify.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(DbNotifyEngine.class);
                    assertThat(context).doesNotHaveBean(DbNotifyListener.class);
                    assertThat(context).doesNotHaveBean(ActorTransactions.class);
                });
    }

    @Test
    void backsOffForUserDefinedBeans() {
        ActorTransactions custom = new ActorTransactions("tenant.actor");
        contextRunner
                .withBean(ActorTransactions.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(ActorTransactions.class);
                    assertThat(context.getBean(ActorTransactions.class)).isSameAs(custom);
                });
        custom.close();
    }
}

package com.steward.database;

import com.steward.access.AccessControl;
import com.steward.access.authz.AuthorizationEngine;
import com.steward.access.mutate.MutationEngine;
import com.steward.access.query.AccessQueries;
import com.steward.database.jdbc.JdbcEntityStore;
import com.steward.database.jdbc.JdbcGrantStore;
import com.steward.database.jdbc.JdbcTransactionRunner;
import com.steward.observability.AccessMetrics;
import com.steward.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

/**
 * Spring wiring for access control over a relational database.
 *
 * <p>Creates a dedicated DataSource, migrates it with its own Flyway instance (locations from
 * {@link AccessStoreProperties.Migrations}), and exposes the engines as beans. The DataSource is kept
 * separate from the application's primary one, so services using this module alongside Spring
 * Boot's own Flyway should disable the latter or point it elsewhere:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <p>Active once {@code steward.access.datasource.url} is set.
 *
 * @see AccessStoreProperties
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(AccessStoreProperties.class)
@ConditionalOnProperty(prefix = "steward.access.datasource", name = "url")
public class AccessControlConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AccessControlConfiguration.class);

    public static final String DATA_SOURCE_BEAN = "accessDataSource";
    public static final String FLYWAY_BEAN = "accessFlyway";

    @Bean(name = DATA_SOURCE_BEAN)
    public DataSource accessDataSource(AccessStoreProperties properties) {
        AccessStoreProperties.Datasource config = properties.datasource();
        return DataSourceBuilder.create()
                .url(config.url())
                .username(config.username())
                .password(config.password())
                .build();
    }

    /** Migrates on creation; absent when {@code steward.access.flyway.enabled=false}. */
    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    @ConditionalOnProperty(
            prefix = "steward.access.flyway",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    public Flyway accessFlyway(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource, AccessStoreProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.flyway().locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    @Bean
    public JdbcEntityStore accessEntityStore(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource, ObjectProvider<Flyway> migrations) {
        awaitMigrations(migrations);
        return new JdbcEntityStore(new JdbcTemplate(dataSource));
    }

    @Bean
    public JdbcGrantStore accessGrantStore(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource, ObjectProvider<Flyway> migrations) {
        awaitMigrations(migrations);
        return new JdbcGrantStore(new JdbcTemplate(dataSource), Clock.systemUTC());
    }

    @Bean
    public JdbcTransactionRunner accessTransactionRunner(
            @Qualifier(DATA_SOURCE_BEAN) DataSource dataSource) {
        return new JdbcTransactionRunner(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Publishes to the application's registry when there is one and metrics are enabled;
     * otherwise records into a private registry.
     */
    @Bean
    public AccessMetrics accessMetrics(
            AccessStoreProperties properties, ObjectProvider<MeterRegistry> registry) {
        MeterRegistry meterRegistry = registry.getIfAvailable();
        if (!properties.metrics().enabled() || meterRegistry == null) {
            log.info(
                    "Access metrics not published (enabled={}, registry present={})",
                    properties.metrics().enabled(),
                    meterRegistry != null);
            return AccessMetrics.noop();
        }
        return new AccessMetrics(new MetricFactory(meterRegistry, properties.serviceName()));
    }

    @Bean
    public AccessControl accessControl(
            JdbcEntityStore entities,
            JdbcGrantStore grants,
            JdbcTransactionRunner transactions,
            AccessMetrics metrics) {
        return AccessControl.create(entities, grants, transactions, metrics);
    }

    @Bean
    public AuthorizationEngine authorizationEngine(AccessControl accessControl) {
        return accessControl.authorization();
    }

    @Bean
    public MutationEngine mutationEngine(AccessControl accessControl) {
        return accessControl.mutations();
    }

    @Bean
    public AccessQueries accessQueries(AccessControl accessControl) {
        return accessControl.queries();
    }

    // ── Private Helpers ──

    /** Resolving the Flyway bean runs its migration before any store touches the schema. */
    private static void awaitMigrations(ObjectProvider<Flyway> migrations) {
        Flyway flyway = migrations.getIfAvailable();
        if (flyway == null) {
            log.info("Access control schema migration disabled; expecting an existing schema");
        }
    }
}

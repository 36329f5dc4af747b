package com.steward.database;

import static org.assertj.core.api.Assertions.assertThat;

import com.steward.access.AccessControl;
import com.steward.access.AccessResource;
import com.steward.access.AccessUser;
import com.steward.access.Privilege;
import com.steward.access.authz.AuthorizationEngine;
import com.steward.access.mutate.MutationEngine;
import com.steward.access.query.AccessQueries;
import com.steward.database.jdbc.JdbcEntityStore;
import com.steward.observability.AccessMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("AccessControlConfiguration")
class AccessControlConfigurationTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(AccessControlConfiguration.class);

    private static String h2Url() {
        return "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        @DisplayName("should stay inactive without a datasource url")
        void inactiveWithoutUrl() {
            runner.run(context -> assertThat(context).doesNotHaveBean(AccessControl.class));
        }

        @Test
        @DisplayName("should wire engines, stores and migration when configured")
        void wiresEverything() {
            runner.withPropertyValues(
                            "steward.access.datasource.url=" + h2Url(),
                            "steward.access.datasource.username=sa")
                    .run(
                            context -> {
                                assertThat(context).hasNotFailed();
                                assertThat(context).hasBean(AccessControlConfiguration.FLYWAY_BEAN);
                                assertThat(context).hasSingleBean(AuthorizationEngine.class);
                                assertThat(context).hasSingleBean(MutationEngine.class);
                                assertThat(context).hasSingleBean(AccessQueries.class);
                                assertThat(context).hasSingleBean(JdbcEntityStore.class);
                            });
        }

        @Test
        @DisplayName("should run access control end to end against the migrated schema")
        void endToEnd() {
            runner.withPropertyValues(
                            "steward.access.datasource.url=" + h2Url(),
                            "steward.access.datasource.username=sa")
                    .run(
                            context -> {
                                JdbcEntityStore entities = context.getBean(JdbcEntityStore.class);
                                AccessUser owner = entities.saveUser(AccessUser.of("owner"));
                                AccessUser reader = entities.saveUser(AccessUser.of("reader"));
                                MutationEngine mutations = context.getBean(MutationEngine.class);
                                AuthorizationEngine authz = context.getBean(AuthorizationEngine.class);

                                AccessResource resource = mutations.createResource(owner, "Notes");
                                mutations.shareResourceWithUser(owner, resource, reader, Privilege.VIEW);

                                assertThat(authz.canViewResource(reader, resource)).isTrue();
                                assertThat(authz.canChangeResource(reader, resource)).isFalse();
                            });
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("should apply defaults for optional sections")
        void shouldApplyDefaults() {
            runner.withPropertyValues(
                            "steward.access.datasource.url=" + h2Url(),
                            "steward.access.datasource.username=sa")
                    .run(
                            context -> {
                                AccessStoreProperties properties =
                                        context.getBean(AccessStoreProperties.class);
                                assertThat(properties.serviceName()).isEqualTo("steward");
                                assertThat(properties.flyway().locations())
                                        .isEqualTo("classpath:db/migration/steward");
                                assertThat(properties.flyway().enabled()).isTrue();
                                assertThat(properties.metrics().enabled()).isTrue();
                            });
        }

        @Test
        @DisplayName("should fail fast when the username is missing")
        void shouldFailWithoutUsername() {
            runner.withPropertyValues("steward.access.datasource.url=" + h2Url())
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("should skip migration when flyway is disabled")
        void shouldSkipDisabledMigration() {
            runner.withPropertyValues(
                            "steward.access.datasource.url=" + h2Url(),
                            "steward.access.datasource.username=sa",
                            "steward.access.flyway.enabled=false")
                    .run(
                            context -> {
                                assertThat(context).hasNotFailed();
                                assertThat(context).doesNotHaveBean(Flyway.class);
                            });
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("should publish to the application's registry under the service name")
        void shouldPublishToRegistry() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            runner.withBean(MeterRegistry.class, () -> registry)
                    .withPropertyValues(
                            "steward.access.datasource.url=" + h2Url(),
                            "steward.access.datasource.username=sa",
                            "steward.access.service-name=documents")
                    .run(
                            context -> {
                                AccessUser owner =
                                        context.getBean(JdbcEntityStore.class)
                                                .saveUser(AccessUser.of("owner"));
                                context.getBean(MutationEngine.class).createGroup(owner, "Team");

                                assertThat(registry.get(AccessMetrics.ACTIONS)
                                                .tag("service", "documents")
                                                .tag("operation", "create_group")
                                                .counter()
                                                .count())
                                        .isEqualTo(1.0);
                            });
        }

        @Test
        @DisplayName("should keep metrics private when disabled")
        void shouldKeepMetricsPrivate() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            runner.withBean(MeterRegistry.class, () -> registry)
                    .withPropertyValues(
                            "steward.access.datasource.url=" + h2Url(),
                            "steward.access.datasource.username=sa",
                            "steward.access.metrics.enabled=false")
                    .run(
                            context -> {
                                assertThat(context.getBean(AccessMetrics.class).factory().registry())
                                        .isNotSameAs(registry);
                            });
        }
    }
}

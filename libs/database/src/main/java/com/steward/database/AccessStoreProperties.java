package com.steward.database;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the JDBC-backed access control stores.
 *
 * <p>Bound from {@code steward.access.*}; Bean Validation fails startup when the datasource is
 * incomplete rather than on the first authorization check.
 *
 * <pre>{@code
 * steward:
 *   access:
 *     service-name: documents
 *     datasource:
 *       url: jdbc:postgresql://localhost:5432/steward
 *       username: steward
 *       password: steward_dev_password
 *     flyway:
 *       locations: classpath:db/migration/steward
 *       enabled: true
 *     metrics:
 *       enabled: true
 * }</pre>
 *
 * @param serviceName value of the {@code service} tag on every access metric
 * @param datasource connection to the database holding grants and entities
 * @param flyway schema migration settings
 * @param metrics whether to publish to the application's {@code MeterRegistry}
 */
@Validated
@ConfigurationProperties(prefix = "steward.access")
public record AccessStoreProperties(
        @DefaultValue("steward") @NotBlank String serviceName,
        @NotNull @Valid Datasource datasource,
        @DefaultValue @Valid Migrations flyway,
        @DefaultValue Metrics metrics) {

    /**
     * @param url JDBC connection URL
     * @param username database username
     * @param password database password
     */
    public record Datasource(@NotBlank String url, @NotBlank String username, String password) {}

    /**
     * @param locations Flyway migration locations
     * @param enabled whether to migrate on startup
     */
    public record Migrations(
            @DefaultValue("classpath:db/migration/steward") @NotBlank String locations,
            @DefaultValue("true") boolean enabled) {}

    /** @param enabled whether to publish to the application's registry */
    public record Metrics(@DefaultValue("true") boolean enabled) {}
}

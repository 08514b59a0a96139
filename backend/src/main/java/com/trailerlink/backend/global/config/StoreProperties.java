package com.trailerlink.backend.global.config;

import java.time.Duration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the backing PostgreSQL-compatible store.
 *
 * <p>{@code host} may carry its own port ({@code db.example.com:6543}); when it does, that port
 * wins over {@code port}. TLS is required whenever the bare hostname ends with
 * {@code tlsHostSuffix}.
 */
@Validated
@ConfigurationProperties(prefix = "app.store")
public record StoreProperties(
        @NotBlank String host,
        @DefaultValue("5432") @Min(1) @Max(65535) int port,
        @DefaultValue("trailerlink") @NotBlank String database,
        String username,
        String password,
        @DefaultValue(".cratedb.net") String tlsHostSuffix,
        @DefaultValue("4") @Min(1) int maxPoolSize,
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("true") boolean heartbeatEnabled,
        @DefaultValue("12h") Duration heartbeatInterval,
        @DefaultValue("30s") Duration heartbeatRetryInitial,
        @DefaultValue("3") @Min(0) int heartbeatMaxRetries,
        @DefaultValue("classpath:db/migration") String migrationLocation
) {

    public String hostname() {
        String trimmed = host.trim();
        int separator = trimmed.lastIndexOf(':');
        return separator > 0 ? trimmed.substring(0, separator) : trimmed;
    }

    public int effectivePort() {
        String trimmed = host.trim();
        int separator = trimmed.lastIndexOf(':');
        if (separator > 0 && separator < trimmed.length() - 1) {
            try {
                return Integer.parseInt(trimmed.substring(separator + 1));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("app.store.host has a malformed port: " + host, ex);
            }
        }
        return port;
    }

    public boolean tlsRequired() {
        return tlsHostSuffix != null
                && !tlsHostSuffix.isBlank()
                && hostname().toLowerCase().endsWith(tlsHostSuffix.trim().toLowerCase());
    }

    public String jdbcUrl() {
        String url = "jdbc:postgresql://" + hostname() + ":" + effectivePort() + "/" + database;
        return tlsRequired() ? url + "?sslmode=require" : url;
    }

    /**
     * Location for log lines; never includes credentials.
     */
    public String describe() {
        return hostname() + ":" + effectivePort() + "/" + database + (tlsRequired() ? " (tls)" : "");
    }
}

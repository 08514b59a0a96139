package com.trailerlink.backend.modules.store.application;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import javax.sql.DataSource;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.TaskScheduler;

import com.trailerlink.backend.global.config.StoreProperties;

/**
 * Owns the connection pool to the backing store, the schema bootstrap and the periodic heartbeat
 * written to {@code store_heartbeat}.
 *
 * <p>Heartbeat failures never escape this class. A failed beat evicts pooled connections, probes
 * the store once, and then retries on an exponential backoff until the next regular beat.
 */
public class StoreConnectionManager implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(StoreConnectionManager.class);

    static final int HEARTBEAT_ROW_ID = 1;
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;
    private static final String POOL_NAME = "trailerlink-store";
    private static final String PRE_SCHEMA_BASELINE = "0";

    private static final String UPDATE_HEARTBEAT_SQL =
            "UPDATE store_heartbeat SET last_heartbeat = ? WHERE id = ?";
    private static final String SEED_HEARTBEAT_SQL = """
            INSERT INTO store_heartbeat (id, last_heartbeat)
            VALUES (?, ?)
            ON CONFLICT (id) DO UPDATE SET last_heartbeat = EXCLUDED.last_heartbeat
            """;

    private final StoreProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile HikariDataSource dataSource;
    private volatile JdbcTemplate jdbcTemplate;
    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile ScheduledFuture<?> retryTask;
    private volatile OffsetDateTime lastHeartbeat;

    public StoreConnectionManager(StoreProperties properties, TaskScheduler taskScheduler, Clock clock) {
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Opens the pool and validates one connection eagerly.
     *
     * @throws IllegalStateException if the store cannot be reached or the manager was closed
     */
    public DataSource connect() {
        synchronized (lifecycleLock) {
            if (closed.get()) {
                throw new IllegalStateException("Store connection manager is already closed");
            }
            if (dataSource != null) {
                return dataSource;
            }
            HikariConfig config = new HikariConfig();
            config.setPoolName(POOL_NAME);
            config.setJdbcUrl(properties.jdbcUrl());
            config.setUsername(properties.username());
            config.setPassword(properties.password());
            config.setMaximumPoolSize(properties.maxPoolSize());
            config.setConnectionTimeout(properties.connectTimeout().toMillis());
            config.setInitializationFailTimeout(1);
            try {
                attach(new HikariDataSource(config));
            } catch (RuntimeException ex) {
                log.error("Failed to connect to store at {}", properties.describe(), ex);
                throw new IllegalStateException("Failed to connect to store at " + properties.describe(), ex);
            }
            log.info("Successfully connected to store at {}", properties.describe());
            return dataSource;
        }
    }

    void attach(HikariDataSource connected) {
        this.dataSource = connected;
        this.jdbcTemplate = new JdbcTemplate(connected);
    }

    /**
     * Creates the store tables if absent and seeds the heartbeat row. Safe to call repeatedly, also
     * against a database that already holds other tables; concurrent starters serialize on Flyway's
     * schema history lock.
     */
    public void ensureSchema() {
        HikariDataSource current = requireConnected();
        try {
            Flyway.configure()
                    .dataSource(current)
                    .locations(properties.migrationLocation())
                    // a store that already holds unrelated tables is baselined below V1 so V1 still runs
                    .baselineOnMigrate(true)
                    .baselineVersion(PRE_SCHEMA_BASELINE)
                    .load()
                    .migrate();
        } catch (FlywayException ex) {
            throw new IllegalStateException("Failed to bring store schema up to date", ex);
        }
        jdbcTemplate.update(SEED_HEARTBEAT_SQL, HEARTBEAT_ROW_ID, OffsetDateTime.now(clock));
        log.info("Store schema ready, heartbeat row initialized");
    }

    /**
     * Writes one heartbeat. Returns {@code false} instead of throwing when the store is unreachable.
     */
    public boolean heartbeat() {
        JdbcTemplate template = this.jdbcTemplate;
        if (template == null || closed.get()) {
            log.warn("Store not connected, skipping heartbeat");
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            int updated = template.update(UPDATE_HEARTBEAT_SQL, now, HEARTBEAT_ROW_ID);
            if (updated == 0) {
                template.update(SEED_HEARTBEAT_SQL, HEARTBEAT_ROW_ID, now);
            }
        } catch (DataAccessException ex) {
            int failures = consecutiveFailures.incrementAndGet();
            log.warn("Failed to send heartbeat (consecutive failures={}): {}", failures, ex.getMessage(), ex);
            reconnect();
            return false;
        }
        lastHeartbeat = now;
        consecutiveFailures.set(0);
        log.info("Heartbeat sent at {}", now);
        return true;
    }

    /**
     * Drops pooled connections so the next borrow dials the store again, then probes it once.
     */
    boolean reconnect() {
        HikariDataSource current = this.dataSource;
        if (current == null || current.isClosed()) {
            return false;
        }
        log.info("Attempting to reconnect to store at {}", properties.describe());
        HikariPoolMXBean pool = current.getHikariPoolMXBean();
        if (pool != null) {
            pool.softEvictConnections();
        }
        try (Connection connection = current.getConnection()) {
            if (connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                log.info("Reconnected to store successfully");
                return true;
            }
            log.warn("Reconnected but store connection failed validation");
            return false;
        } catch (SQLException | RuntimeException ex) {
            log.error("Reconnection to store failed: {}", ex.getMessage());
            return false;
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.heartbeatEnabled()) {
            startHeartbeat(properties.heartbeatInterval());
        } else {
            log.info("Store heartbeat disabled by configuration");
        }
    }

    /**
     * Schedules an immediate heartbeat followed by one every {@code interval} until {@link #close()}.
     * Calling it again while running is a no-op.
     */
    public void startHeartbeat(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("heartbeat interval must be positive: " + interval);
        }
        synchronized (lifecycleLock) {
            if (closed.get()) {
                throw new IllegalStateException("Store connection manager is already closed");
            }
            if (heartbeatTask != null) {
                return;
            }
            heartbeatTask = taskScheduler.scheduleAtFixedRate(this::runHeartbeatCycle, clock.instant(), interval);
            log.info("Heartbeat scheduler started (interval: {})", interval);
        }
    }

    void runHeartbeatCycle() {
        cancelRetry();
        if (!heartbeat()) {
            scheduleRetry(1);
        }
    }

    private void scheduleRetry(int attempt) {
        if (closed.get()) {
            return;
        }
        if (attempt > properties.heartbeatMaxRetries()) {
            log.warn("Heartbeat still failing after {} retries, waiting for the next scheduled beat",
                    properties.heartbeatMaxRetries());
            return;
        }
        Duration delay = retryDelay(attempt);
        synchronized (lifecycleLock) {
            if (closed.get()) {
                return;
            }
            retryTask = taskScheduler.schedule(() -> {
                if (!heartbeat()) {
                    scheduleRetry(attempt + 1);
                }
            }, clock.instant().plus(delay));
        }
        log.info("Heartbeat retry {} scheduled in {}", attempt, delay);
    }

    Duration retryDelay(int attempt) {
        Duration delay = properties.heartbeatRetryInitial().multipliedBy(1L << Math.min(attempt - 1, 16));
        Duration cap = properties.heartbeatInterval();
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    private void cancelRetry() {
        ScheduledFuture<?> pending = retryTask;
        if (pending != null) {
            pending.cancel(false);
            retryTask = null;
        }
    }

    /**
     * Stops the heartbeat, then releases the pool. Idempotent and safe before {@link #connect()}.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (lifecycleLock) {
            ScheduledFuture<?> task = heartbeatTask;
            if (task != null) {
                task.cancel(false);
                heartbeatTask = null;
                log.info("Heartbeat scheduler stopped");
            }
            cancelRetry();
            HikariDataSource current = dataSource;
            if (current != null) {
                current.close();
                log.info("Store connection closed");
            }
        }
    }

    @Override
    public void destroy() {
        close();
    }

    public boolean isOpen() {
        HikariDataSource current = dataSource;
        return !closed.get() && current != null && !current.isClosed();
    }

    public boolean isHeartbeatRunning() {
        return heartbeatTask != null;
    }

    public Optional<OffsetDateTime> lastHeartbeat() {
        return Optional.ofNullable(lastHeartbeat);
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    private HikariDataSource requireConnected() {
        HikariDataSource current = dataSource;
        if (current == null || closed.get()) {
            throw new IllegalStateException("Store is not connected");
        }
        return current;
    }
}

package com.trailerlink.backend.modules.store.application;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports store liveness as seen by the heartbeat, registered under {@code storeHeartbeat}.
 */
@Component
public class StoreHeartbeatHealthIndicator implements HealthIndicator {

    private final StoreConnectionManager storeConnectionManager;

    public StoreHeartbeatHealthIndicator(StoreConnectionManager storeConnectionManager) {
        this.storeConnectionManager = storeConnectionManager;
    }

    @Override
    public Health health() {
        if (!storeConnectionManager.isOpen()) {
            return Health.down()
                    .withDetail("reason", "store connection closed")
                    .build();
        }
        int failures = storeConnectionManager.consecutiveFailures();
        Health.Builder builder = failures > 0 ? Health.down() : Health.up();
        builder.withDetail("consecutiveFailures", failures)
                .withDetail("heartbeatRunning", storeConnectionManager.isHeartbeatRunning());
        storeConnectionManager.lastHeartbeat()
                .ifPresent(at -> builder.withDetail("lastHeartbeat", at.toString()));
        return builder.build();
    }
}

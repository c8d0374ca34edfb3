package com.example.taskboard.realtime.health;

import com.example.taskboard.realtime.config.ShutdownManager;
import com.example.taskboard.realtime.service.ConnectionRegistry;
import com.example.taskboard.realtime.service.SubscriptionStore;
import com.example.taskboard.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports connection and subscription counts; out of service once shutdown begins.
 */
@Component
@RequiredArgsConstructor
public class RealtimeHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionStore subscriptionStore;
    private final ShutdownManager shutdownManager;
    private final AppProperties appProperties;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("instance", appProperties.getService().getName());
        details.put("connections", connectionRegistry.connectedCount());
        details.put("subscriptions", subscriptionStore.subscriptionCount());
        details.put("activeProjects", subscriptionStore.activeProjectCount());

        Health.Builder healthBuilder = shutdownManager.isShuttingDown() ? Health.outOfService() : Health.up();
        return healthBuilder
                .withDetails(details)
                .build();
    }
}

package com.example.taskboard.realtime.config;

import com.example.taskboard.realtime.service.ConnectionRegistry;
import com.example.taskboard.realtime.service.SubscriptionStore;
import com.example.taskboard.shared.util.Constants;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RealtimeMetricsConfig {

    @Bean
    public MeterBinder realtimeGauges(ConnectionRegistry connectionRegistry, SubscriptionStore subscriptionStore) {
        return registry -> {
            Gauge.builder(Constants.Metrics.CONNECTIONS_ACTIVE, connectionRegistry, ConnectionRegistry::connectedCount)
                    .description("Live WebSocket connections on this instance")
                    .register(registry);
            Gauge.builder(Constants.Metrics.SUBSCRIPTIONS_ACTIVE, subscriptionStore, SubscriptionStore::subscriptionCount)
                    .description("User and project subscription pairs")
                    .register(registry);
        };
    }
}

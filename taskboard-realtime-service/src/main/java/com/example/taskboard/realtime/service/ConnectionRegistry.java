package com.example.taskboard.realtime.service;

import com.example.taskboard.realtime.model.OutboundChannel;
import com.example.taskboard.shared.config.AppProperties;
import com.example.taskboard.shared.config.MonitoringConfig;
import com.example.taskboard.shared.event.EventType;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Sinks;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the outbound channel of every live connection, keyed by user id. One live
 * connection per user: registering again displaces the previous channel.
 * <p>
 * Delivery is best-effort. A send to an unknown user, a full channel or a closed
 * channel is dropped and logged; after too many consecutive failures the
 * connection is evicted so its session tears down.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Map<UUID, OutboundChannel> channels = new ConcurrentHashMap<>();

    private final AppProperties appProperties;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    public OutboundChannel register(UUID userId) {
        OutboundChannel channel = new OutboundChannel(userId, appProperties.getRealtime().getChannelCapacity());
        OutboundChannel previous = channels.put(userId, channel);
        if (previous != null) {
            log.info("User {} opened a new connection; displacing the previous one", userId);
            previous.close();
        }
        log.debug("Registered outbound channel for user {} (capacity {})", userId, channel.getCapacity());
        return channel;
    }

    public void unregister(UUID userId) {
        OutboundChannel removed = channels.remove(userId);
        if (removed != null) {
            removed.close();
            log.debug("Unregistered outbound channel for user {}", userId);
        }
    }

    /**
     * Removes the entry only while it still maps to {@code channel}; the channel
     * itself is closed either way.
     *
     * @return whether the registry entry was removed
     */
    public boolean unregister(UUID userId, OutboundChannel channel) {
        boolean removed = channels.remove(userId, channel);
        channel.close();
        if (removed) {
            log.debug("Unregistered outbound channel for user {}", userId);
        }
        return removed;
    }

    /**
     * Removes the connection and cuts its outbound stream without draining the backlog.
     *
     * @return whether a connection was found
     */
    public boolean evict(UUID userId, String reason) {
        OutboundChannel removed = channels.remove(userId);
        if (removed == null) {
            return false;
        }
        removed.evict();
        metricsCollector.incrementCounter(Constants.Metrics.CONNECTIONS_EVICTED, "reason", reason);
        log.warn("Evicted connection of user {} ({})", userId, reason);
        return true;
    }

    /**
     * Best-effort, non-blocking delivery.
     *
     * @return {@code true} if the event was enqueued
     */
    public boolean send(UUID userId, RealtimeEvent event) {
        OutboundChannel channel = channels.get(userId);
        if (channel == null) {
            log.debug("Dropping {} for user {}: not connected", EventType.of(event).getTag(), userId);
            metricsCollector.incrementCounter(Constants.Metrics.EVENTS_DROPPED, "reason", "not_connected");
            return false;
        }
        return deliver(userId, channel, event);
    }

    /**
     * Delivers to one particular connection, and only while it is still the user's
     * registered one. Replies to a displaced session never reach its successor.
     */
    public boolean send(OutboundChannel channel, RealtimeEvent event) {
        UUID userId = channel.getUserId();
        if (!isCurrent(userId, channel)) {
            log.debug("Dropping {} for user {}: connection no longer registered", EventType.of(event).getTag(), userId);
            metricsCollector.incrementCounter(Constants.Metrics.EVENTS_DROPPED, "reason", "displaced");
            return false;
        }
        return deliver(userId, channel, event);
    }

    public boolean isCurrent(UUID userId, OutboundChannel channel) {
        return channels.get(userId) == channel;
    }

    public boolean isConnected(UUID userId) {
        return channels.containsKey(userId);
    }

    public int connectedCount() {
        return channels.size();
    }

    public Set<UUID> connectedUserIds() {
        return new HashSet<>(channels.keySet());
    }

    private boolean deliver(UUID userId, OutboundChannel channel, RealtimeEvent event) {
        String tag = EventType.of(event).getTag();
        Sinks.EmitResult result = channel.offer(event);
        if (result.isSuccess()) {
            channel.recordSuccess();
            metricsCollector.incrementCounter(Constants.Metrics.EVENTS_DELIVERED, "type", tag);
            return true;
        }

        int failCount = channel.recordFailure();
        metricsCollector.incrementCounter(Constants.Metrics.EVENTS_DROPPED, "reason", result.name().toLowerCase());
        log.warn("Failed to deliver {} to user {}. Result: {}. Fail count: {}", tag, userId, result, failCount);

        if (failCount >= appProperties.getRealtime().getMaxConsecutiveDeliveryFailures()
                && channels.remove(userId, channel)) {
            log.warn("Connection of user {} failed {} consecutive deliveries; evicting", userId, failCount);
            channel.evict();
            metricsCollector.incrementCounter(Constants.Metrics.CONNECTIONS_EVICTED, "reason", "delivery_failures");
        }
        return false;
    }
}

package com.example.taskboard.realtime.service;

import com.example.taskboard.shared.aspect.Monitored;
import com.example.taskboard.shared.event.EventType;
import com.example.taskboard.shared.event.RealtimeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.UUID;

/**
 * Fans events out to the connections subscribed to a project.
 * <p>
 * The subscriber set is read once per call; a connection that subscribes or
 * unsubscribes concurrently may or may not get the in-flight event.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("router")
public class BroadcastRouter {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionStore subscriptionStore;

    /**
     * @param excludeUser user to skip, typically the one whose action produced the event
     * @return number of connections the event was enqueued for
     */
    public int broadcastToProject(UUID projectId, RealtimeEvent event, @Nullable UUID excludeUser) {
        Set<UUID> subscribers = subscriptionStore.subscribersOf(projectId);
        int delivered = 0;
        for (UUID userId : subscribers) {
            if (userId.equals(excludeUser)) {
                continue;
            }
            if (connectionRegistry.send(userId, event)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} to project {}: {}/{} subscribers reached (excluded: {})",
                EventType.of(event).getTag(), projectId, delivered, subscribers.size(), excludeUser);
        return delivered;
    }

    /** Direct delivery, bypassing subscriptions. */
    public boolean sendToUser(UUID userId, RealtimeEvent event) {
        return connectionRegistry.send(userId, event);
    }
}

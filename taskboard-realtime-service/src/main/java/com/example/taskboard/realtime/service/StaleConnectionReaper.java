package com.example.taskboard.realtime.service;

import com.example.taskboard.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Evicts connections that have shown no sign of life for longer than the client
 * timeout. Eviction ends the session, whose teardown then cleans up.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StaleConnectionReaper {

    private final SubscriptionStore subscriptionStore;
    private final ConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${taskboard.realtime.reaper-interval:60000}",
               initialDelayString = "${taskboard.realtime.reaper-interval:60000}")
    public void cleanupStaleConnections() {
        try {
            int evicted = reap();
            if (evicted > 0) {
                log.info("Stale connection cleanup evicted {} connections", evicted);
            }
        } catch (Exception e) {
            log.error("Error during stale connection cleanup job", e);
        }
    }

    /**
     * @return how many connections were evicted
     */
    public int reap() {
        Instant threshold = clock.instant().minusMillis(appProperties.getRealtime().getClientTimeoutThreshold());
        List<UUID> stale = subscriptionStore.staleConnections(threshold);
        if (stale.isEmpty()) {
            log.trace("No stale connections found");
            return 0;
        }
        log.warn("Found {} stale connections to clean up", stale.size());
        int evicted = 0;
        for (UUID userId : stale) {
            if (connectionRegistry.evict(userId, "stale")) {
                evicted++;
            }
        }
        return evicted;
    }
}

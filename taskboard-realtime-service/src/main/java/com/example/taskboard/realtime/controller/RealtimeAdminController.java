package com.example.taskboard.realtime.controller;

import com.example.taskboard.realtime.dto.ConnectionInfoResponse;
import com.example.taskboard.realtime.dto.RealtimeStatsResponse;
import com.example.taskboard.realtime.service.ConnectionRegistry;
import com.example.taskboard.realtime.service.SubscriptionStore;
import com.example.taskboard.shared.config.AppProperties;
import com.example.taskboard.shared.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.ZonedDateTime;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/realtime")
@RequiredArgsConstructor
@Slf4j
public class RealtimeAdminController {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionStore subscriptionStore;
    private final AppProperties appProperties;

    @GetMapping("/stats")
    public ResponseEntity<RealtimeStatsResponse> getStats() {
        RealtimeStatsResponse stats = RealtimeStatsResponse.builder()
                .instance(appProperties.getService().getName())
                .connectedUsers(connectionRegistry.connectedCount())
                .trackedConnections(subscriptionStore.connectionCount())
                .activeSubscriptions(subscriptionStore.subscriptionCount())
                .activeProjects(subscriptionStore.activeProjectCount())
                .timestamp(ZonedDateTime.now())
                .build();
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/connected/{userId}")
    public ResponseEntity<Boolean> isUserConnected(@PathVariable UUID userId) {
        return ResponseEntity.ok(connectionRegistry.isConnected(userId));
    }

    @GetMapping("/connections/{userId}")
    public ResponseEntity<ConnectionInfoResponse> getConnection(@PathVariable UUID userId) {
        return subscriptionStore.find(userId)
                .map(info -> ConnectionInfoResponse.from(info, subscriptionStore.projectsOf(info)))
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("No live connection for user " + userId));
    }

    @GetMapping("/projects/{projectId}/subscribers")
    public ResponseEntity<Set<UUID>> getSubscribers(@PathVariable UUID projectId) {
        return ResponseEntity.ok(subscriptionStore.subscribersOf(projectId));
    }

    @DeleteMapping("/connections/{userId}")
    public ResponseEntity<Void> disconnect(@PathVariable UUID userId) {
        log.info("Administrative disconnect requested for user {}", userId);
        if (!connectionRegistry.evict(userId, "admin")) {
            throw new ResourceNotFoundException("No live connection for user " + userId);
        }
        return ResponseEntity.noContent().build();
    }
}

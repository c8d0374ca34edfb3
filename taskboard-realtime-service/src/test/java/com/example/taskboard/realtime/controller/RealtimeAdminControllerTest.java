package com.example.taskboard.realtime.controller;

import com.example.taskboard.realtime.model.ConnectionInfo;
import com.example.taskboard.realtime.service.ConnectionRegistry;
import com.example.taskboard.realtime.service.SubscriptionStore;
import com.example.taskboard.shared.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(RealtimeAdminController.class)
class RealtimeAdminControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ConnectionRegistry connectionRegistry;

    @MockBean
    private SubscriptionStore subscriptionStore;

    @MockBean
    private AppProperties appProperties;

    private final UUID userId = UUID.randomUUID();

    @Test
    void statsCombineRegistryAndStoreCounts() {
        AppProperties.Service service = new AppProperties.Service();
        service.setName("realtime-test");
        when(appProperties.getService()).thenReturn(service);
        when(connectionRegistry.connectedCount()).thenReturn(3);
        when(subscriptionStore.connectionCount()).thenReturn(3);
        when(subscriptionStore.subscriptionCount()).thenReturn(5);
        when(subscriptionStore.activeProjectCount()).thenReturn(2);

        webTestClient.get().uri("/api/realtime/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.instance").isEqualTo("realtime-test")
                .jsonPath("$.connected_users").isEqualTo(3)
                .jsonPath("$.active_subscriptions").isEqualTo(5)
                .jsonPath("$.active_projects").isEqualTo(2);
    }

    @Test
    void connectionDetailsOfLiveUser() {
        UUID project = UUID.randomUUID();
        ConnectionInfo info = new ConnectionInfo(userId, Instant.parse("2024-03-01T09:00:00Z"));
        when(subscriptionStore.find(userId)).thenReturn(Optional.of(info));
        when(subscriptionStore.projectsOf(info)).thenReturn(Set.of(project));

        webTestClient.get().uri("/api/realtime/connections/{userId}", userId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.user_id").isEqualTo(userId.toString())
                .jsonPath("$.subscribed_projects[0]").isEqualTo(project.toString())
                .jsonPath("$.connected_at").isEqualTo("2024-03-01T09:00:00Z");
    }

    @Test
    void unknownConnectionIsNotFound() {
        when(subscriptionStore.find(userId)).thenReturn(Optional.empty());

        webTestClient.get().uri("/api/realtime/connections/{userId}", userId)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.path").isEqualTo("/api/realtime/connections/" + userId);
    }

    @Test
    void malformedUserIdIsBadRequest() {
        webTestClient.get().uri("/api/realtime/connected/not-a-uuid")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void disconnectEvictsLiveConnection() {
        when(connectionRegistry.evict(eq(userId), any())).thenReturn(true);

        webTestClient.delete().uri("/api/realtime/connections/{userId}", userId)
                .exchange()
                .expectStatus().isNoContent();

        verify(connectionRegistry).evict(userId, "admin");
    }

    @Test
    void disconnectOfUnknownUserIsNotFound() {
        when(connectionRegistry.evict(eq(userId), any())).thenReturn(false);

        webTestClient.delete().uri("/api/realtime/connections/{userId}", userId)
                .exchange()
                .expectStatus().isNotFound();
    }
}

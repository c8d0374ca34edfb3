package com.example.taskboard.realtime.service;

import com.example.taskboard.realtime.model.ConnectionInfo;
import com.example.taskboard.realtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionStoreTest {

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID project = UUID.randomUUID();

    private MutableClock clock;
    private SubscriptionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        store = new SubscriptionStore(clock);
    }

    @Test
    void subscribeReportsOnlyNewSubscriptions() {
        store.open(alice);

        assertThat(store.subscribe(alice, project)).isTrue();
        assertThat(store.subscribe(alice, project)).isFalse();

        assertThat(store.subscribedProjectsOf(alice)).containsExactly(project);
        assertThat(store.subscribersOf(project)).containsExactly(alice);
        assertThat(store.subscriptionCount()).isEqualTo(1);
    }

    @Test
    void replacedEntryCannotChangeTheLiveOne() {
        ConnectionInfo displaced = store.open(alice);
        ConnectionInfo live = store.open(alice);
        store.subscribe(live, project);

        assertThat(store.unsubscribe(displaced, project)).isFalse();
        assertThat(store.subscribe(displaced, UUID.randomUUID())).isFalse();

        assertThat(store.isLive(displaced)).isFalse();
        assertThat(store.isSubscribed(displaced, project)).isFalse();
        assertThat(store.isSubscribed(live, project)).isTrue();
        assertThat(store.subscribedProjectsOf(alice)).containsExactly(project);
        assertThat(store.subscriptionCount()).isEqualTo(1);
    }

    @Test
    void subscribeWithoutLiveEntryIsIgnored() {
        assertThat(store.subscribe(alice, project)).isFalse();
        assertThat(store.subscribersOf(project)).isEmpty();
    }

    @Test
    void unsubscribeOfUnknownProjectIsANoOp() {
        store.open(alice);

        assertThat(store.unsubscribe(alice, project)).isFalse();
        assertThat(store.unsubscribe(bob, project)).isFalse();
    }

    @Test
    void unsubscribeRemovesFromIndexAndDropsEmptyProjects() {
        store.open(alice);
        store.open(bob);
        store.subscribe(alice, project);
        store.subscribe(bob, project);

        assertThat(store.unsubscribe(alice, project)).isTrue();
        assertThat(store.subscribersOf(project)).containsExactly(bob);

        store.unsubscribe(bob, project);
        assertThat(store.activeProjectCount()).isZero();
    }

    @Test
    void closeRemovesEntryAndAllItsSubscriptions() {
        UUID other = UUID.randomUUID();
        ConnectionInfo info = store.open(alice);
        store.subscribe(alice, project);
        store.subscribe(alice, other);

        assertThat(store.close(alice, info)).isTrue();

        assertThat(store.find(alice)).isEmpty();
        assertThat(store.subscribersOf(project)).isEmpty();
        assertThat(store.subscribersOf(other)).isEmpty();
        assertThat(store.connectionCount()).isZero();
    }

    @Test
    void reopeningReplacesDisplacedEntry() {
        ConnectionInfo displaced = store.open(alice);
        store.subscribe(alice, project);

        ConnectionInfo current = store.open(alice);

        assertThat(store.subscribersOf(project)).isEmpty();
        assertThat(store.projectsOf(displaced)).containsExactly(project);
        assertThat(store.close(alice, displaced)).isFalse();
        assertThat(store.find(alice)).containsSame(current);
    }

    @Test
    void subscribedProjectsOfIsASnapshot() {
        store.open(alice);
        store.subscribe(alice, project);

        var snapshot = store.subscribedProjectsOf(alice);
        store.unsubscribe(alice, project);

        assertThat(snapshot).containsExactly(project);
    }

    @Test
    void staleConnectionsAreThoseSilentSinceBeforeThreshold() {
        store.open(alice);
        store.open(bob);

        clock.advance(Duration.ofSeconds(60));
        store.touch(bob);
        clock.advance(Duration.ofSeconds(40));

        Instant threshold = clock.instant().minusSeconds(90);
        assertThat(store.staleConnections(threshold)).containsExactly(alice);
    }

    @Test
    void subscribeCountsAsActivity() {
        store.open(alice);
        clock.advance(Duration.ofSeconds(30));

        store.subscribe(alice, project);

        assertThat(store.find(alice).orElseThrow().getLastSeen()).isEqualTo(clock.instant());
    }

    @Test
    void concurrentChangesKeepIndexConsistent() throws Exception {
        int users = 16;
        List<UUID> projects = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        List<UUID> userIds = new ArrayList<>();
        for (int i = 0; i < users; i++) {
            UUID userId = UUID.randomUUID();
            userIds.add(userId);
            store.open(userId);
        }

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (UUID userId : userIds) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int round = 0; round < 200; round++) {
                    UUID p = projects.get(round % projects.size());
                    store.subscribe(userId, p);
                    if (round % 2 == 0) {
                        store.unsubscribe(userId, p);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        int fromUsers = userIds.stream().mapToInt(u -> store.subscribedProjectsOf(u).size()).sum();
        assertThat(store.subscriptionCount()).isEqualTo(fromUsers);
        for (UUID p : projects) {
            for (UUID userId : store.subscribersOf(p)) {
                assertThat(store.isSubscribed(userId, p)).isTrue();
            }
        }
    }
}

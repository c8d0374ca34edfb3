package com.example.taskboard.realtime.service;

import com.example.taskboard.realtime.model.ConnectionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Which projects each connected user currently wants events for, plus when the
 * connection last showed signs of life.
 * <p>
 * Keeps a project-to-subscribers index next to the per-user sets so fan-out only
 * visits a project's own subscribers. Both maps change together under one write
 * lock; every read hands out a copy. No authorization happens here: callers check
 * membership before {@link #subscribe}.
 */
@Component
@Slf4j
public class SubscriptionStore {

    private final Map<UUID, ConnectionInfo> connections = new HashMap<>();
    private final Map<UUID, Set<UUID>> subscribersByProject = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public SubscriptionStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates an empty entry for a freshly registered connection. An entry left by a
     * displaced connection of the same user is replaced and its subscriptions dropped
     * from the index.
     */
    public ConnectionInfo open(UUID userId) {
        ConnectionInfo info = new ConnectionInfo(userId, clock.instant());
        lock.writeLock().lock();
        try {
            ConnectionInfo previous = connections.put(userId, info);
            if (previous != null) {
                unindex(userId, previous);
                log.debug("Replaced subscription entry of displaced connection for user {}", userId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        return info;
    }

    /**
     * Removes the entry if it is still {@code info}. A session that was displaced
     * must not remove its successor's entry.
     *
     * @return whether the entry was removed
     */
    public boolean close(UUID userId, ConnectionInfo info) {
        lock.writeLock().lock();
        try {
            if (connections.get(userId) != info) {
                return false;
            }
            connections.remove(userId);
            unindex(userId, info);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Idempotent.
     *
     * @return {@code true} if the project was newly added, {@code false} if it was
     * already present or the user has no live entry
     */
    public boolean subscribe(UUID userId, UUID projectId) {
        lock.writeLock().lock();
        try {
            return addSubscription(connections.get(userId), projectId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Like {@link #subscribe(UUID, UUID)}, but only while {@code info} is still the
     * user's live entry. A displaced connection cannot subscribe its successor.
     */
    public boolean subscribe(ConnectionInfo info, UUID projectId) {
        lock.writeLock().lock();
        try {
            return holds(info) && addSubscription(info, projectId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Idempotent.
     *
     * @return {@code true} if the project was present and has been removed
     */
    public boolean unsubscribe(UUID userId, UUID projectId) {
        lock.writeLock().lock();
        try {
            return removeSubscription(connections.get(userId), projectId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** No-op unless {@code info} is still the user's live entry. */
    public boolean unsubscribe(ConnectionInfo info, UUID projectId) {
        lock.writeLock().lock();
        try {
            return holds(info) && removeSubscription(info, projectId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Whether {@code info} is the user's live entry and holds {@code projectId}. */
    public boolean isSubscribed(ConnectionInfo info, UUID projectId) {
        lock.readLock().lock();
        try {
            return holds(info) && info.isSubscribedTo(projectId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isSubscribed(UUID userId, UUID projectId) {
        lock.readLock().lock();
        try {
            ConnectionInfo info = connections.get(userId);
            return info != null && info.isSubscribedTo(projectId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<UUID> subscribedProjectsOf(UUID userId) {
        lock.readLock().lock();
        try {
            ConnectionInfo info = connections.get(userId);
            return info == null ? Set.of() : Set.copyOf(info.projectsView());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Projects held by one particular entry, whether or not it is still the live one. */
    public Set<UUID> projectsOf(ConnectionInfo info) {
        lock.readLock().lock();
        try {
            return Set.copyOf(info.projectsView());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<UUID> subscribersOf(UUID projectId) {
        lock.readLock().lock();
        try {
            Set<UUID> subscribers = subscribersByProject.get(projectId);
            return subscribers == null ? Set.of() : Set.copyOf(subscribers);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void touch(UUID userId) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            ConnectionInfo info = connections.get(userId);
            if (info != null) {
                info.touch(now);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ConnectionInfo> find(UUID userId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Users whose connection has been silent since before {@code threshold}. */
    public List<UUID> staleConnections(Instant threshold) {
        lock.readLock().lock();
        try {
            return connections.values().stream()
                    .filter(info -> info.getLastSeen().isBefore(threshold))
                    .map(ConnectionInfo::getUserId)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriptionCount() {
        lock.readLock().lock();
        try {
            return subscribersByProject.values().stream().mapToInt(Set::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int activeProjectCount() {
        lock.readLock().lock();
        try {
            return subscribersByProject.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Whether {@code info} is still the entry of its user. */
    public boolean isLive(ConnectionInfo info) {
        lock.readLock().lock();
        try {
            return holds(info);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean holds(ConnectionInfo info) {
        return connections.get(info.getUserId()) == info;
    }

    private boolean addSubscription(ConnectionInfo info, UUID projectId) {
        if (info == null) {
            return false;
        }
        info.touch(clock.instant());
        if (!info.addProject(projectId)) {
            return false;
        }
        subscribersByProject.computeIfAbsent(projectId, k -> new HashSet<>()).add(info.getUserId());
        return true;
    }

    private boolean removeSubscription(ConnectionInfo info, UUID projectId) {
        if (info == null || !info.removeProject(projectId)) {
            return false;
        }
        info.touch(clock.instant());
        removeFromIndex(projectId, info.getUserId());
        return true;
    }

    private void unindex(UUID userId, ConnectionInfo info) {
        for (UUID projectId : info.projectsView()) {
            removeFromIndex(projectId, userId);
        }
    }

    private void removeFromIndex(UUID projectId, UUID userId) {
        Set<UUID> subscribers = subscribersByProject.get(projectId);
        if (subscribers != null) {
            subscribers.remove(userId);
            if (subscribers.isEmpty()) {
                subscribersByProject.remove(projectId);
            }
        }
    }
}

package com.example.taskboard.realtime.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Subscription state of one live connection. Mutated only by
 * {@link com.example.taskboard.realtime.service.SubscriptionStore}, which guards the
 * project set with its own lock.
 */
@Getter
@ToString(exclude = "subscribedProjects")
public class ConnectionInfo {

    private final UUID userId;
    private final Instant connectedAt;
    @Getter(AccessLevel.NONE)
    private final Set<UUID> subscribedProjects = new HashSet<>();
    private volatile Instant lastSeen;

    public ConnectionInfo(UUID userId, Instant now) {
        this.userId = userId;
        this.connectedAt = now;
        this.lastSeen = now;
    }

    public boolean addProject(UUID projectId) {
        return subscribedProjects.add(projectId);
    }

    public boolean removeProject(UUID projectId) {
        return subscribedProjects.remove(projectId);
    }

    public boolean isSubscribedTo(UUID projectId) {
        return subscribedProjects.contains(projectId);
    }

    /** Caller must hold the store's lock. */
    public Set<UUID> projectsView() {
        return Collections.unmodifiableSet(subscribedProjects);
    }

    public void touch(Instant now) {
        this.lastSeen = now;
    }
}

package com.example.taskboard.realtime.model;

import com.example.taskboard.shared.model.UserSummary;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-side state of one authenticated connection, from registration to teardown.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor
public class RealtimeSession {

    @ToString.Include
    private final String sessionId;
    private final UserSummary user;
    private final OutboundChannel channel;
    private final ConnectionInfo connectionInfo;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean();

    @ToString.Include
    public UUID getUserId() {
        return user.getId();
    }

    /**
     * @return {@code true} for exactly one caller, the one that must run teardown
     */
    public boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }
}

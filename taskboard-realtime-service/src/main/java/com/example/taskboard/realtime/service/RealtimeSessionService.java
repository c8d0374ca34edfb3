package com.example.taskboard.realtime.service;

import com.example.taskboard.realtime.model.ConnectionInfo;
import com.example.taskboard.realtime.model.OutboundChannel;
import com.example.taskboard.realtime.model.RealtimeSession;
import com.example.taskboard.shared.collaborator.IdentityVerifier;
import com.example.taskboard.shared.collaborator.MembershipOracle;
import com.example.taskboard.shared.collaborator.UserIdentity;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.exception.AuthenticationFailureException;
import com.example.taskboard.shared.exception.CollaboratorUnavailableException;
import com.example.taskboard.shared.util.Constants.ClientMessages;
import com.example.taskboard.shared.util.Constants.Collaborators;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;

/**
 * Session lifecycle and the state transitions driven by client messages:
 * authentication, subscribe, unsubscribe, typing relays and teardown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RealtimeSessionService {

    private final IdentityVerifier identityVerifier;
    private final MembershipOracle membershipOracle;
    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionStore subscriptionStore;
    private final BroadcastRouter broadcastRouter;
    private final Scheduler collaboratorScheduler;
    private final Clock clock;

    /**
     * Errors with {@link AuthenticationFailureException} when the credential is absent,
     * rejected, or cannot be checked. The exception message is safe to show the client.
     */
    public Mono<UserIdentity> authenticate(@Nullable String credential) {
        if (credential == null || credential.isBlank()) {
            return Mono.error(new AuthenticationFailureException(ClientMessages.NO_TOKEN));
        }
        return Mono.fromCallable(() -> identityVerifier.verify(credential))
                .subscribeOn(collaboratorScheduler)
                .onErrorMap(e -> !(e instanceof AuthenticationFailureException), e -> {
                    log.error("Identity verification failed unexpectedly: {}", e.getMessage());
                    return new AuthenticationFailureException(ClientMessages.AUTH_UNAVAILABLE,
                            new CollaboratorUnavailableException(Collaborators.IDENTITY_VERIFIER, e));
                });
    }

    public RealtimeSession open(UserIdentity identity, String sessionId) {
        UUID userId = identity.userId();
        ConnectionInfo info = subscriptionStore.open(userId);
        OutboundChannel channel = connectionRegistry.register(userId);
        RealtimeSession session = new RealtimeSession(sessionId, identity.toSummary(), channel, info);
        log.info("User {} connected (session {})", userId, sessionId);
        return session;
    }

    /**
     * Checks membership, then records the subscription, tells the project's other
     * subscribers and acknowledges. Only a newly added subscription produces a
     * {@code UserJoined}; every successful call is acknowledged.
     */
    public Mono<Void> subscribe(RealtimeSession session, UUID projectId) {
        UUID userId = session.getUserId();
        return checkMembership(projectId, userId)
                .doOnNext(isMember -> {
                    if (isMember) {
                        completeSubscription(session, projectId);
                    } else {
                        log.warn("User {} denied subscription to project {}: not a member", userId, projectId);
                        reply(session, new RealtimeEvent.SubscriptionError(ClientMessages.NOT_A_MEMBER));
                    }
                })
                .onErrorResume(CollaboratorUnavailableException.class, e -> {
                    log.error("Membership check for user {} on project {} failed: {}", userId, projectId, e.getMessage());
                    reply(session, new RealtimeEvent.SubscriptionError(ClientMessages.MEMBERSHIP_UNAVAILABLE));
                    return Mono.empty();
                })
                .then();
    }

    /**
     * No-op, with no presence event, if this session was not subscribed or has been
     * displaced by a newer connection.
     */
    public void unsubscribe(RealtimeSession session, UUID projectId) {
        UUID userId = session.getUserId();
        if (!subscriptionStore.unsubscribe(session.getConnectionInfo(), projectId)) {
            log.debug("Session {} unsubscribed from project {} without a subscription; ignoring", session.getSessionId(), projectId);
            return;
        }
        broadcastRouter.broadcastToProject(projectId,
                new RealtimeEvent.UserLeft(session.getUser(), projectId, clock.instant()), userId);
        log.debug("User {} unsubscribed from project {}", userId, projectId);
    }

    /**
     * Forwards a typing indicator unchanged to the project's other subscribers. The
     * sender must itself be subscribed to the project.
     */
    public <E extends RealtimeEvent & RealtimeEvent.ProjectScoped> void relayTyping(RealtimeSession session, E indicator) {
        UUID userId = session.getUserId();
        UUID projectId = indicator.projectId();
        if (!subscriptionStore.isSubscribed(session.getConnectionInfo(), projectId)) {
            log.warn("User {} sent a typing indicator for project {} without a subscription", userId, projectId);
            reply(session, new RealtimeEvent.Error(ClientMessages.NOT_SUBSCRIBED));
            return;
        }
        broadcastRouter.broadcastToProject(projectId, indicator, userId);
    }

    public void touch(RealtimeSession session) {
        if (isCurrent(session)) {
            subscriptionStore.touch(session.getUserId());
        }
    }

    /**
     * Whether the session still owns its user's registry and store entries. A session
     * displaced by a newer connection of the same user stays open until its backlog
     * drains, but must no longer act for that user.
     */
    public boolean isCurrent(RealtimeSession session) {
        return !session.isClosed()
                && connectionRegistry.isCurrent(session.getUserId(), session.getChannel())
                && subscriptionStore.isLive(session.getConnectionInfo());
    }

    /** Sends to this session's own channel; dropped once the session is displaced or closed. */
    public boolean reply(RealtimeSession session, RealtimeEvent event) {
        return connectionRegistry.send(session.getChannel(), event);
    }

    /**
     * Idempotent teardown; whichever of the session's loops ends first runs it.
     * Emits one {@code UserLeft} per subscribed project, then unregisters the channel
     * and drops the subscription entry. When a newer connection of the same user has
     * displaced this one, projects that connection still watches get no
     * {@code UserLeft}.
     */
    public void close(RealtimeSession session, String reason) {
        if (!session.markClosed()) {
            return;
        }
        UUID userId = session.getUserId();
        ConnectionInfo info = session.getConnectionInfo();

        boolean displaced = subscriptionStore.find(userId).map(current -> current != info).orElse(false);
        Set<UUID> stillWatched = displaced ? subscriptionStore.subscribedProjectsOf(userId) : Set.of();

        for (UUID projectId : subscriptionStore.projectsOf(info)) {
            if (!stillWatched.contains(projectId)) {
                broadcastRouter.broadcastToProject(projectId,
                        new RealtimeEvent.UserLeft(session.getUser(), projectId, clock.instant()), userId);
            }
        }

        connectionRegistry.unregister(userId, session.getChannel());
        subscriptionStore.close(userId, info);
        log.info("User {} disconnected (session {}, reason: {}{})", userId, session.getSessionId(), reason,
                displaced ? ", displaced" : "");
    }

    private void completeSubscription(RealtimeSession session, UUID projectId) {
        UUID userId = session.getUserId();
        if (!isCurrent(session)) {
            log.debug("Session {} closed or displaced during membership check; dropping subscription to {}",
                    session.getSessionId(), projectId);
            return;
        }
        if (subscriptionStore.subscribe(session.getConnectionInfo(), projectId)) {
            broadcastRouter.broadcastToProject(projectId,
                    new RealtimeEvent.UserJoined(session.getUser(), projectId, clock.instant()), userId);
            log.debug("User {} subscribed to project {}", userId, projectId);
        } else {
            log.debug("User {} re-subscribed to project {}; already subscribed", userId, projectId);
        }
        reply(session, new RealtimeEvent.SubscriptionSuccess(projectId));
    }

    private Mono<Boolean> checkMembership(UUID projectId, UUID userId) {
        return Mono.fromCallable(() -> membershipOracle.isProjectMember(projectId, userId))
                .subscribeOn(collaboratorScheduler)
                .onErrorMap(e -> new CollaboratorUnavailableException(Collaborators.MEMBERSHIP_ORACLE, e));
    }
}

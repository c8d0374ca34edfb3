package com.example.taskboard.shared.collaborator;

import java.util.UUID;

/**
 * Answers whether a user may see a project's events. Consulted once per subscribe;
 * later membership changes are not pushed into live subscriptions.
 * <p>
 * Implementations may block and may throw when their backing store is unreachable.
 */
@FunctionalInterface
public interface MembershipOracle {

    boolean isProjectMember(UUID projectId, UUID userId);
}

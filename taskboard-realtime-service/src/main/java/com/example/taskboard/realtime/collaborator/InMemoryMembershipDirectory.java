package com.example.taskboard.realtime.collaborator;

import com.example.taskboard.shared.collaborator.MembershipOracle;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Membership kept in memory, seeded from {@code taskboard.membership.grants}. Used
 * when the host application does not provide its own {@link MembershipOracle}.
 * <p>
 * Revoking a grant does not end subscriptions that were already accepted.
 */
@Slf4j
public class InMemoryMembershipDirectory implements MembershipOracle {

    private final Map<UUID, Set<UUID>> membersByProject = new ConcurrentHashMap<>();

    public InMemoryMembershipDirectory(Map<UUID, List<UUID>> seed) {
        seed.forEach((projectId, members) -> members.forEach(userId -> grant(projectId, userId)));
        log.info("Membership directory seeded with {} projects", membersByProject.size());
    }

    @Override
    public boolean isProjectMember(UUID projectId, UUID userId) {
        Set<UUID> members = membersByProject.get(projectId);
        return members != null && members.contains(userId);
    }

    public void grant(UUID projectId, UUID userId) {
        membersByProject.computeIfAbsent(projectId, k -> ConcurrentHashMap.newKeySet()).add(userId);
    }

    public void revoke(UUID projectId, UUID userId) {
        membersByProject.computeIfPresent(projectId, (k, members) -> {
            members.remove(userId);
            return members.isEmpty() ? null : members;
        });
    }
}

package com.example.taskboard.shared.collaborator;

import com.example.taskboard.shared.model.UserSummary;

import java.util.UUID;

public record UserIdentity(UUID userId, String username, String displayName) {

    public UserSummary toSummary() {
        return UserSummary.builder()
                .id(userId)
                .username(username)
                .displayName(displayName)
                .build();
    }
}

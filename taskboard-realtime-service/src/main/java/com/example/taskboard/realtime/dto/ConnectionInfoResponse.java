package com.example.taskboard.realtime.dto;

import com.example.taskboard.realtime.model.ConnectionInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionInfoResponse {
    private UUID userId;
    private Set<UUID> subscribedProjects;
    private Instant connectedAt;
    private Instant lastSeen;

    public static ConnectionInfoResponse from(ConnectionInfo info, Set<UUID> subscribedProjects) {
        return ConnectionInfoResponse.builder()
                .userId(info.getUserId())
                .subscribedProjects(subscribedProjects)
                .connectedAt(info.getConnectedAt())
                .lastSeen(info.getLastSeen())
                .build();
    }
}

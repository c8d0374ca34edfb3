package com.example.taskboard.realtime.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeStatsResponse {
    private String instance;
    private int connectedUsers;
    private int trackedConnections;
    private int activeSubscriptions;
    private int activeProjects;
    private ZonedDateTime timestamp;
}

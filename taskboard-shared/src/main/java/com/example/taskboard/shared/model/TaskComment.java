package com.example.taskboard.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskComment {
    private UUID id;
    private UUID taskId;
    private UUID userId;
    private String content;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}

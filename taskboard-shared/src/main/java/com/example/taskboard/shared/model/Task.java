package com.example.taskboard.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a task as the CRUD layer stored it, carried inside task events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private UUID id;
    private String title;
    private String description;
    private UUID projectId;
    private UUID createdBy;
    private UUID assignedTo;
    private TaskStatus status;
    private TaskPriority priority;
    private OffsetDateTime dueDate;
    private List<String> tags;
    private int position; // drag-and-drop ordering within a column
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}

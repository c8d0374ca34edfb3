package com.example.taskboard.shared.event;

import com.example.taskboard.shared.model.Board;
import com.example.taskboard.shared.model.Task;
import com.example.taskboard.shared.model.TaskComment;
import com.example.taskboard.shared.model.TaskStatus;
import com.example.taskboard.shared.model.UserSummary;

import java.time.Instant;
import java.util.UUID;

/**
 * Every message that travels over a real-time connection, in either direction.
 * <p>
 * On the wire each variant is a frame of the form {@code {"type": "<Tag>", "data": {...}}};
 * see {@link EventType} for the tags and {@link RealtimeEventCodec} for the encoding.
 */
public sealed interface RealtimeEvent {

    /** Kinds a client is allowed to send. */
    interface ClientMessage {
    }

    /** Kinds that belong to exactly one project. */
    interface ProjectScoped {
        UUID projectId();
    }

    // Authentication

    record AuthenticationSuccess(UUID userId) implements RealtimeEvent {
    }

    record AuthenticationError(String message) implements RealtimeEvent {
    }

    // Subscriptions

    record Subscribe(UUID projectId) implements RealtimeEvent, ClientMessage, ProjectScoped {
    }

    record Unsubscribe(UUID projectId) implements RealtimeEvent, ClientMessage, ProjectScoped {
    }

    record SubscriptionSuccess(UUID projectId) implements RealtimeEvent, ProjectScoped {
    }

    record SubscriptionError(String message) implements RealtimeEvent {
    }

    // Tasks

    record TaskCreated(Task task, UUID projectId, UserSummary user) implements RealtimeEvent, ProjectScoped {
    }

    record TaskUpdated(Task task, UUID projectId, UserSummary user) implements RealtimeEvent, ProjectScoped {
    }

    record TaskDeleted(UUID taskId, UUID projectId) implements RealtimeEvent, ProjectScoped {
    }

    record TaskMoved(UUID taskId, TaskStatus fromStatus, TaskStatus toStatus, int position,
                     UUID projectId, UserSummary user) implements RealtimeEvent, ProjectScoped {
    }

    // Boards

    record BoardCreated(Board board, UUID projectId, UserSummary user) implements RealtimeEvent, ProjectScoped {
    }

    record BoardUpdated(Board board, UUID projectId, UserSummary user) implements RealtimeEvent, ProjectScoped {
    }

    record BoardDeleted(UUID boardId, UUID projectId) implements RealtimeEvent, ProjectScoped {
    }

    // Comments

    record CommentCreated(TaskComment comment, UUID taskId, UUID projectId, UserSummary user)
            implements RealtimeEvent, ProjectScoped {
    }

    record CommentDeleted(UUID commentId, UUID taskId, UUID projectId) implements RealtimeEvent, ProjectScoped {
    }

    // Presence

    record UserJoined(UserSummary user, UUID projectId, Instant timestamp) implements RealtimeEvent, ProjectScoped {
    }

    record UserLeft(UserSummary user, UUID projectId, Instant timestamp) implements RealtimeEvent, ProjectScoped {
    }

    record UserTyping(UserSummary user, UUID taskId, UUID projectId, Instant timestamp)
            implements RealtimeEvent, ClientMessage, ProjectScoped {
    }

    record UserStoppedTyping(UserSummary user, UUID taskId, UUID projectId, Instant timestamp)
            implements RealtimeEvent, ClientMessage, ProjectScoped {
    }

    // Control

    record Error(String message) implements RealtimeEvent {
    }

    record Pong() implements RealtimeEvent, ClientMessage {
    }
}

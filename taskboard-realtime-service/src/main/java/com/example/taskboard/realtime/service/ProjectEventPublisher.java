package com.example.taskboard.realtime.service;

import com.example.taskboard.shared.aspect.Monitored;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.model.Board;
import com.example.taskboard.shared.model.Task;
import com.example.taskboard.shared.model.TaskComment;
import com.example.taskboard.shared.model.TaskStatus;
import com.example.taskboard.shared.model.UserSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for the CRUD layer. Called synchronously right after a mutation
 * commits; the acting user is excluded so their other tabs are updated but the
 * originating one gets no echo of its own action.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("publisher")
public class ProjectEventPublisher {

    private final BroadcastRouter broadcastRouter;

    public <E extends RealtimeEvent & RealtimeEvent.ProjectScoped> int publish(E event, @Nullable UUID excludeUser) {
        return broadcastRouter.broadcastToProject(event.projectId(), event, excludeUser);
    }

    public boolean sendToUser(UUID userId, RealtimeEvent event) {
        return broadcastRouter.sendToUser(userId, event);
    }

    public int taskCreated(Task task, UserSummary actor) {
        return publish(new RealtimeEvent.TaskCreated(task, task.getProjectId(), actor), actor.getId());
    }

    public int taskUpdated(Task task, UserSummary actor) {
        return publish(new RealtimeEvent.TaskUpdated(task, task.getProjectId(), actor), actor.getId());
    }

    public int taskDeleted(UUID taskId, UUID projectId, UUID actorId) {
        return publish(new RealtimeEvent.TaskDeleted(taskId, projectId), actorId);
    }

    public int taskMoved(UUID taskId, TaskStatus fromStatus, TaskStatus toStatus, int position,
                         UUID projectId, UserSummary actor) {
        log.debug("Task {} moved {} -> {} (position {}) by {}", taskId, fromStatus, toStatus, position, actor.getId());
        return publish(new RealtimeEvent.TaskMoved(taskId, fromStatus, toStatus, position, projectId, actor), actor.getId());
    }

    public int boardCreated(Board board, UserSummary actor) {
        return publish(new RealtimeEvent.BoardCreated(board, board.getProjectId(), actor), actor.getId());
    }

    public int boardUpdated(Board board, UserSummary actor) {
        return publish(new RealtimeEvent.BoardUpdated(board, board.getProjectId(), actor), actor.getId());
    }

    public int boardDeleted(UUID boardId, UUID projectId, UUID actorId) {
        return publish(new RealtimeEvent.BoardDeleted(boardId, projectId), actorId);
    }

    public int commentCreated(TaskComment comment, UUID projectId, UserSummary actor) {
        return publish(new RealtimeEvent.CommentCreated(comment, comment.getTaskId(), projectId, actor), actor.getId());
    }

    public int commentDeleted(UUID commentId, UUID taskId, UUID projectId, UUID actorId) {
        return publish(new RealtimeEvent.CommentDeleted(commentId, taskId, projectId), actorId);
    }
}

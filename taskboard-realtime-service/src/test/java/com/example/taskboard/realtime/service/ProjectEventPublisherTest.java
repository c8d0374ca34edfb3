package com.example.taskboard.realtime.service;

import com.example.taskboard.realtime.model.OutboundChannel;
import com.example.taskboard.realtime.support.RealtimeTestFixture;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.model.Board;
import com.example.taskboard.shared.model.Task;
import com.example.taskboard.shared.model.TaskComment;
import com.example.taskboard.shared.model.TaskStatus;
import com.example.taskboard.shared.model.UserSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.example.taskboard.realtime.support.RealtimeTestFixture.drain;
import static com.example.taskboard.realtime.support.RealtimeTestFixture.ofType;
import static com.example.taskboard.realtime.support.RealtimeTestFixture.user;
import static org.assertj.core.api.Assertions.assertThat;

class ProjectEventPublisherTest {

    private final UUID aliceId = UUID.randomUUID();
    private final UUID bobId = UUID.randomUUID();
    private final UUID project = UUID.randomUUID();
    private final UserSummary alice = user(aliceId, "alice");

    private RealtimeTestFixture fixture;
    private ProjectEventPublisher publisher;
    private OutboundChannel aliceChannel;
    private OutboundChannel bobChannel;

    @BeforeEach
    void setUp() {
        fixture = new RealtimeTestFixture();
        publisher = new ProjectEventPublisher(fixture.router);
        aliceChannel = fixture.connect(aliceId);
        bobChannel = fixture.connect(bobId);
        fixture.store.subscribe(aliceId, project);
        fixture.store.subscribe(bobId, project);
    }

    @Test
    void taskMoveReachesCollaboratorButNotTheActor() {
        UUID taskId = UUID.randomUUID();

        int delivered = publisher.taskMoved(taskId, TaskStatus.TODO, TaskStatus.IN_PROGRESS, 0, project, alice);

        assertThat(delivered).isEqualTo(1);
        List<RealtimeEvent.TaskMoved> moves = ofType(drain(bobChannel), RealtimeEvent.TaskMoved.class);
        assertThat(moves).hasSize(1);
        assertThat(moves.get(0).taskId()).isEqualTo(taskId);
        assertThat(moves.get(0).toStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(ofType(drain(aliceChannel), RealtimeEvent.TaskMoved.class)).isEmpty();
    }

    @Test
    void taskCreatedUsesTheTasksProject() {
        Task task = Task.builder().id(UUID.randomUUID()).title("Write docs").projectId(project).status(TaskStatus.TODO).build();

        publisher.taskCreated(task, alice);

        assertThat(drain(bobChannel)).containsExactly(new RealtimeEvent.TaskCreated(task, project, alice));
    }

    @Test
    void boardAndCommentEventsFollowTheSameRouting() {
        Board board = Board.builder().id(UUID.randomUUID()).name("Sprint 1").projectId(project).build();
        TaskComment comment = TaskComment.builder().id(UUID.randomUUID()).taskId(UUID.randomUUID()).userId(aliceId)
                .content("Looks good").build();

        publisher.boardCreated(board, alice);
        publisher.commentCreated(comment, project, alice);
        publisher.commentDeleted(comment.getId(), comment.getTaskId(), project, aliceId);

        assertThat(drain(bobChannel)).containsExactly(
                new RealtimeEvent.BoardCreated(board, project, alice),
                new RealtimeEvent.CommentCreated(comment, comment.getTaskId(), project, alice),
                new RealtimeEvent.CommentDeleted(comment.getId(), comment.getTaskId(), project));
        assertThat(drain(aliceChannel)).isEmpty();
    }

    @Test
    void deletionsWithoutActorSummaryStillExcludeTheActor() {
        publisher.taskDeleted(UUID.randomUUID(), project, bobId);

        assertThat(ofType(drain(aliceChannel), RealtimeEvent.TaskDeleted.class)).hasSize(1);
        assertThat(drain(bobChannel)).isEmpty();
    }
}

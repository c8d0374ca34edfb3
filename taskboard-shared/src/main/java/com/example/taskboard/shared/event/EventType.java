package com.example.taskboard.shared.event;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wire tags of {@link RealtimeEvent} variants.
 */
public enum EventType {
    AUTHENTICATION_SUCCESS("AuthenticationSuccess", RealtimeEvent.AuthenticationSuccess.class),
    AUTHENTICATION_ERROR("AuthenticationError", RealtimeEvent.AuthenticationError.class),
    SUBSCRIBE("Subscribe", RealtimeEvent.Subscribe.class),
    UNSUBSCRIBE("Unsubscribe", RealtimeEvent.Unsubscribe.class),
    SUBSCRIPTION_SUCCESS("SubscriptionSuccess", RealtimeEvent.SubscriptionSuccess.class),
    SUBSCRIPTION_ERROR("SubscriptionError", RealtimeEvent.SubscriptionError.class),
    TASK_CREATED("TaskCreated", RealtimeEvent.TaskCreated.class),
    TASK_UPDATED("TaskUpdated", RealtimeEvent.TaskUpdated.class),
    TASK_DELETED("TaskDeleted", RealtimeEvent.TaskDeleted.class),
    TASK_MOVED("TaskMoved", RealtimeEvent.TaskMoved.class),
    BOARD_CREATED("BoardCreated", RealtimeEvent.BoardCreated.class),
    BOARD_UPDATED("BoardUpdated", RealtimeEvent.BoardUpdated.class),
    BOARD_DELETED("BoardDeleted", RealtimeEvent.BoardDeleted.class),
    COMMENT_CREATED("CommentCreated", RealtimeEvent.CommentCreated.class),
    COMMENT_DELETED("CommentDeleted", RealtimeEvent.CommentDeleted.class),
    USER_JOINED("UserJoined", RealtimeEvent.UserJoined.class),
    USER_LEFT("UserLeft", RealtimeEvent.UserLeft.class),
    USER_TYPING("UserTyping", RealtimeEvent.UserTyping.class),
    USER_STOPPED_TYPING("UserStoppedTyping", RealtimeEvent.UserStoppedTyping.class),
    ERROR("Error", RealtimeEvent.Error.class),
    PONG("Pong", RealtimeEvent.Pong.class, false);

    private static final Map<String, EventType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::getTag, Function.identity()));

    private static final Map<Class<?>, EventType> BY_CLASS = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::getEventClass, Function.identity()));

    private final String tag;
    private final Class<? extends RealtimeEvent> eventClass;
    private final boolean payload;

    EventType(String tag, Class<? extends RealtimeEvent> eventClass) {
        this(tag, eventClass, true);
    }

    EventType(String tag, Class<? extends RealtimeEvent> eventClass, boolean payload) {
        this.tag = tag;
        this.eventClass = eventClass;
        this.payload = payload;
    }

    public String getTag() {
        return tag;
    }

    public Class<? extends RealtimeEvent> getEventClass() {
        return eventClass;
    }

    /** Unit kinds are written without a {@code data} member. */
    public boolean hasPayload() {
        return payload;
    }

    public boolean isClientMessage() {
        return RealtimeEvent.ClientMessage.class.isAssignableFrom(eventClass);
    }

    public static Optional<EventType> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }

    public static EventType of(RealtimeEvent event) {
        return BY_CLASS.get(event.getClass());
    }
}

package com.example.taskboard.shared.event;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EventTypeTest {

    @Test
    void pongIsTheOnlyKindWithoutPayload() {
        assertThat(Arrays.stream(EventType.values()).filter(type -> !type.hasPayload()))
                .containsExactly(EventType.PONG);
    }

    @Test
    void everyKindIsResolvableByTagAndByInstance() {
        for (EventType type : EventType.values()) {
            assertThat(EventType.fromTag(type.getTag())).contains(type);
        }
        assertThat(EventType.of(new RealtimeEvent.SubscriptionSuccess(UUID.randomUUID())))
                .isEqualTo(EventType.SUBSCRIPTION_SUCCESS);
        assertThat(EventType.fromTag("TaskArchived")).isEmpty();
    }

    @Test
    void clientMessagesAreTheInboundKinds() {
        assertThat(Arrays.stream(EventType.values()).filter(EventType::isClientMessage))
                .containsExactlyInAnyOrder(EventType.SUBSCRIBE, EventType.UNSUBSCRIBE, EventType.PONG,
                        EventType.USER_TYPING, EventType.USER_STOPPED_TYPING);
    }
}

package com.example.taskboard.realtime.websocket;

import com.example.taskboard.realtime.model.RealtimeSession;
import com.example.taskboard.realtime.service.RealtimeSessionService;
import com.example.taskboard.shared.config.MonitoringConfig;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.event.RealtimeEventCodec;
import com.example.taskboard.shared.exception.ProtocolViolationException;
import com.example.taskboard.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Inbound half of a session: decodes each frame and applies it. Any frame counts as
 * liveness. A frame that cannot be understood is answered with an {@code Error}
 * and the connection stays open. Frames reaching a session that a newer connection
 * of the same user has displaced are ignored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClientMessageDispatcher {

    private final RealtimeEventCodec codec;
    private final RealtimeSessionService sessionService;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    public Mono<Void> dispatch(RealtimeSession session, InboundFrame frame) {
        if (!sessionService.isCurrent(session)) {
            log.debug("Ignoring {} frame from displaced session {} of user {}", frame.type(), session.getSessionId(), session.getUserId());
            return Mono.empty();
        }
        sessionService.touch(session);
        switch (frame.type()) {
            case PING:
            case PONG:
                return Mono.empty();
            case BINARY:
                return reject(session, new ProtocolViolationException(Constants.ClientMessages.BINARY_UNSUPPORTED));
            default:
                break;
        }

        RealtimeEvent message;
        try {
            message = codec.decodeClientMessage(frame.text());
        } catch (ProtocolViolationException e) {
            return reject(session, e);
        }
        return handle(session, message);
    }

    private Mono<Void> handle(RealtimeSession session, RealtimeEvent message) {
        if (message instanceof RealtimeEvent.Subscribe subscribe) {
            return sessionService.subscribe(session, subscribe.projectId());
        }
        if (message instanceof RealtimeEvent.Unsubscribe unsubscribe) {
            sessionService.unsubscribe(session, unsubscribe.projectId());
        } else if (message instanceof RealtimeEvent.UserTyping typing) {
            sessionService.relayTyping(session, typing);
        } else if (message instanceof RealtimeEvent.UserStoppedTyping stoppedTyping) {
            sessionService.relayTyping(session, stoppedTyping);
        } else if (message instanceof RealtimeEvent.Pong) {
            log.trace("Pong from user {}", session.getUserId());
        }
        return Mono.empty();
    }

    private Mono<Void> reject(RealtimeSession session, ProtocolViolationException e) {
        log.warn("Protocol violation from user {} (session {}): {}", session.getUserId(), session.getSessionId(), e.getMessage());
        metricsCollector.incrementCounter(Constants.Metrics.PROTOCOL_VIOLATIONS);
        sessionService.reply(session, new RealtimeEvent.Error(e.getMessage()));
        return Mono.empty();
    }
}

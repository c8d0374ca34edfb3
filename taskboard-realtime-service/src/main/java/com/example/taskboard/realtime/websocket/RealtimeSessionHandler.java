package com.example.taskboard.realtime.websocket;

import com.example.taskboard.realtime.model.RealtimeSession;
import com.example.taskboard.realtime.service.RealtimeSessionService;
import com.example.taskboard.shared.collaborator.UserIdentity;
import com.example.taskboard.shared.config.AppProperties;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.event.RealtimeEventCodec;
import com.example.taskboard.shared.exception.AuthenticationFailureException;
import com.example.taskboard.shared.util.Constants;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Drives one WebSocket connection: authenticates the handshake credential, then runs
 * the outbound loop (channel events plus heartbeat pings) and the inbound loop
 * side by side. Whichever loop ends first ends the session, and teardown runs once.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RealtimeSessionHandler implements WebSocketHandler {

    private static final byte[] PING_PAYLOAD = "heartbeat".getBytes(StandardCharsets.UTF_8);

    private final RealtimeSessionService sessionService;
    private final ClientMessageDispatcher dispatcher;
    private final RealtimeEventCodec codec;
    private final AppProperties appProperties;

    @Override
    @RateLimiter(name = "realtimeConnectLimiter", fallbackMethod = "connectFallback")
    public Mono<Void> handle(WebSocketSession session) {
        log.info("[CONNECT_START] WebSocket connection {} from {}", session.getId(), session.getHandshakeInfo().getRemoteAddress());
        String credential = extractCredential(session.getHandshakeInfo().getUri());

        return sessionService.authenticate(credential)
                .onErrorResume(AuthenticationFailureException.class, ex -> {
                    log.warn("Authentication failed for connection {}: {}", session.getId(), ex.getMessage());
                    return reject(session, new RealtimeEvent.AuthenticationError(ex.getMessage()), CloseStatus.POLICY_VIOLATION)
                            .then(Mono.<UserIdentity>empty());
                })
                .flatMap(identity -> serve(session, identity));
    }

    public Mono<Void> connectFallback(WebSocketSession session, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded for connection {}. IP: {}. Details: {}",
                session.getId(), session.getHandshakeInfo().getRemoteAddress(), ex.getMessage());
        return reject(session, new RealtimeEvent.Error(Constants.ClientMessages.RATE_LIMITED), CloseStatus.SERVICE_OVERLOAD);
    }

    private Mono<Void> serve(WebSocketSession session, UserIdentity identity) {
        RealtimeSession realtimeSession = sessionService.open(identity, session.getId());
        Sinks.Empty<Void> outboundDone = Sinks.empty();

        Flux<WebSocketMessage> events = Flux.concat(
                        Mono.just(new RealtimeEvent.AuthenticationSuccess(identity.userId())),
                        realtimeSession.getChannel().events())
                .map(event -> session.textMessage(codec.encode(event)))
                .doFinally(signal -> outboundDone.tryEmitEmpty());

        Flux<WebSocketMessage> heartbeats = Flux.interval(Duration.ofMillis(appProperties.getRealtime().getHeartbeatInterval()))
                .map(tick -> session.pingMessage(factory -> factory.wrap(PING_PAYLOAD)))
                .takeUntilOther(outboundDone.asMono());

        Mono<Void> output = session.send(Flux.merge(events, heartbeats));
        Mono<Void> input = session.receive()
                .map(InboundFrame::of)
                .concatMap(frame -> dispatcher.dispatch(realtimeSession, frame))
                .then();

        return Mono.firstWithSignal(input, output)
                .onErrorResume(ex -> {
                    log.warn("Connection {} of user {} failed: {}", session.getId(), identity.userId(), ex.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> sessionService.close(realtimeSession, signal.toString()))
                .then(Mono.defer(session::close));
    }

    private Mono<Void> reject(WebSocketSession session, RealtimeEvent event, CloseStatus status) {
        return session.send(Mono.just(session.textMessage(codec.encode(event))))
                .onErrorResume(ex -> {
                    log.debug("Could not notify connection {} before closing: {}", session.getId(), ex.getMessage());
                    return Mono.empty();
                })
                .then(Mono.defer(() -> session.close(status)));
    }

    @Nullable
    private String extractCredential(URI uri) {
        String raw = UriComponentsBuilder.fromUri(uri).build().getQueryParams()
                .getFirst(appProperties.getRealtime().getTokenParam());
        return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
    }
}

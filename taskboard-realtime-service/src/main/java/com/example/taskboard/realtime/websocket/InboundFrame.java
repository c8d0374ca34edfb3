package com.example.taskboard.realtime.websocket;

import org.springframework.lang.Nullable;
import org.springframework.web.reactive.socket.WebSocketMessage;

/**
 * A received frame with its text already copied out, so it can be handled after the
 * underlying buffer has been released.
 */
public record InboundFrame(WebSocketMessage.Type type, @Nullable String text) {

    public static InboundFrame of(WebSocketMessage message) {
        String text = message.getType() == WebSocketMessage.Type.TEXT ? message.getPayloadAsText() : null;
        return new InboundFrame(message.getType(), text);
    }

    public static InboundFrame text(String text) {
        return new InboundFrame(WebSocketMessage.Type.TEXT, text);
    }
}

package com.example.taskboard.shared.event;

import com.example.taskboard.shared.exception.ProtocolViolationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts {@link RealtimeEvent}s to and from text frames.
 * <p>
 * Frames are adjacently tagged: {@code {"type": "TaskMoved", "data": {...}}}. Field
 * names are snake_case and timestamps ISO-8601, regardless of how the application's
 * shared {@link ObjectMapper} is configured.
 */
@Component
@Slf4j
public class RealtimeEventCodec {

    static final String TYPE_FIELD = "type";
    static final String DATA_FIELD = "data";

    private final ObjectMapper objectMapper;

    public RealtimeEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    public String encode(RealtimeEvent event) {
        EventType type = EventType.of(event);
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put(TYPE_FIELD, type.getTag());
        if (type.hasPayload()) {
            frame.set(DATA_FIELD, objectMapper.valueToTree(event));
        }
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            // An ObjectNode tree always serializes; reaching this means the mapper itself is broken.
            throw new IllegalStateException("Failed to serialize " + type.getTag() + " frame", e);
        }
    }

    /**
     * Decodes a frame sent by a client. Server-only kinds are rejected as well as
     * anything that does not decode.
     *
     * @throws ProtocolViolationException if the frame is not a well-formed client message
     */
    public RealtimeEvent decodeClientMessage(String text) {
        RealtimeEvent event = decode(text);
        if (!(event instanceof RealtimeEvent.ClientMessage)) {
            throw new ProtocolViolationException("Unexpected event from client: " + EventType.of(event).getTag());
        }
        return event;
    }

    /**
     * @throws ProtocolViolationException if the frame is not a well-formed event of a known kind
     */
    public RealtimeEvent decode(String text) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException("Invalid message format: " + e.getOriginalMessage(), e);
        }
        if (frame == null || !frame.isObject()) {
            throw new ProtocolViolationException("Invalid message format: expected a JSON object");
        }

        JsonNode typeNode = frame.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolViolationException("Invalid message format: missing '" + TYPE_FIELD + "'");
        }
        EventType type = EventType.fromTag(typeNode.asText())
                .orElseThrow(() -> new ProtocolViolationException("Unknown message type: " + typeNode.asText()));

        if (!type.hasPayload()) {
            return new RealtimeEvent.Pong();
        }

        JsonNode data = frame.get(DATA_FIELD);
        if (data == null || !data.isObject()) {
            throw new ProtocolViolationException("Invalid message format: '" + type.getTag() + "' requires a '" + DATA_FIELD + "' object");
        }

        RealtimeEvent event;
        try {
            event = objectMapper.treeToValue(data, type.getEventClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Rejected {} payload: {}", type.getTag(), e.getMessage());
            throw new ProtocolViolationException("Invalid message format: malformed '" + type.getTag() + "' payload", e);
        }

        if (event instanceof RealtimeEvent.ProjectScoped scoped && scoped.projectId() == null) {
            throw new ProtocolViolationException("Invalid message format: '" + type.getTag() + "' requires 'project_id'");
        }
        return event;
    }
}

package com.example.taskboard.realtime.config;

import com.example.taskboard.realtime.websocket.RealtimeSessionHandler;
import com.example.taskboard.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
@Slf4j
public class WebSocketConfig {

    /** Ordered ahead of the annotated controllers. */
    @Bean
    public HandlerMapping realtimeHandlerMapping(RealtimeSessionHandler handler, AppProperties appProperties) {
        String path = appProperties.getRealtime().getPath();
        log.info("Real-time WebSocket endpoint mapped at '{}'", path);
        return new SimpleUrlHandlerMapping(Map.of(path, handler), -1);
    }
}

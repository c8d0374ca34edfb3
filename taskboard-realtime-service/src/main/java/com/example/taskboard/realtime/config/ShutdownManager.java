package com.example.taskboard.realtime.config;

import com.example.taskboard.realtime.service.ConnectionRegistry;
import com.example.taskboard.shared.config.AppProperties;
import com.example.taskboard.shared.event.RealtimeEvent;
import com.example.taskboard.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * Warns connected clients and closes their connections when the application stops.
 * Runs as a lifecycle stop in the default phase, which comes before the web server
 * stops accepting and closing connections.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ShutdownManager implements SmartLifecycle {

    private final ConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;

    private volatile boolean running;

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        log.info("Initiating graceful shutdown...");

        Set<UUID> connected = connectionRegistry.connectedUserIds();
        if (connected.isEmpty()) {
            log.info("No live connections. Graceful shutdown completed.");
            return;
        }

        log.info("Sending shutdown notice to {} connected clients...", connected.size());
        RealtimeEvent notice = new RealtimeEvent.Error(Constants.ClientMessages.SERVER_SHUTDOWN);
        connected.forEach(userId -> connectionRegistry.send(userId, notice));

        try {
            Thread.sleep(appProperties.getRealtime().getShutdownNoticeDelay());
        } catch (InterruptedException e) {
            log.warn("Shutdown notice delay was interrupted");
            Thread.currentThread().interrupt();
        }

        connected.forEach(connectionRegistry::unregister);
        log.info("Closed {} connections. Graceful shutdown completed.", connected.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public boolean isShuttingDown() {
        return !running;
    }
}

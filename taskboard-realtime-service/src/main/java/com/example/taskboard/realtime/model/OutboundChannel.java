package com.example.taskboard.realtime.model;

import com.example.taskboard.shared.event.RealtimeEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded outbound queue of one connection. Any thread may offer; the owning
 * session's outbound loop is the only subscriber.
 * <p>
 * Offers never block: once {@code capacity} events are waiting the offer fails with
 * {@link Sinks.EmitResult#FAIL_OVERFLOW} and the event is lost.
 */
public class OutboundChannel {

    private final UUID userId;
    private final int capacity;
    private final Sinks.Many<RealtimeEvent> sink;
    private final Sinks.Empty<Void> evicted = Sinks.empty();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public OutboundChannel(UUID userId, int capacity) {
        this.userId = userId;
        this.capacity = capacity;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(capacity));
    }

    public UUID getUserId() {
        return userId;
    }

    public int getCapacity() {
        return capacity;
    }

    // Serialized so concurrent broadcasters never see FAIL_NON_SERIALIZED.
    public synchronized Sinks.EmitResult offer(RealtimeEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        // Before the outbound loop subscribes, a full queue is reported as FAIL_ZERO_SUBSCRIBER.
        return result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER ? Sinks.EmitResult.FAIL_OVERFLOW : result;
    }

    /**
     * Events in enqueue order. Completes after {@link #close()} once the backlog is
     * drained, or immediately after {@link #evict()}.
     */
    public Flux<RealtimeEvent> events() {
        return sink.asFlux().takeUntilOther(evicted.asMono());
    }

    public synchronized void close() {
        sink.tryEmitComplete();
    }

    /** Closes without waiting for the backlog to drain. */
    public void evict() {
        evicted.tryEmitEmpty();
        close();
    }

    public int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }
}

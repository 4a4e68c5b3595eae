package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.event.ExecutionEvent;

import java.time.Duration;
import java.util.Optional;

/**
 * Cursor over the event log of one execution.
 *
 * <p>Events are returned in publish order. A subscription created with a lower
 * {@code fromSequence} replays earlier events, which gives consumers at-least-once delivery
 * across reconnects.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventSubscription extends AutoCloseable {

    /**
     * Waits for the next event.
     *
     * @param timeout maximum wait
     * @return next event, or empty if none arrived in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<ExecutionEvent> poll(Duration timeout) throws InterruptedException;

    /**
     * Whether the terminal event has been returned and no more events will arrive.
     */
    boolean isExhausted();

    /**
     * Sequence number the next {@link #poll(Duration)} will return.
     */
    long position();

    @Override
    void close();
}

package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.event.ExecutionEvent;
import com.ryuqq.pipeline.core.model.ExecutionId;

import java.util.List;

/**
 * In-process publish primitive for execution events.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Assigning a per-execution, monotonically increasing sequence number on publish</li>
 *   <li>Keeping the ordered event log of each execution until it is discarded</li>
 *   <li>Serving subscriptions that can start from any sequence (replay)</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publishers and subscribers run on different threads</li>
 *   <li>Ordering: events of one execution are delivered in publish order</li>
 *   <li>At-least-once Delivery: a subscriber resuming from an earlier sequence receives duplicates</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventChannel {

    /**
     * Creates the log of an execution before its first event.
     *
     * <p>Subscriptions opened before any event is published wait on this log. Opening an
     * existing log has no effect.</p>
     *
     * @param executionId execution whose events will be published
     */
    void open(ExecutionId executionId);

    /**
     * Appends an event to the log of its execution.
     *
     * @param event event without sequence
     * @return the stored event carrying its sequence number
     * @throws IllegalArgumentException if event is null
     * @throws IllegalStateException if the execution's log is already closed
     */
    ExecutionEvent publish(ExecutionEvent event);

    /**
     * Opens a cursor starting at the given sequence (0 for the first event).
     *
     * @param executionId execution to follow
     * @param fromSequence first sequence to deliver
     * @return subscription, already exhausted when the execution has no log
     */
    EventSubscription subscribe(ExecutionId executionId, long fromSequence);

    /**
     * Events published so far for an execution.
     */
    List<ExecutionEvent> history(ExecutionId executionId);

    /**
     * Marks the log as complete; subscribers drain remaining events then stop.
     */
    void close(ExecutionId executionId);

    /**
     * Drops the log of an execution.
     */
    void discard(ExecutionId executionId);
}

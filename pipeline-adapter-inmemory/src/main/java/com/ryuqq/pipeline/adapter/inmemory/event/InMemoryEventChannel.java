package com.ryuqq.pipeline.adapter.inmemory.event;

import com.ryuqq.pipeline.core.event.ExecutionEvent;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.spi.EventChannel;
import com.ryuqq.pipeline.core.spi.EventSubscription;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link EventChannel} SPI.
 *
 * <p>Each execution owns an append-only log. Publishing assigns the next sequence number
 * under the log's lock and wakes waiting subscribers. Subscriptions are independent cursors
 * over the log, so any number of consumers can follow one execution and a consumer can
 * resume from an earlier sequence.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Logs:</strong> ConcurrentHashMap&lt;ExecutionId, EventLog&gt; - one log per execution</li>
 *   <li><strong>Signalling:</strong> ReentrantLock + Condition per log - blocking poll without busy waiting</li>
 * </ul>
 *
 * <p><strong>Retention:</strong> logs live from {@link #open(ExecutionId)} or the first publish
 * until {@link #discard(ExecutionId)} is called, normally by the execution reaper when the run is
 * evicted from the registry. Subscribing to an execution without a log returns an exhausted
 * subscription and retains nothing.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventChannel implements EventChannel {

    private final ConcurrentHashMap<ExecutionId, EventLog> logs = new ConcurrentHashMap<>();

    @Override
    public void open(ExecutionId executionId) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        logs.computeIfAbsent(executionId, id -> new EventLog());
    }

    @Override
    public ExecutionEvent publish(ExecutionEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return logs.computeIfAbsent(event.executionId(), id -> new EventLog()).append(event);
    }

    @Override
    public EventSubscription subscribe(ExecutionId executionId, long fromSequence) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        if (fromSequence < 0) {
            throw new IllegalArgumentException("fromSequence must not be negative (current: " + fromSequence + ")");
        }
        EventLog log = logs.get(executionId);
        return new LogSubscription(log == null ? EventLog.closedEmpty() : log, fromSequence);
    }

    @Override
    public List<ExecutionEvent> history(ExecutionId executionId) {
        EventLog log = logs.get(executionId);
        return log == null ? List.of() : log.snapshot();
    }

    @Override
    public void close(ExecutionId executionId) {
        EventLog log = logs.get(executionId);
        if (log != null) {
            log.close();
        }
    }

    @Override
    public void discard(ExecutionId executionId) {
        EventLog log = logs.remove(executionId);
        if (log != null) {
            log.close();
        }
    }

    /**
     * Number of executions whose log is retained.
     */
    public int retainedLogs() {
        return logs.size();
    }

    private static final class EventLog {

        private final List<ExecutionEvent> events = new ArrayList<>();
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();
        private boolean closed;

        static EventLog closedEmpty() {
            EventLog log = new EventLog();
            log.closed = true;
            return log;
        }

        ExecutionEvent append(ExecutionEvent event) {
            lock.lock();
            try {
                if (closed) {
                    throw new IllegalStateException(
                        "Event log already closed for " + event.executionId().getValue()
                    );
                }
                ExecutionEvent sequenced = event.withSequence(events.size());
                events.add(sequenced);
                changed.signalAll();
                return sequenced;
            } finally {
                lock.unlock();
            }
        }

        void close() {
            lock.lock();
            try {
                closed = true;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        List<ExecutionEvent> snapshot() {
            lock.lock();
            try {
                return Collections.unmodifiableList(new ArrayList<>(events));
            } finally {
                lock.unlock();
            }
        }
    }

    private static final class LogSubscription implements EventSubscription {

        private final EventLog log;
        private long cursor;
        private volatile boolean cancelled;

        LogSubscription(EventLog log, long fromSequence) {
            this.log = log;
            this.cursor = fromSequence;
        }

        @Override
        public Optional<ExecutionEvent> poll(Duration timeout) throws InterruptedException {
            long remainingNanos = timeout.toNanos();
            log.lock.lock();
            try {
                while (!cancelled && cursor >= log.events.size() && !log.closed) {
                    if (remainingNanos <= 0) {
                        return Optional.empty();
                    }
                    remainingNanos = log.changed.awaitNanos(remainingNanos);
                }
                if (cancelled || cursor >= log.events.size()) {
                    return Optional.empty();
                }
                ExecutionEvent event = log.events.get((int) cursor);
                cursor++;
                return Optional.of(event);
            } finally {
                log.lock.unlock();
            }
        }

        @Override
        public boolean isExhausted() {
            log.lock.lock();
            try {
                return cancelled || (log.closed && cursor >= log.events.size());
            } finally {
                log.lock.unlock();
            }
        }

        @Override
        public long position() {
            log.lock.lock();
            try {
                return cursor;
            } finally {
                log.lock.unlock();
            }
        }

        @Override
        public void close() {
            cancelled = true;
            log.lock.lock();
            try {
                log.changed.signalAll();
            } finally {
                log.lock.unlock();
            }
        }
    }
}

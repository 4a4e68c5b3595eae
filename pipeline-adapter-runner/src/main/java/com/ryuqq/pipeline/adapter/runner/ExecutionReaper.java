package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.application.registry.ExecutionRegistry;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.spi.EventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 종료된 실행 정리 컴포넌트.
 *
 * <p>보관 기간이 지난 종료 실행을 레지스트리에서 제거하고 이벤트 로그를 폐기합니다.
 * 진행 중인 실행은 대상이 아닙니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. cutoff = now - retention
 * 2. registry.evictFinishedBefore(cutoff) → [ExecutionId1, ExecutionId2, ...]
 * 3. For each ExecutionId: eventChannel.discard(executionId)
 * 4. 성공/실패 카운트 로깅
 * </pre>
 *
 * <p>주기적으로 호출되어야 합니다 ({@link RetentionConfig#scanIntervalMs()} 간격).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionReaper {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReaper.class);

    private final ExecutionRegistry registry;
    private final EventChannel eventChannel;
    private final RetentionConfig config;
    private final Clock clock;

    public ExecutionReaper(ExecutionRegistry registry, EventChannel eventChannel, RetentionConfig config) {
        this(registry, eventChannel, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param registry 실행 레지스트리
     * @param eventChannel 이벤트 채널
     * @param config 설정
     * @param clock 기준 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExecutionReaper(ExecutionRegistry registry, EventChannel eventChannel, RetentionConfig config, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (eventChannel == null) {
            throw new IllegalArgumentException("eventChannel cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.eventChannel = eventChannel;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 보관 기간이 지난 실행 정리.
     *
     * @return 제거된 실행 수
     */
    public int scan() {
        log.info("ExecutionReaper scan started");
        int evicted = evictFinishedBefore(clock.instant().minusMillis(config.retentionMs()));
        log.info("ExecutionReaper scan completed: {} executions evicted", evicted);
        return evicted;
    }

    /**
     * 기준 시각 이전에 종료된 실행 정리.
     *
     * @param cutoff 기준 시각
     * @return 제거된 실행 수
     */
    public int evictFinishedBefore(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }

        // 1. 레지스트리에서 제거
        List<ExecutionId> evicted = registry.evictFinishedBefore(cutoff);

        // 2. 이벤트 로그 폐기
        int discarded = 0;
        for (ExecutionId executionId : evicted) {
            if (tryDiscard(executionId)) {
                discarded++;
            }
        }

        log.debug("Evicted {} executions finished before {} ({} event logs discarded)",
            evicted.size(), cutoff, discarded);
        return evicted.size();
    }

    Instant now() {
        return clock.instant();
    }

    /**
     * 개별 이벤트 로그 폐기.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 정리를 방해하지 않습니다.</p>
     */
    private boolean tryDiscard(ExecutionId executionId) {
        try {
            eventChannel.discard(executionId);
            return true;
        } catch (Exception e) {
            log.error("Failed to discard event log of {} in ExecutionReaper scan", executionId, e);
            return false;
        }
    }
}

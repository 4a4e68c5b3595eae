package com.ryuqq.pipeline.core.model;

import java.time.Duration;

/**
 * 파이프라인 단위 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrencyLimit: 동시에 실행할 수 있는 Step 수 (기본 4)</li>
 *   <li>globalTimeout: 실행 전체의 wall-clock 상한 (기본 1시간)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrencyLimit 동시 실행 한도 (1 이상)
 * @param globalTimeout 전체 타임아웃 (양수)
 */
public record PipelineSettings(
    int concurrencyLimit,
    Duration globalTimeout
) {

    public static final int DEFAULT_CONCURRENCY_LIMIT = 4;
    public static final Duration DEFAULT_GLOBAL_TIMEOUT = Duration.ofHours(1);

    /**
     * 기본 설정 생성자.
     */
    public PipelineSettings() {
        this(DEFAULT_CONCURRENCY_LIMIT, DEFAULT_GLOBAL_TIMEOUT);
    }

    public PipelineSettings {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException(
                "concurrencyLimit must be positive (current: " + concurrencyLimit + ")"
            );
        }
        if (globalTimeout == null) {
            throw new IllegalArgumentException("globalTimeout cannot be null");
        }
        if (globalTimeout.isNegative() || globalTimeout.isZero()) {
            throw new IllegalArgumentException(
                "globalTimeout must be positive (current: " + globalTimeout + ")"
            );
        }
    }

    /**
     * concurrencyLimit만 변경한 새 인스턴스 생성.
     */
    public PipelineSettings withConcurrencyLimit(int concurrencyLimit) {
        return new PipelineSettings(concurrencyLimit, globalTimeout);
    }

    /**
     * globalTimeout만 변경한 새 인스턴스 생성.
     */
    public PipelineSettings withGlobalTimeout(Duration globalTimeout) {
        return new PipelineSettings(concurrencyLimit, globalTimeout);
    }
}

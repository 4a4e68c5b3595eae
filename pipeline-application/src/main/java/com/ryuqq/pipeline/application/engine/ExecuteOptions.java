package com.ryuqq.pipeline.application.engine;

/**
 * 실행 옵션 (불변 record).
 *
 * <ul>
 *   <li>dryRun: 외부 부작용 없이 검증과 비용/구조 추정만 수행</li>
 *   <li>debugMode: 이벤트에 진단 정보(debug)를 포함하고 DEBUG 로그 출력</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param dryRun 시뮬레이션 실행 여부
 * @param debugMode 디버그 모드 여부
 */
public record ExecuteOptions(boolean dryRun, boolean debugMode) {

    /**
     * 기본 옵션 (실제 실행, 디버그 off).
     */
    public ExecuteOptions() {
        this(false, false);
    }

    public static ExecuteOptions defaults() {
        return new ExecuteOptions();
    }

    public ExecuteOptions withDryRun(boolean dryRun) {
        return new ExecuteOptions(dryRun, debugMode);
    }

    public ExecuteOptions withDebugMode(boolean debugMode) {
        return new ExecuteOptions(dryRun, debugMode);
    }
}

package com.ryuqq.pipeline.adapter.runner;

import java.util.HashMap;
import java.util.Map;

/**
 * 실행 1건의 Step을 수행 중인 워커 스레드 목록.
 *
 * <p>Step 풀은 모든 실행이 공유하므로, 인터럽트는 스레드가 이 실행의 Step에 등록되어 있는
 * 동안에만 전달되어야 합니다. 등록, 해제, 인터럽트는 같은 잠금 아래에서 수행되고
 * 해제 시 전달되지 않고 남은 인터럽트 플래그를 지웁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InFlightThreads {

    private final Map<String, Thread> threads = new HashMap<>();

    synchronized void register(String stepId, Thread thread) {
        threads.put(stepId, thread);
    }

    /**
     * 현재 스레드의 등록 해제.
     */
    synchronized void deregister(String stepId) {
        threads.remove(stepId);
        Thread.interrupted();
    }

    synchronized void interruptAll() {
        for (Thread thread : threads.values()) {
            thread.interrupt();
        }
    }

    synchronized int size() {
        return threads.size();
    }
}

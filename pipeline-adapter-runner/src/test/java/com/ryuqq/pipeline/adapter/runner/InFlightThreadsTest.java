package com.ryuqq.pipeline.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InFlightThreads 유닛 테스트.
 *
 * <p>공유 풀의 스레드가 다른 실행의 Step으로 넘어간 뒤에는 인터럽트가 전달되지 않아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InFlightThreadsTest {

    @Test
    void interruptAll_등록된_스레드만_인터럽트함() throws Exception {
        // given
        InFlightThreads threads = new InFlightThreads();
        CountDownLatch registered = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        Thread worker = new Thread(() -> {
            threads.register("a", Thread.currentThread());
            registered.countDown();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            } finally {
                threads.deregister("a");
            }
        });
        worker.start();
        assertThat(registered.await(1, TimeUnit.SECONDS)).isTrue();

        // when
        threads.interruptAll();

        // then
        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
        worker.join(1_000);
        assertThat(threads.size()).isZero();
    }

    @Test
    void interruptAll_해제된_풀_스레드의_다음_작업은_영향받지_않음() throws Exception {
        // given
        InFlightThreads runA = new InFlightThreads();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> {
                runA.register("a", Thread.currentThread());
                runA.deregister("a");
            }).get(1, TimeUnit.SECONDS);

            // when
            runA.interruptAll();
            Future<Boolean> nextTask = pool.submit(() -> {
                Thread.sleep(50);
                return Thread.currentThread().isInterrupted();
            });

            // then
            assertThat(nextTask.get(1, TimeUnit.SECONDS)).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deregister_남은_인터럽트_플래그를_지움() {
        // given
        InFlightThreads threads = new InFlightThreads();
        threads.register("a", Thread.currentThread());
        threads.interruptAll();

        // when
        threads.deregister("a");

        // then
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
        assertThat(threads.size()).isZero();
    }
}

package com.xammer.guardrail.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AsyncConfig")
class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("A full hygiene queue runs the overflow on the submitting thread instead of rejecting it")
    void fullQueueRunsOnCaller() throws InterruptedException {
        GuardrailProperties properties = new GuardrailProperties();
        properties.getHygiene().setWorkerPoolSize(1);
        executor = new AsyncConfig().hygieneTaskExecutor(properties);

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1011);
        AtomicInteger onCaller = new AtomicInteger();
        Thread caller = Thread.currentThread();

        executor.execute(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.countDown();
        });
        for (int i = 0; i < 1010; i++) {
            executor.execute(() -> {
                if (Thread.currentThread() == caller) {
                    onCaller.incrementAndGet();
                }
                finished.countDown();
            });
        }
        release.countDown();

        assertThat(finished.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(onCaller.get()).isEqualTo(10);
    }
}

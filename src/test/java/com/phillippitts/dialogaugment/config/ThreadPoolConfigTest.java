package com.phillippitts.dialogaugment.config;

import com.phillippitts.dialogaugment.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateFixedSizeExecutorFromDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).augmentExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("augment-worker-");
    }

    @Test
    void shouldHonorConfiguredWorkerCount() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setWorkers(4);
        executor = new ThreadPoolConfig(properties).augmentExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(4);
    }

    @Test
    void shouldRunMoreTasksThanQueueCapacityWithCallerRuns() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).augmentExecutor();

        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(5);
                    completed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).augmentExecutor();
        ThreadContext.put("runId", "run-42");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get("runId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("run-42");
        assertThat(threadName.get()).startsWith("augment-worker-");
    }

    @Test
    void decoratorRestoresCallerContext() {
        ThreadContext.put("runId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator()
                .decorate(() -> ThreadContext.put("shard", "dialogues_001.json"));

        decorated.run();

        assertThat(ThreadContext.get("runId")).isEqualTo("outer");
        assertThat(ThreadContext.get("shard")).isNull();
    }
}

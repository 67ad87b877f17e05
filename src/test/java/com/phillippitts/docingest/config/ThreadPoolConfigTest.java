package com.phillippitts.docingest.config;

import com.phillippitts.docingest.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;
    private ThreadPoolTaskScheduler scheduler;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).ingestExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(16);
        assertThat(executor.getMaxPoolSize()).isEqualTo(256);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("ingest-pool-");
    }

    @Test
    void ingestPoolGrowsPastCoreSizeInsteadOfQueueing() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getIngest().setCorePoolSize(2);
        executor = new ThreadPoolConfig(properties).ingestExecutor();

        assertThat(runAllAtOnce(executor, 6)).isTrue();
    }

    @Test
    void transferPoolStartsEveryTransferImmediately() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).transferExecutor();

        assertThat(executor.getCorePoolSize()).isZero();
        assertThat(executor.getMaxPoolSize()).isEqualTo(Integer.MAX_VALUE);
        assertThat(runAllAtOnce(executor, 40)).isTrue();
    }

    /**
     * Submits {@code count} tasks that each wait for all the others to be running.
     */
    private static boolean runAllAtOnce(ThreadPoolTaskExecutor pool, int count) throws InterruptedException {
        CountDownLatch running = new CountDownLatch(count);
        CountDownLatch finished = new CountDownLatch(count);
        for (int i = 0; i < count; i++) {
            pool.execute(() -> {
                running.countDown();
                try {
                    running.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    finished.countDown();
                }
            });
        }
        boolean allRan = running.await(2, TimeUnit.SECONDS);
        finished.await(3, TimeUnit.SECONDS);
        return allRan;
    }

    @Test
    void shouldHonourConfiguredSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getIngest().setCorePoolSize(2);
        properties.getIngest().setMaxPoolSize(3);
        properties.getPoll().setPoolSize(1);
        ThreadPoolConfig config = new ThreadPoolConfig(properties);

        executor = config.ingestExecutor();
        scheduler = config.pollScheduler();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(3);
        assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).ingestExecutor();

        int taskCount = 40;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(5);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).ingestExecutor();
        ThreadContext.put("batchId", "b-1");
        ThreadContext.put("requestId", "r-1");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> batchId = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            batchId.set(ThreadContext.get("batchId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(batchId.get()).isEqualTo("b-1");
        assertThat(threadName.get()).startsWith("ingest-pool-");
    }

    @Test
    void shouldNotLeakContextBetweenTasks() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getIngest().setCorePoolSize(1);
        properties.getIngest().setMaxPoolSize(1);
        executor = new ThreadPoolConfig(properties).ingestExecutor();

        ThreadContext.put("batchId", "b-1");
        CountDownLatch first = new CountDownLatch(1);
        executor.execute(first::countDown);
        assertThat(first.await(1, TimeUnit.SECONDS)).isTrue();

        ThreadContext.clearAll();
        CountDownLatch second = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>("unset");
        executor.execute(() -> {
            seen.set(ThreadContext.get("batchId"));
            second.countDown();
        });

        assertThat(second.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isNull();
    }

    @Test
    void schedulerRunsWithPollPrefix() throws InterruptedException {
        scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).pollScheduler();

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();
        scheduler.schedule(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        }, Instant.now().plusMillis(10));

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("poll-");
    }

    @Test
    void schedulerPropagatesThreadContextToScheduledTasks() throws InterruptedException {
        scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).pollScheduler();
        ThreadContext.put("batchId", "b-7");
        ThreadContext.put("entryKey", "jan.csv");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> batchId = new AtomicReference<>();
        AtomicReference<String> entryKey = new AtomicReference<>();
        scheduler.schedule(() -> {
            batchId.set(ThreadContext.get("batchId"));
            entryKey.set(ThreadContext.get("entryKey"));
            latch.countDown();
        }, Instant.now().plusMillis(10));
        ThreadContext.clearAll();

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(batchId.get()).isEqualTo("b-7");
        assertThat(entryKey.get()).isEqualTo("jan.csv");
    }

    @Test
    void fixedDelayPollKeepsContextOnEveryRun() throws InterruptedException {
        scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).pollScheduler();
        ThreadContext.put("batchId", "b-8");

        CountDownLatch runs = new CountDownLatch(3);
        List<String> seen = new CopyOnWriteArrayList<>();
        scheduler.scheduleWithFixedDelay(() -> {
            seen.add(ThreadContext.get("batchId"));
            runs.countDown();
        }, Instant.now(), Duration.ofMillis(5));
        ThreadContext.clearAll();

        assertThat(runs.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).allMatch("b-8"::equals);
    }
}

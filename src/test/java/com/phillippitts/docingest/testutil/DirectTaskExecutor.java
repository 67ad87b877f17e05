package com.phillippitts.docingest.testutil;

import org.springframework.core.task.AsyncTaskExecutor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on the calling thread, for deterministic tests of components that take an
 * executor but do not depend on concurrency.
 */
public class DirectTaskExecutor implements AsyncTaskExecutor {

    private final AtomicInteger executed = new AtomicInteger();

    @Override
    public void execute(Runnable task) {
        executed.incrementAndGet();
        task.run();
    }

    public int executedCount() {
        return executed.get();
    }
}

package com.phillippitts.docingest.config;

import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link ThreadPoolTaskScheduler} that runs every task through a {@link TaskDecorator}, so poll
 * loops and transfer deadlines log with the ThreadContext of the code that scheduled them.
 */
class MdcTaskScheduler extends ThreadPoolTaskScheduler {

    private final TaskDecorator decorator;

    MdcTaskScheduler(TaskDecorator decorator) {
        this.decorator = decorator;
    }

    @Override
    public void execute(Runnable task) {
        super.execute(decorator.decorate(task));
    }

    @Override
    public Future<?> submit(Runnable task) {
        return super.submit(decorator.decorate(task));
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        return super.schedule(decorator.decorate(task), trigger);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        return super.schedule(decorator.decorate(task), startTime);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        return super.scheduleAtFixedRate(decorator.decorate(task), startTime, period);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        return super.scheduleAtFixedRate(decorator.decorate(task), period);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        return super.scheduleWithFixedDelay(decorator.decorate(task), startTime, delay);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        return super.scheduleWithFixedDelay(decorator.decorate(task), delay);
    }
}

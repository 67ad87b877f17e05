package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.service.monitor.ProcessingMonitor;

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cancellation scope of one item: its transfer, the transfer deadline and its poll loop.
 *
 * <p>{@link #cancel()} always stops all of them together. Activities attached after the scope
 * was cancelled are stopped on attach.
 */
final class ItemScope {

    private final Lock lock = new ReentrantLock();
    private Future<?> transfer;
    private ScheduledFuture<?> deadline;
    private ProcessingMonitor.PollHandle poll;
    private boolean cancelled;

    void attachTransfer(Future<?> transferFuture) {
        lock.lock();
        try {
            transfer = transferFuture;
            if (cancelled) {
                stopAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called from the transfer thread before the first byte is sent.
     */
    void armDeadline(ScheduledFuture<?> deadlineFuture) {
        lock.lock();
        try {
            deadline = deadlineFuture;
            if (cancelled) {
                stopAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called from the transfer thread once the transfer returned: disarms the deadline and
     * detaches the finished transfer so a later {@link #cancel()} does not interrupt that thread.
     */
    void transferEnded() {
        lock.lock();
        try {
            if (deadline != null) {
                deadline.cancel(false);
                deadline = null;
            }
            transfer = null;
        } finally {
            lock.unlock();
        }
    }

    void attachPoll(ProcessingMonitor.PollHandle handle) {
        lock.lock();
        try {
            poll = handle;
            if (cancelled) {
                stopAll();
            }
        } finally {
            lock.unlock();
        }
    }

    void cancel() {
        lock.lock();
        try {
            cancelled = true;
            stopAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true while a poll loop attached to this scope is still running
     */
    boolean isPolling() {
        lock.lock();
        try {
            return poll != null && poll.isActive();
        } finally {
            lock.unlock();
        }
    }

    private void stopAll() {
        if (deadline != null) {
            deadline.cancel(false);
        }
        if (transfer != null && !transfer.isDone()) {
            transfer.cancel(true);
        }
        if (poll != null) {
            poll.cancel();
        }
    }
}

package com.phillippitts.docingest.service.monitor;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.ProcessingFailedException;
import com.phillippitts.docingest.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks server-side processing of transferred items by polling the status endpoint.
 *
 * <p><b>Thread Model:</b> each item gets its own fixed-delay task on the poll scheduler, so a
 * slow status call for one item never delays another. A loop stops itself when the item reaches
 * a terminal state and can be stopped from outside through its {@link PollHandle}; either way
 * the scheduled task is cancelled and no timer outlives the item.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>transport failure on one poll: retried on the next tick, counted against the ceiling</li>
 *   <li>server {@code error}: item {@code error} with the server's message</li>
 *   <li>{@link AuthFailureException}: loop stops, failure handed to the listener for the batch</li>
 *   <li>attempt ceiling: {@link PollExhaustionPolicy} decides between success and error</li>
 * </ul>
 */
@Component
public class ProcessingMonitor {

    private static final Logger LOG = LogManager.getLogger(ProcessingMonitor.class);

    /**
     * How a poll loop ended.
     */
    public enum Outcome { COMPLETED, FAILED, EXHAUSTED }

    /**
     * Receives poll loop results. Invoked on scheduler threads.
     */
    public interface Listener {
        void onProcessingProgress(UploadItem item);

        /**
         * Called once, after the item reached a terminal state.
         */
        void onProcessingFinished(UploadItem item, Outcome outcome, long elapsedMs);

        void onAuthFailure(UploadItem item, AuthFailureException failure);
    }

    /**
     * Handle of one running poll loop.
     */
    public interface PollHandle {
        /**
         * Stops the loop; an in-flight status call is interrupted. Idempotent.
         */
        void cancel();

        boolean isActive();
    }

    private final StatusClient statusClient;
    private final TaskScheduler scheduler;
    private final IngestionProperties.Poll props;
    private final Set<PollLoop> activeLoops = ConcurrentHashMap.newKeySet();

    public ProcessingMonitor(StatusClient statusClient,
                             @Qualifier("pollScheduler") TaskScheduler scheduler,
                             IngestionProperties properties) {
        this.statusClient = Objects.requireNonNull(statusClient);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.props = properties.getPoll();
    }

    /**
     * Starts polling for an item that has just entered {@code processing}.
     */
    public PollHandle start(UploadItem item, Listener listener) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(listener, "listener");
        PollLoop loop = new PollLoop(item, listener);
        activeLoops.add(loop);
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(loop, Instant.now(),
                Duration.ofMillis(props.getIntervalMs()));
        loop.attach(future);
        return loop;
    }

    /**
     * @return number of poll loops that have not stopped yet
     */
    public int activeLoopCount() {
        return activeLoops.size();
    }

    private final class PollLoop implements Runnable, PollHandle {

        private final UploadItem item;
        private final Listener listener;
        private final AtomicInteger attempts = new AtomicInteger();
        private final long startNanos = System.nanoTime();
        private volatile boolean done;
        private volatile ScheduledFuture<?> future;

        PollLoop(UploadItem item, Listener listener) {
            this.item = item;
            this.listener = listener;
        }

        void attach(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            // the first tick may already have ended the loop
            if (done) {
                scheduled.cancel(false);
            }
        }

        @Override
        public void run() {
            if (done) {
                return;
            }
            if (item.isTerminal()) {
                stop(false);
                return;
            }
            int attempt = attempts.incrementAndGet();
            ProcessingStatus status;
            try {
                status = statusClient.status(item.getUploadId());
            } catch (AuthFailureException e) {
                stop(false);
                listener.onAuthFailure(item, e);
                return;
            } catch (RuntimeException e) {
                if (done) {
                    return;
                }
                LOG.debug("Status poll {} for {} failed, retrying: {}", attempt, item.getEntryKey(), e.getMessage());
                exhaustIfCeilingReached(attempt);
                return;
            }
            if (done) {
                return;
            }
            switch (status.state()) {
                case COMPLETE -> finish(item.complete(completionMessage(status)), Outcome.COMPLETED);
                case ERROR -> {
                    ProcessingFailedException failure = new ProcessingFailedException(item.getUploadId(), status.message());
                    finish(item.fail(failure.getMessage(), "uploadId=" + item.getUploadId()), Outcome.FAILED);
                }
                default -> {
                    if (item.advanceProcessingProgress(status.progress(), status.describe())) {
                        listener.onProcessingProgress(item);
                    }
                    exhaustIfCeilingReached(attempt);
                }
            }
        }

        private void exhaustIfCeilingReached(int attempt) {
            int max = props.getMaxAttempts();
            if (attempt < max) {
                return;
            }
            PollExhaustionPolicy policy = props.getExhaustionPolicy();
            LOG.warn("No terminal processing status for {} after {} attempts; applying {}",
                    item.getEntryKey(), max, policy);
            boolean changed = policy == PollExhaustionPolicy.TIMEOUT_ERROR
                    ? item.fail("Processing timed out after " + max + " attempts",
                            "No terminal status from server for uploadId=" + item.getUploadId())
                    : item.complete("Processing status unconfirmed after " + max + " attempts");
            finish(changed, Outcome.EXHAUSTED);
        }

        private void finish(boolean changed, Outcome outcome) {
            stop(false);
            if (changed) {
                long elapsed = TimeUtils.elapsedMillis(startNanos);
                LOG.debug("Processing of {} ended {} after {} polls in {}", item.getEntryKey(), outcome,
                        attempts.get(), TimeUtils.humanize(Duration.ofMillis(elapsed)));
                listener.onProcessingFinished(item, outcome, elapsed);
            }
        }

        private void stop(boolean interrupt) {
            done = true;
            activeLoops.remove(this);
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(interrupt);
            }
        }

        @Override
        public void cancel() {
            if (!done) {
                stop(true);
            }
        }

        @Override
        public boolean isActive() {
            return !done;
        }
    }

    private static String completionMessage(ProcessingStatus status) {
        if (status.processed() != null) {
            return "Imported " + status.processed() + " records";
        }
        return "Processing complete";
    }
}

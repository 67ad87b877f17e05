package com.phillippitts.docingest.config.properties;

import com.phillippitts.docingest.service.monitor.PollExhaustionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed properties for batch ingestion ({@code ingest.*}).
 *
 * <p>Groups transfer-progress throttling, status polling, transfer timeout scaling, file
 * validation and batch retention. Invalid values fail startup.
 */
@Validated
@ConfigurationProperties(prefix = "ingest")
public class IngestionProperties {

    @Valid
    private Progress progress = new Progress();

    @Valid
    private Poll poll = new Poll();

    @Valid
    private Transfer transfer = new Transfer();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Batch batch = new Batch();

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Poll getPoll() {
        return poll;
    }

    public void setPoll(Poll poll) {
        this.poll = poll;
    }

    public Transfer getTransfer() {
        return transfer;
    }

    public void setTransfer(Transfer transfer) {
        this.transfer = transfer;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    /**
     * Transfer progress event throttling.
     */
    public static class Progress {
        /** Minimum gap between two non-boundary progress events of one transfer. */
        @Min(value = 0, message = "Throttle must not be negative")
        private long throttleMs = 100;

        public long getThrottleMs() {
            return throttleMs;
        }

        public void setThrottleMs(long throttleMs) {
            this.throttleMs = throttleMs;
        }
    }

    /**
     * Processing status polling.
     */
    public static class Poll {
        @Positive(message = "Poll interval must be positive")
        private long intervalMs = 1000;

        /** Polls attempted before the exhaustion policy applies (300 x 1s is about 5 minutes). */
        @Positive(message = "Max poll attempts must be positive")
        private int maxAttempts = 300;

        @NotNull
        private PollExhaustionPolicy exhaustionPolicy = PollExhaustionPolicy.FORCED_SUCCESS;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public PollExhaustionPolicy getExhaustionPolicy() {
            return exhaustionPolicy;
        }

        public void setExhaustionPolicy(PollExhaustionPolicy exhaustionPolicy) {
            this.exhaustionPolicy = exhaustionPolicy;
        }
    }

    /**
     * Size-scaled transfer timeout. The timeout is
     * {@code base + bytes / bytesPerSecond + estimatedRecords * millisPerRecord},
     * clamped into {@code [timeoutFloorMs, timeoutCeilingMs]}.
     */
    public static class Transfer {
        @Positive
        private long timeoutFloorMs = 30_000;

        @Positive
        private long timeoutCeilingMs = 600_000;

        @Min(0)
        private long baseTimeoutMs = 15_000;

        @Positive
        private long bytesPerSecond = 256 * 1024;

        @Positive
        private int bytesPerRecord = 120;

        @Min(0)
        private long millisPerRecord = 5;

        @AssertTrue(message = "Transfer timeout floor must not exceed the ceiling")
        public boolean isFloorBelowCeiling() {
            return timeoutFloorMs <= timeoutCeilingMs;
        }

        public long getTimeoutFloorMs() {
            return timeoutFloorMs;
        }

        public void setTimeoutFloorMs(long timeoutFloorMs) {
            this.timeoutFloorMs = timeoutFloorMs;
        }

        public long getTimeoutCeilingMs() {
            return timeoutCeilingMs;
        }

        public void setTimeoutCeilingMs(long timeoutCeilingMs) {
            this.timeoutCeilingMs = timeoutCeilingMs;
        }

        public long getBaseTimeoutMs() {
            return baseTimeoutMs;
        }

        public void setBaseTimeoutMs(long baseTimeoutMs) {
            this.baseTimeoutMs = baseTimeoutMs;
        }

        public long getBytesPerSecond() {
            return bytesPerSecond;
        }

        public void setBytesPerSecond(long bytesPerSecond) {
            this.bytesPerSecond = bytesPerSecond;
        }

        public int getBytesPerRecord() {
            return bytesPerRecord;
        }

        public void setBytesPerRecord(int bytesPerRecord) {
            this.bytesPerRecord = bytesPerRecord;
        }

        public long getMillisPerRecord() {
            return millisPerRecord;
        }

        public void setMillisPerRecord(long millisPerRecord) {
            this.millisPerRecord = millisPerRecord;
        }
    }

    /**
     * Per-file validation applied before an item enters the pipeline.
     */
    public static class Validation {
        /** Accepted extensions, lowercase without the dot. */
        @NotEmpty
        private List<String> allowedExtensions = new ArrayList<>(List.of("csv", "pdf"));

        @Positive
        private long maxFileBytes = 50L * 1024 * 1024;

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
        }
    }

    /**
     * Batch bookkeeping.
     */
    public static class Batch {
        /** Settled batches kept addressable by id before the oldest is evicted. */
        @Min(1)
        private int retainedBatches = 20;

        /** Fetch the existing-documents snapshot from the backend on every submission. */
        private boolean refreshSnapshotOnSubmit = true;

        public int getRetainedBatches() {
            return retainedBatches;
        }

        public void setRetainedBatches(int retainedBatches) {
            this.retainedBatches = retainedBatches;
        }

        public boolean isRefreshSnapshotOnSubmit() {
            return refreshSnapshotOnSubmit;
        }

        public void setRefreshSnapshotOnSubmit(boolean refreshSnapshotOnSubmit) {
            this.refreshSnapshotOnSubmit = refreshSnapshotOnSubmit;
        }
    }
}

package com.phillippitts.docingest.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing for the two worker pools, bound from {@code threadpool.*}.
 *
 * <p>{@code threadpool.ingest} runs detection and the per-item pipeline steps.
 * {@code threadpool.transfer} runs the blocking uploads, one thread per running transfer.
 * {@code threadpool.poll} runs status polling and transfer deadlines.
 *
 * <p>A queue capacity of 0 hands every task straight to a thread, so the pool grows to its
 * maximum instead of queueing behind busy workers.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private IngestPool ingest = new IngestPool();

    @Valid
    private TransferPool transfer = new TransferPool();

    @Valid
    private PollPool poll = new PollPool();

    public IngestPool getIngest() {
        return ingest;
    }

    public void setIngest(IngestPool ingest) {
        this.ingest = ingest;
    }

    public TransferPool getTransfer() {
        return transfer;
    }

    public void setTransfer(TransferPool transfer) {
        this.transfer = transfer;
    }

    public PollPool getPoll() {
        return poll;
    }

    public void setPoll(PollPool poll) {
        this.poll = poll;
    }

    public static class IngestPool {
        @Min(1)
        private int corePoolSize = 16;
        @Min(1)
        private int maxPoolSize = 256;
        @Min(0)
        private int queueCapacity = 0;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "ingest-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /** A transfer holds its thread until the upload finishes; by default the pool is unbounded. */
    public static class TransferPool {
        @Min(0)
        private int corePoolSize = 0;
        @Min(1)
        private int maxPoolSize = Integer.MAX_VALUE;
        @Min(0)
        private int queueCapacity = 0;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "transfer-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    public static class PollPool {
        @Min(1)
        private int poolSize = 4;
        @NotBlank
        private String threadNamePrefix = "poll-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}

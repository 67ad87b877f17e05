package com.phillippitts.docingest.service.transfer;

import java.util.function.LongSupplier;

/**
 * Decides which transfer progress updates are worth emitting.
 *
 * <p>At most one update per interval passes, except the 0% and 100% boundaries, which always
 * pass so that consumers observe both start and completion. One instance per transfer.
 */
public final class ProgressThrottle {

    private final long intervalMs;
    private final LongSupplier clockMillis;
    private long lastEmitMs = Long.MIN_VALUE;

    public ProgressThrottle(long intervalMs) {
        this(intervalMs, System::currentTimeMillis);
    }

    ProgressThrottle(long intervalMs, LongSupplier clockMillis) {
        this.intervalMs = Math.max(0, intervalMs);
        this.clockMillis = clockMillis;
    }

    public synchronized boolean shouldEmit(int percent) {
        long now = clockMillis.getAsLong();
        boolean boundary = percent <= 0 || percent >= 100;
        if (boundary || lastEmitMs == Long.MIN_VALUE || now - lastEmitMs >= intervalMs) {
            lastEmitMs = now;
            return true;
        }
        return false;
    }

    /**
     * Converts bytes sent into a whole percentage in [0,100].
     */
    public static int percentOf(long bytesSent, long totalBytes) {
        if (totalBytes <= 0) {
            return bytesSent > 0 ? 100 : 0;
        }
        long pct = bytesSent * 100 / totalBytes;
        return (int) Math.max(0, Math.min(100, pct));
    }
}

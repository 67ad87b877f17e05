package com.phillippitts.docingest.service.transfer;

import com.phillippitts.docingest.config.properties.IngestionProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Computes the deadline for one transfer from the file's size and its estimated record count.
 *
 * <pre>
 * timeout = base + bytes * 1000 / bytesPerSecond + ceil(bytes / bytesPerRecord) * millisPerRecord
 * </pre>
 * clamped into {@code [floor, ceiling]} so tiny files are not starved and huge ones cannot hang.
 */
@Component
public class TransferTimeoutPolicy {

    private final IngestionProperties.Transfer props;

    public TransferTimeoutPolicy(IngestionProperties properties) {
        this.props = properties.getTransfer();
    }

    public Duration timeoutFor(long fileBytes) {
        long bytes = Math.max(0, fileBytes);
        long transferMs = bytes * 1000 / props.getBytesPerSecond();
        long recordsMs = estimateRecords(bytes) * props.getMillisPerRecord();
        long total = saturatedAdd(props.getBaseTimeoutMs(), saturatedAdd(transferMs, recordsMs));
        long clamped = Math.max(props.getTimeoutFloorMs(), Math.min(props.getTimeoutCeilingMs(), total));
        return Duration.ofMillis(clamped);
    }

    public long estimateRecords(long fileBytes) {
        if (fileBytes <= 0) {
            return 0;
        }
        int perRecord = props.getBytesPerRecord();
        return (fileBytes + perRecord - 1) / perRecord;
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return ((a ^ r) & (b ^ r)) < 0 ? Long.MAX_VALUE : r;
    }
}

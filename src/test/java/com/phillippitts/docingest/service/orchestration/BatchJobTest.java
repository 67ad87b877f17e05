package com.phillippitts.docingest.service.orchestration;

import com.phillippitts.docingest.domain.BatchState;
import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.service.dedup.DedupIndex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BatchJobTest {

    private static final String CATEGORY = "bank_statement_dkb";

    private static UploadItem processing(String name) {
        UploadItem item = new UploadItem(name, name, 10, name + "::10", CATEGORY);
        item.transitionTo(ItemStatus.PROCESSING, "Processing…");
        return item;
    }

    private static BatchJob jobOf(UploadItem... items) {
        return new BatchJob(CATEGORY, List.of(items), DedupIndex.fromSnapshot(List.of()), List.of());
    }

    @Test
    void abortSkipsEveryOpenItemBeforeLeavingRunning() {
        UploadItem done = processing("done.csv");
        done.complete("Imported");
        UploadItem open = processing("open.csv");
        BatchJob job = jobOf(done, open);

        Optional<List<UploadItem>> skipped = job.abort("Authentication required", "Cancelled");

        assertThat(skipped).hasValueSatisfying(items -> assertThat(items).containsExactly(open));
        assertThat(job.getState()).isEqualTo(BatchState.ABORTED);
        assertThat(done.getStatus()).isEqualTo(ItemStatus.SUCCESS);
        assertThat(open.getStatus()).isEqualTo(ItemStatus.SKIPPED);
        // a status response arriving after the abort cannot turn the item into a success
        assertThat(open.complete("Imported")).isFalse();
        assertThat(job.settleIfComplete()).isEmpty();
    }

    @Test
    void secondAbortIsIgnored() {
        BatchJob job = jobOf(processing("a.csv"));

        assertThat(job.abort("Authentication required", "Cancelled")).isPresent();
        assertThat(job.abort("Authentication required", "Cancelled")).isEmpty();
    }

    @Test
    void itemEitherSucceedsOrIsSkippedWhenRacingAnAbort() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 200; round++) {
                UploadItem item = processing("race.csv");
                BatchJob job = jobOf(item);
                CountDownLatch go = new CountDownLatch(1);

                Future<Boolean> completed = pool.submit(() -> {
                    go.await();
                    return item.complete("Imported");
                });
                Future<Optional<List<UploadItem>>> aborted = pool.submit(() -> {
                    go.await();
                    return job.abort("Authentication required", "Cancelled");
                });
                go.countDown();

                boolean success = completed.get(1, TimeUnit.SECONDS);
                List<UploadItem> skipped = aborted.get(1, TimeUnit.SECONDS).orElseThrow();

                assertThat(job.getState()).isEqualTo(BatchState.ABORTED);
                if (success) {
                    assertThat(item.getStatus()).isEqualTo(ItemStatus.SUCCESS);
                    assertThat(skipped).isEmpty();
                } else {
                    assertThat(item.getStatus()).isEqualTo(ItemStatus.SKIPPED);
                    assertThat(skipped).containsExactly(item);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}

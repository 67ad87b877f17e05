package com.phillippitts.docingest.service.resolve;

import com.phillippitts.docingest.domain.ItemStatus;
import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.domain.UploadItem;
import com.phillippitts.docingest.service.dedup.DedupIndex;
import com.phillippitts.docingest.service.dedup.DedupKeyBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateResolverTest {

    private final DuplicateResolver resolver = new DuplicateResolver();

    private static UploadItem item(String key, String name, long size) {
        return new UploadItem(key, name, size, DedupKeyBuilder.keyFor(name, size), "bank_statement_dkb");
    }

    @Test
    void flagsOnlyLaterOccurrencesInsideBatch() {
        List<UploadItem> items = List.of(
                item("A", "jan.csv", 100),
                item("B", "feb.csv", 200),
                item("C", "jan (1).csv", 100));

        List<DuplicateCandidate> conflicts = resolver.findConflicts(items, new DedupIndex(), List.of());

        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).entryKey()).isEqualTo("C");
        assertThat(conflicts.get(0).source()).isEqualTo(DuplicateCandidate.Source.BATCH);
        assertThat(conflicts.get(0).matches()).containsExactly("A");
    }

    @Test
    void flagsExistingDocumentsWithTheirNames() {
        List<KnownDocument> existing = List.of(new KnownDocument("d1", "Jan.csv", 100L, "bank_statement_dkb"));

        List<DuplicateCandidate> conflicts = resolver.findConflicts(List.of(item("A", "jan_copy.csv", 100)),
                DedupIndex.fromSnapshot(existing), existing);

        assertThat(conflicts).singleElement().satisfies(c -> {
            assertThat(c.source()).isEqualTo(DuplicateCandidate.Source.EXISTING);
            assertThat(c.matches()).containsExactly("Jan.csv");
        });
    }

    @Test
    void batchCollisionWinsOverExisting() {
        List<KnownDocument> existing = List.of(new KnownDocument("d1", "jan.csv", 100L, "bank_statement_dkb"));
        List<UploadItem> items = List.of(item("A", "jan.csv", 100), item("B", "jan.csv", 100));

        List<DuplicateCandidate> conflicts = resolver.findConflicts(items, DedupIndex.fromSnapshot(existing), existing);

        assertThat(conflicts).extracting(DuplicateCandidate::source)
                .containsExactly(DuplicateCandidate.Source.EXISTING, DuplicateCandidate.Source.BATCH);
    }

    @Test
    void itemsWithoutKeyNeverConflict() {
        UploadItem unknownSize = new UploadItem("A", "jan.csv", -1, null, "bank_statement_dkb");
        UploadItem again = new UploadItem("B", "jan.csv", -1, null, "bank_statement_dkb");

        assertThat(resolver.findConflicts(List.of(unknownSize, again), new DedupIndex(), List.of())).isEmpty();
    }

    @Test
    void opensNothingWithoutConflicts() {
        assertThat(resolver.open(UUID.randomUUID(), List.of())).isEmpty();
    }

    @Test
    void skipEndsItemOnce() {
        UploadItem item = item("A", "jan.csv", 100);
        item.transitionTo(ItemStatus.AWAITING_DUPLICATE_DECISION, null);

        assertThat(resolver.skip(item)).isTrue();
        assertThat(resolver.skip(item)).isFalse();
        assertThat(item.snapshot().message()).isEqualTo("Skipped: duplicate document");
    }
}

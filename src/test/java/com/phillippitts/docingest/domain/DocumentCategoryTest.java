package com.phillippitts.docingest.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentCategoryTest {

    @Test
    void normalizesKeys() {
        assertThat(DocumentCategory.normalizeKey("  Broker_VIAC_pdf ")).isEqualTo("broker_viac_pdf");
        assertThat(DocumentCategory.normalizeKey(null)).isEqualTo(DocumentCategory.UNKNOWN);
        assertThat(DocumentCategory.normalizeKey("   ")).isEqualTo(DocumentCategory.UNKNOWN);
    }

    @Test
    void looksUpCatalogEntries() {
        assertThat(DocumentCategory.fromKey("BANK_STATEMENT_DKB")).contains(DocumentCategory.BANK_STATEMENT_DKB);
        assertThat(DocumentCategory.fromKey("something_else")).isEmpty();
    }

    @Test
    void acceptsOnlyListedExtensions() {
        assertThat(DocumentCategory.BROKER_ING_DIBA_CSV.accepts("PDF")).isTrue();
        assertThat(DocumentCategory.BANK_STATEMENT_DKB.accepts("pdf")).isFalse();
        assertThat(DocumentCategory.LOAN_KFW_PDF.accepts(null)).isFalse();
    }
}

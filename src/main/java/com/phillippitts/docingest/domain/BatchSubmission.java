package com.phillippitts.docingest.domain;

import java.util.List;
import java.util.Objects;

/**
 * A file selection submitted together under one user-selected category.
 *
 * @param files selected files in selection order
 * @param targetCategory category key the user selected
 */
public record BatchSubmission(List<SubmittedFile> files, String targetCategory) {

    public BatchSubmission {
        Objects.requireNonNull(files, "files");
        files = List.copyOf(files);
    }
}

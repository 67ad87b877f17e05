package com.phillippitts.docingest.service.resolve;

import java.util.List;

/**
 * A file whose dedup key collides with an earlier file of the same batch or with a document the
 * backend already holds.
 *
 * @param entryKey conflicted entry
 * @param fileName its display name
 * @param source where the colliding key came from
 * @param matches entry keys of the earlier batch files ({@code BATCH}) or names of the existing
 *                documents ({@code EXISTING})
 */
public record DuplicateCandidate(String entryKey, String fileName, Source source, List<String> matches)
        implements ResolutionCandidate {

    public enum Source { BATCH, EXISTING }

    public DuplicateCandidate {
        matches = List.copyOf(matches);
    }
}

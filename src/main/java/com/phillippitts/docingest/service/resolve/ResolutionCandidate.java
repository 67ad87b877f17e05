package com.phillippitts.docingest.service.resolve;

/**
 * One conflicted entry inside a {@link ResolutionRequest}.
 */
public interface ResolutionCandidate {

    String entryKey();

    String fileName();
}

package com.phillippitts.docingest.domain;

/**
 * A document the backend already holds, as listed by the existing-documents snapshot.
 *
 * @param documentId backend id (may be null in snapshots that only carry name and size)
 * @param name original file name
 * @param size original byte size, null when the backend did not record it
 * @param category category key the document was imported under
 */
public record KnownDocument(String documentId, String name, Long size, String category) {
}

package com.phillippitts.docingest.service.registry;

import com.phillippitts.docingest.domain.KnownDocument;

import java.util.List;

/**
 * Lists the documents the backend already holds.
 */
public interface ExistingDocumentsSource {

    List<KnownDocument> listDocuments();
}

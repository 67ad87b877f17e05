package com.phillippitts.docingest.service.registry;

/**
 * Backend deletion calls used by the surrounding application.
 */
public interface DocumentDeletionClient {

    void deleteDocument(String documentId);

    /**
     * @return number of documents the backend removed
     */
    int deleteByCategory(String category);
}

package com.phillippitts.docingest.service.registry;

import com.phillippitts.docingest.domain.DocumentCategory;
import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.service.orchestration.BatchCoordinator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Document deletion for the surrounding application. Deletes on the backend first, then lets the
 * coordinator drop the entries from the document list and from live dedup indexes.
 */
@Service
public class DocumentService {

    private static final Logger LOG = LogManager.getLogger(DocumentService.class);

    private final DocumentDeletionClient deletionClient;
    private final BatchCoordinator coordinator;

    public DocumentService(DocumentDeletionClient deletionClient, BatchCoordinator coordinator) {
        this.deletionClient = deletionClient;
        this.coordinator = coordinator;
    }

    public List<KnownDocument> list() {
        return coordinator.documents();
    }

    public void deleteDocument(String documentId) {
        deletionClient.deleteDocument(documentId);
        boolean listed = coordinator.forgetDocument(documentId).isPresent();
        LOG.info("Deleted document {}{}", documentId, listed ? "" : " (not in the local list)");
    }

    /**
     * @return number of documents the backend reported as deleted
     */
    public int deleteByCategory(String category) {
        String normalized = DocumentCategory.normalizeKey(category);
        int deleted = deletionClient.deleteByCategory(normalized);
        List<KnownDocument> removed = coordinator.forgetCategory(normalized);
        LOG.info("Deleted {} documents of {} ({} listed locally)", deleted, normalized, removed.size());
        return deleted;
    }
}

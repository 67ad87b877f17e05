package com.phillippitts.docingest.presentation.controller;

import com.phillippitts.docingest.domain.KnownDocument;
import com.phillippitts.docingest.service.registry.DocumentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Document list and deletions. Deletions also drop the document from the dedup indexes of
 * running batches.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentService documentService;

    public DocumentController(DocumentService documentService) {
        this.documentService = documentService;
    }

    @GetMapping
    public List<KnownDocument> list() {
        return documentService.list();
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> delete(@PathVariable String documentId) {
        documentService.deleteDocument(documentId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/by-category/{category}")
    public DeleteResponse deleteByCategory(@PathVariable String category) {
        return new DeleteResponse(documentService.deleteByCategory(category));
    }

    public record DeleteResponse(int deletedCount) {}
}

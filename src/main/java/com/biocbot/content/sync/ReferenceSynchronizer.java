package com.biocbot.content.sync;

import com.biocbot.content.course.CourseAggregateStore;
import com.biocbot.content.course.CourseModels.ReferenceUpsertResult;
import com.biocbot.content.document.DocumentModels.NewDocument;
import com.biocbot.content.document.DocumentStore;
import com.biocbot.content.domain.DomainModels.Document;
import com.biocbot.content.domain.DomainModels.DocumentStatus;
import com.biocbot.content.exception.DocumentNotFoundException;
import com.biocbot.content.exception.UnitNotFoundException;
import com.biocbot.content.indexing.IndexingModels.IndexRequest;
import com.biocbot.content.indexing.IndexingNotifier;
import com.biocbot.content.sync.SyncModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives the document repository and the course reference through document lifecycle
 * events. The repository write is primary: its failure aborts the operation. The reference
 * write is secondary: its failure is reported as a flag on the result. Indexing is
 * notified last and never influences the result.
 */
@Service
public class ReferenceSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(ReferenceSynchronizer.class);

    private final DocumentStore documentStore;
    private final CourseAggregateStore courseStore;
    private final IndexingNotifier indexingNotifier;

    public ReferenceSynchronizer(DocumentStore documentStore,
                                 CourseAggregateStore courseStore,
                                 IndexingNotifier indexingNotifier) {
        this.documentStore = documentStore;
        this.courseStore = courseStore;
        this.indexingNotifier = indexingNotifier;
    }

    public AddDocumentResult addDocument(NewDocument request) {
        Document document = documentStore.create(request);
        boolean linked = link(document, request.actorId());
        boolean indexing = indexingNotifier.documentIndexed(indexRequest(document));

        log.info("Document {} ({}) added to {}/{}, linked={}", document.documentId(), document.displayName(),
                document.courseId(), document.unitName(), linked);
        return new AddDocumentResult(document.documentId(), document.displayName(), document.sizeBytes(),
                document.createdAt(), linked, indexing);
    }

    /**
     * Deletes the document and its course reference. The course and unit hints are only used
     * when the document itself is already gone; without a course the reference cannot be located.
     */
    public DeleteDocumentResult deleteDocument(String documentId, String actorId, String courseIdHint, String unitNameHint) {
        Optional<Document> existing = documentStore.find(documentId);
        int deleted = documentStore.delete(documentId);

        String courseId = existing.map(Document::courseId).orElse(courseIdHint);
        String unitName = existing.map(Document::unitName).orElse(unitNameHint);
        int referencesRemoved = 0;
        if (courseId != null) {
            try {
                referencesRemoved = unlink(courseId, unitName, documentId, actorId);
            } catch (RuntimeException e) {
                log.warn("Document {} deleted but its reference in course {} could not be removed: {}",
                        documentId, courseId, e.getMessage(), e);
            }
        } else {
            log.debug("No course known for missing document {}, skipping reference cleanup", documentId);
        }
        indexingNotifier.documentRemoved(documentId);

        log.info("Document {} delete by {}: deletedCount={}, referencesRemoved={}", documentId, actorId, deleted, referencesRemoved);
        return new DeleteDocumentResult(documentId, deleted, referencesRemoved > 0, referencesRemoved);
    }

    /**
     * Callback for the text extraction service. A document deleted while extraction was in
     * flight is an expected race and reported as {@code documentGone}.
     */
    public ExtractionResult recordExtractedText(String documentId, String text) {
        try {
            documentStore.updateContent(documentId, text);
        } catch (DocumentNotFoundException e) {
            log.debug("Document {} was deleted before its extracted text arrived", documentId);
            return new ExtractionResult(documentId, false, true, false);
        }
        Optional<Document> document = documentStore.find(documentId);
        if (document.isEmpty()) {
            return new ExtractionResult(documentId, true, true, false);
        }
        boolean referenceUpdated = link(document.get(), document.get().actorId());
        indexingNotifier.documentIndexed(indexRequest(document.get()));
        return new ExtractionResult(documentId, true, false, referenceUpdated);
    }

    public ExtractionResult recordStatus(String documentId, DocumentStatus status) {
        try {
            documentStore.updateStatus(documentId, status);
        } catch (DocumentNotFoundException e) {
            log.debug("Document {} was deleted before status {} arrived", documentId, status);
            return new ExtractionResult(documentId, false, true, false);
        }
        return documentStore.find(documentId)
                .map(d -> new ExtractionResult(documentId, true, false, link(d, d.actorId())))
                .orElseGet(() -> new ExtractionResult(documentId, true, true, false));
    }

    /**
     * Rewrites the course reference of an existing document from its repository record.
     * Repairs documents added with {@code linkedToCourse == false}.
     */
    public RelinkResult relinkDocument(String documentId, String actorId) {
        Document document = documentStore.get(documentId);
        ReferenceUpsertResult result = courseStore.upsertDocumentReference(
                document.courseId(), document.unitName(), document.toReference(), actorId);
        log.info("Relinked document {} to {}/{} (appended={})", documentId, document.courseId(), document.unitName(), result.appended());
        return new RelinkResult(documentId, document.courseId(), document.unitName(), result.appended());
    }

    private boolean link(Document document, String actorId) {
        try {
            courseStore.upsertDocumentReference(document.courseId(), document.unitName(), document.toReference(), actorId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Document {} stored but not linked to {}/{}: {}", document.documentId(),
                    document.courseId(), document.unitName(), e.getMessage());
            return false;
        }
    }

    private int unlink(String courseId, String unitName, String documentId, String actorId) {
        if (unitName != null) {
            try {
                int removed = courseStore.removeDocumentReference(courseId, unitName, documentId, actorId);
                if (removed > 0) return removed;
            } catch (UnitNotFoundException e) {
                log.debug("Unit {} no longer in course {}, searching all units", unitName, courseId);
            }
        }
        return courseStore.removeDocumentReferenceFromAnyUnit(courseId, documentId, actorId).size();
    }

    private IndexRequest indexRequest(Document document) {
        return new IndexRequest(document.courseId(), document.unitName(), document.documentId(),
                document.textContent(), document.fileName() != null ? document.fileName() : document.displayName());
    }
}

package com.biocbot.content.document;

import com.biocbot.content.document.DocumentModels.DocumentStats;
import com.biocbot.content.document.DocumentModels.NewDocument;
import com.biocbot.content.domain.DomainModels.Document;
import com.biocbot.content.domain.DomainModels.DocumentMetadata;
import com.biocbot.content.domain.DomainModels.DocumentStatus;
import com.biocbot.content.exception.DocumentNotFoundException;
import com.biocbot.content.exception.InvalidRequestException;
import com.biocbot.content.repository.DocumentJdbcRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

import static com.biocbot.content.exception.StoreFailures.guard;
import static com.biocbot.content.exception.StoreFailures.run;

/**
 * Canonical store of course material. Knows nothing about course structure.
 */
@Service
public class DocumentStore {
    private final DocumentJdbcRepository repository;
    private final Clock clock;

    public DocumentStore(DocumentJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Document create(NewDocument doc) {
        Instant now = clock.instant();
        Document document = new Document(
                "doc_" + UUID.randomUUID(),
                doc.courseId(),
                doc.unitName(),
                doc.actorId(),
                doc.documentType(),
                doc.contentKind(),
                doc.displayName(),
                doc.fileName(),
                doc.fileData(),
                doc.text(),
                doc.mimeType(),
                doc.sizeBytes(),
                DocumentStatus.UPLOADED,
                doc.metadata() == null ? DocumentMetadata.empty() : doc.metadata(),
                now,
                now);
        run("document create", () -> repository.insert(document));
        return document;
    }

    public Document get(String documentId) {
        return find(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    public Optional<Document> find(String documentId) {
        return guard("document lookup", () -> repository.findById(documentId));
    }

    /**
     * Stores extracted text and marks the document parsed.
     *
     * @throws DocumentNotFoundException when the document was deleted meanwhile
     */
    public void updateContent(String documentId, String extractedText) {
        if (extractedText == null || extractedText.isBlank()) {
            throw new InvalidRequestException("EMPTY_CONTENT", "text", "Parsed documents must carry non-empty text");
        }
        int updated = guard("document content update", () -> repository.updateContent(documentId, extractedText, clock.instant()));
        if (updated == 0) throw new DocumentNotFoundException(documentId);
    }

    public void updateStatus(String documentId, DocumentStatus status) {
        if (status == DocumentStatus.PARSED) {
            throw new InvalidRequestException("STATUS_REQUIRES_CONTENT", "status", "Use the content update to mark a document parsed");
        }
        int updated = guard("document status update", () -> repository.updateStatus(documentId, status, clock.instant()));
        if (updated == 0) throw new DocumentNotFoundException(documentId);
    }

    /**
     * @return 1 when a document was removed, 0 when it was already gone
     */
    public int delete(String documentId) {
        return guard("document delete", () -> repository.delete(documentId));
    }

    public List<Document> listByUnit(String courseId, String unitName) {
        return guard("document listing", () -> repository.findByUnit(courseId, unitName));
    }

    /**
     * Returns the subset of {@code documentIds} that exist, in a single query.
     */
    public Set<String> existingIds(Collection<String> documentIds) {
        return guard("document existence lookup", () -> repository.findExistingIds(documentIds));
    }

    public DocumentStats stats(String courseId) {
        var rows = guard("document stats", () -> repository.statusBreakdown(courseId));
        Map<DocumentStatus, Long> byStatus = new EnumMap<>(DocumentStatus.class);
        long total = 0;
        long size = 0;
        for (var row : rows) {
            byStatus.put(row.status(), row.count());
            total += row.count();
            size += row.totalSize();
        }
        return new DocumentStats(courseId, total, size, byStatus);
    }
}

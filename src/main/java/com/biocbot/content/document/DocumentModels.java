package com.biocbot.content.document;

import com.biocbot.content.domain.DomainModels.ContentKind;
import com.biocbot.content.domain.DomainModels.DocumentMetadata;
import com.biocbot.content.domain.DomainModels.DocumentStatus;

import java.util.Map;

public class DocumentModels {
    /**
     * Everything needed to create a document except the repository-assigned fields.
     * {@code text} is the submitted text for TEXT documents and the extracted text,
     * when already known, for FILE documents.
     */
    public record NewDocument(String courseId,
                              String unitName,
                              String actorId,
                              String documentType,
                              ContentKind contentKind,
                              String displayName,
                              String fileName,
                              byte[] fileData,
                              String text,
                              String mimeType,
                              long sizeBytes,
                              DocumentMetadata metadata) {}

    public record DocumentStats(String courseId, long totalDocuments, long totalSize, Map<DocumentStatus, Long> countByStatus) {}
}

package com.biocbot.content.sync;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class SyncModels {
    /**
     * {@code linkedToCourse == false} means the document exists but its unit reference
     * could not be written; it stays retrievable by id until relinked.
     */
    public record AddDocumentResult(String documentId,
                                    String displayName,
                                    long sizeBytes,
                                    Instant createdAt,
                                    boolean linkedToCourse,
                                    boolean indexingScheduled) {}

    public record DeleteDocumentResult(String documentId,
                                       int deletedCount,
                                       boolean removedFromCourse,
                                       int referencesRemoved) {}

    public record ExtractionResult(String documentId,
                                   boolean stored,
                                   boolean documentGone,
                                   boolean referenceUpdated) {}

    public record RelinkResult(String documentId, String courseId, String unitName, boolean appended) {}

    public record ReconcileResult(String courseId,
                                  int orphanReferencesRemoved,
                                  int unitsModified,
                                  Map<String, List<String>> removedByUnit) {}
}

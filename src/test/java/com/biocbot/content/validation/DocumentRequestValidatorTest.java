package com.biocbot.content.validation;

import com.biocbot.content.config.SyncProperties;
import com.biocbot.content.config.SyncProperties.LookupFailurePolicy;
import com.biocbot.content.document.DocumentModels.NewDocument;
import com.biocbot.content.domain.DomainModels.ContentKind;
import com.biocbot.content.domain.DomainModels.DocumentMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentRequestValidatorTest {
    private final DocumentRequestValidator validator = new DocumentRequestValidator(new SyncProperties(
            new SyncProperties.Reconcile(500, LookupFailurePolicy.DANGLING),
            new SyncProperties.Indexing(true, 1000, 200, 1, 10),
            new SyncProperties.Upload(100, List.of("application/pdf", "text/plain"))));

    @Test
    void acceptsCompleteRequests() {
        assertTrue(validator.validate(file("application/pdf", new byte[]{1, 2, 3})).isEmpty());
        assertTrue(validator.validate(text("Enzymes speed up reactions")).isEmpty());
    }

    @Test
    void reportsEveryMissingField() {
        var doc = new NewDocument(null, " ", null, null, ContentKind.TEXT, null, null, null, "body", "text/plain", 4,
                DocumentMetadata.empty());

        List<String> fields = validator.validate(doc).stream().map(ValidationError::field).toList();
        assertEquals(List.of("courseId", "unitName", "actorId", "documentType", "displayName"), fields);
    }

    @Test
    void rejectsDisallowedMimeTypeAndEmptyFile() {
        var errors = validator.validate(file("image/png", new byte[0]));

        assertEquals(List.of("MISSING_FIELD", "UNSUPPORTED_MIME_TYPE"), errors.stream().map(ValidationError::code).toList());
    }

    @Test
    void rejectsTextCarryingBinaryContent() {
        var doc = new NewDocument("C1", "Unit 1", "inst-1", "notes", ContentKind.TEXT, "T", "T.txt", new byte[]{1}, "body",
                "text/plain", 4, DocumentMetadata.empty());

        var errors = validator.validate(doc);
        assertEquals(1, errors.size());
        assertEquals("CONTENT_KIND_MISMATCH", errors.get(0).code());
    }

    @Test
    void rejectsOversizedDocuments() {
        var errors = validator.validate(file("application/pdf", new byte[101]));

        assertEquals("FILE_TOO_LARGE", errors.get(0).code());
    }

    @Test
    void missingContentKindStopsFurtherChecks() {
        var doc = new NewDocument("C1", "Unit 1", "inst-1", "notes", null, "T", null, null, null, null, 0, null);

        var errors = validator.validate(doc);
        assertEquals(1, errors.size());
        assertEquals("contentKind", errors.get(0).field());
    }

    private NewDocument file(String mimeType, byte[] data) {
        return new NewDocument("C1", "Unit 1", "inst-1", "notes", ContentKind.FILE, "a.pdf", "a.pdf", data, null,
                mimeType, data.length, DocumentMetadata.empty());
    }

    private NewDocument text(String body) {
        return new NewDocument("C1", "Unit 1", "inst-1", "notes", ContentKind.TEXT, "T", "T.txt", null, body,
                "text/plain", body.length(), DocumentMetadata.empty());
    }
}

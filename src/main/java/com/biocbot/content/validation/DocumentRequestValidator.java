package com.biocbot.content.validation;

import com.biocbot.content.config.SyncProperties;
import com.biocbot.content.document.DocumentModels.NewDocument;
import com.biocbot.content.domain.DomainModels.ContentKind;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class DocumentRequestValidator {
    private final long maxSizeBytes;
    private final Set<String> allowedMimeTypes;

    public DocumentRequestValidator(SyncProperties properties) {
        this.maxSizeBytes = properties.upload().maxSizeBytes();
        this.allowedMimeTypes = new HashSet<>(properties.upload().allowedMimeTypes());
    }

    public List<ValidationError> validate(NewDocument doc) {
        List<ValidationError> errors = new ArrayList<>();

        required(doc.courseId(), "courseId", errors);
        required(doc.unitName(), "unitName", errors);
        required(doc.actorId(), "actorId", errors);
        required(doc.documentType(), "documentType", errors);
        required(doc.displayName(), "displayName", errors);

        if (doc.contentKind() == null) {
            errors.add(new ValidationError("MISSING_FIELD", "contentKind", "Missing required field: contentKind"));
            return errors;
        }

        if (doc.contentKind() == ContentKind.FILE) {
            if (doc.fileData() == null || doc.fileData().length == 0) {
                errors.add(new ValidationError("MISSING_FIELD", "file", "File uploads need a non-empty file"));
            }
            if (doc.mimeType() == null || !allowedMimeTypes.contains(doc.mimeType())) {
                errors.add(new ValidationError("UNSUPPORTED_MIME_TYPE", "mimeType", "File type not allowed: " + doc.mimeType()));
            }
        } else {
            if (doc.text() == null || doc.text().isBlank()) {
                errors.add(new ValidationError("MISSING_FIELD", "content", "Text documents need non-empty content"));
            }
            if (doc.fileData() != null) {
                errors.add(new ValidationError("CONTENT_KIND_MISMATCH", "file", "Text documents cannot carry binary content"));
            }
        }

        if (doc.sizeBytes() > maxSizeBytes) {
            errors.add(new ValidationError("FILE_TOO_LARGE", "size", "Document exceeds " + maxSizeBytes + " bytes"));
        }
        return errors;
    }

    private void required(String value, String field, List<ValidationError> errors) {
        if (value == null || value.isBlank()) {
            errors.add(new ValidationError("MISSING_FIELD", field, "Missing required field: " + field));
        }
    }
}

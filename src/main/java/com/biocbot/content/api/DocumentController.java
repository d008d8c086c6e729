package com.biocbot.content.api;

import com.biocbot.content.document.DocumentModels.DocumentStats;
import com.biocbot.content.document.DocumentModels.NewDocument;
import com.biocbot.content.document.DocumentStore;
import com.biocbot.content.domain.DomainModels.ContentKind;
import com.biocbot.content.domain.DomainModels.Document;
import com.biocbot.content.domain.DomainModels.DocumentMetadata;
import com.biocbot.content.domain.DomainModels.DocumentStatus;
import com.biocbot.content.exception.InvalidRequestException;
import com.biocbot.content.sync.ReferenceSynchronizer;
import com.biocbot.content.sync.SyncModels.*;
import com.biocbot.content.validation.DocumentRequestValidator;
import com.biocbot.content.validation.ValidationError;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {
    private static final Set<String> PLAIN_TEXT_TYPES = Set.of("text/plain", "text/markdown");

    private final ReferenceSynchronizer synchronizer;
    private final DocumentStore documentStore;
    private final DocumentRequestValidator validator;

    public DocumentController(ReferenceSynchronizer synchronizer,
                              DocumentStore documentStore,
                              DocumentRequestValidator validator) {
        this.synchronizer = synchronizer;
        this.documentStore = documentStore;
        this.validator = validator;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AddDocumentResult> upload(@RequestHeader("X-Actor-Id") String actorId,
                                                    @RequestParam String courseId,
                                                    @RequestParam String unitName,
                                                    @RequestParam String documentType,
                                                    @RequestParam("file") MultipartFile file,
                                                    @RequestParam(required = false) String description,
                                                    @RequestParam(required = false) String tags,
                                                    @RequestParam(required = false) String learningObjectives) throws IOException {
        byte[] bytes = file.getBytes();
        String contentType = file.getContentType();
        String text = contentType != null && PLAIN_TEXT_TYPES.contains(contentType) ? new String(bytes, StandardCharsets.UTF_8) : null;
        NewDocument doc = new NewDocument(courseId, unitName, actorId, documentType, ContentKind.FILE,
                file.getOriginalFilename(), file.getOriginalFilename(), bytes, text, file.getContentType(), file.getSize(),
                new DocumentMetadata(description == null ? "" : description, parseCsv(tags), parseCsv(learningObjectives)));
        return ResponseEntity.ok(add(doc));
    }

    @PostMapping("/text")
    public ResponseEntity<AddDocumentResult> submitText(@RequestHeader("X-Actor-Id") String actorId,
                                                        @RequestBody TextDocumentRequest request) {
        String content = request.content();
        NewDocument doc = new NewDocument(request.courseId(), request.unitName(), actorId, request.documentType(), ContentKind.TEXT,
                request.title(), request.title() == null ? null : request.title() + ".txt", null, content, "text/plain",
                content == null ? 0 : content.getBytes(StandardCharsets.UTF_8).length,
                new DocumentMetadata(request.description() == null ? "" : request.description(),
                        request.tags() == null ? List.of() : request.tags(),
                        request.learningObjectives() == null ? List.of() : request.learningObjectives()));
        return ResponseEntity.ok(add(doc));
    }

    @GetMapping
    public ResponseEntity<UnitDocumentsResponse> listByUnit(@RequestParam String courseId, @RequestParam String unitName) {
        List<Document> documents = documentStore.listByUnit(courseId, unitName);
        return ResponseEntity.ok(new UnitDocumentsResponse(courseId, unitName, documents, documents.size()));
    }

    @GetMapping("/stats")
    public ResponseEntity<DocumentStats> stats(@RequestParam String courseId) {
        return ResponseEntity.ok(documentStore.stats(courseId));
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<Document> get(@PathVariable String documentId) {
        return ResponseEntity.ok(documentStore.get(documentId));
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<DeleteDocumentResult> delete(@RequestHeader("X-Actor-Id") String actorId,
                                                       @PathVariable String documentId,
                                                       @RequestParam(required = false) String courseId,
                                                       @RequestParam(required = false) String unitName) {
        return ResponseEntity.ok(synchronizer.deleteDocument(documentId, actorId, courseId, unitName));
    }

    @PutMapping("/{documentId}/content")
    public ResponseEntity<ExtractionResult> recordContent(@PathVariable String documentId, @RequestBody ContentRequest request) {
        return ResponseEntity.ok(synchronizer.recordExtractedText(documentId, request.text()));
    }

    @PutMapping("/{documentId}/status")
    public ResponseEntity<ExtractionResult> recordStatus(@PathVariable String documentId, @RequestBody StatusRequest request) {
        if (request.status() == null) {
            throw new InvalidRequestException("MISSING_FIELD", "status", "Missing required field: status");
        }
        return ResponseEntity.ok(synchronizer.recordStatus(documentId, request.status()));
    }

    @PostMapping("/{documentId}/relink")
    public ResponseEntity<RelinkResult> relink(@RequestHeader("X-Actor-Id") String actorId, @PathVariable String documentId) {
        return ResponseEntity.ok(synchronizer.relinkDocument(documentId, actorId));
    }

    private AddDocumentResult add(NewDocument doc) {
        List<ValidationError> errors = validator.validate(doc);
        if (!errors.isEmpty()) throw new InvalidRequestException(errors);
        return synchronizer.addDocument(doc);
    }

    private List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public record TextDocumentRequest(String courseId,
                                      String unitName,
                                      String documentType,
                                      String title,
                                      String content,
                                      String description,
                                      List<String> tags,
                                      List<String> learningObjectives) {}

    public record UnitDocumentsResponse(String courseId, String unitName, List<Document> documents, int count) {}

    public record ContentRequest(String text) {}

    public record StatusRequest(DocumentStatus status) {}
}

package com.biocbot.content.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class DomainModels {
    public record Document(String documentId,
                           String courseId,
                           String unitName,
                           String actorId,
                           String documentType,
                           ContentKind contentKind,
                           String displayName,
                           String fileName,
                           byte[] fileData,
                           String textContent,
                           String mimeType,
                           long sizeBytes,
                           DocumentStatus status,
                           DocumentMetadata metadata,
                           Instant createdAt,
                           Instant lastModifiedAt) {

        public boolean hasText() {
            return textContent != null && !textContent.isBlank();
        }

        public DocumentReference toReference() {
            return new DocumentReference(documentId, displayName, documentType, mimeType, sizeBytes, status, metadata, null, null);
        }
    }

    public record DocumentMetadata(String description, List<String> tags, List<String> learningObjectives) {
        public static DocumentMetadata empty() {
            return new DocumentMetadata("", List.of(), List.of());
        }
    }

    public enum ContentKind { FILE, TEXT }

    public enum DocumentStatus { UPLOADED, PARSING, PARSED, ERROR }

    public record Course(String courseId,
                         String courseName,
                         String ownerId,
                         List<StaffMember> staff,
                         List<Unit> units,
                         Instant createdAt,
                         Instant updatedAt,
                         String lastUpdatedBy) {

        public Unit unit(String unitName) {
            return units.stream().filter(u -> u.name().equals(unitName)).findFirst().orElse(null);
        }
    }

    public record StaffMember(String memberId, StaffRole role) {}

    public enum StaffRole { INSTRUCTOR, TA }

    public record Unit(String name,
                       boolean isPublished,
                       List<String> learningObjectives,
                       Integer passThreshold,
                       List<AssessmentQuestion> assessmentQuestions,
                       List<DocumentReference> documentReferences,
                       Instant createdAt,
                       Instant updatedAt,
                       String lastUpdatedBy) {}

    public record AssessmentQuestion(String questionId,
                                     QuestionType questionType,
                                     String prompt,
                                     Map<String, String> options,
                                     String correctAnswer,
                                     String explanation,
                                     Instant createdAt,
                                     Instant updatedAt) {

        public AssessmentQuestion withId(String id) {
            return new AssessmentQuestion(id, questionType, prompt, options, correctAnswer, explanation, createdAt, updatedAt);
        }
    }

    public enum QuestionType { TRUE_FALSE, MULTIPLE_CHOICE, SHORT_ANSWER }

    public record DocumentReference(String documentId,
                                    String displayName,
                                    String documentType,
                                    String mimeType,
                                    long sizeBytes,
                                    DocumentStatus status,
                                    DocumentMetadata metadata,
                                    Instant createdAt,
                                    Instant updatedAt) {}
}

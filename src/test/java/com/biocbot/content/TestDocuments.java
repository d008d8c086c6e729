package com.biocbot.content;

import com.biocbot.content.course.CourseModels.NewCourse;
import com.biocbot.content.document.DocumentModels.NewDocument;
import com.biocbot.content.domain.DomainModels.ContentKind;
import com.biocbot.content.domain.DomainModels.DocumentMetadata;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

final class TestDocuments {
    static final String INSTRUCTOR = "inst-1";

    private TestDocuments() {
    }

    static String uniqueCourseId() {
        return "BIOC-" + UUID.randomUUID();
    }

    /** Two units: "Unit 1" carrying the objectives, and "Unit 2". */
    static NewCourse twoUnitCourse(String courseId) {
        return new NewCourse(courseId, "Biochemistry", INSTRUCTOR, 1, 2, List.of("Explain enzyme kinetics"));
    }

    static NewDocument text(String courseId, String unitName, String title, String content) {
        return new NewDocument(courseId, unitName, INSTRUCTOR, "lecture-notes", ContentKind.TEXT, title, title + ".txt",
                null, content, "text/plain", content.getBytes(StandardCharsets.UTF_8).length,
                new DocumentMetadata("", List.of("week-1"), List.of()));
    }

    static NewDocument pdf(String courseId, String unitName, String fileName) {
        byte[] bytes = "%PDF-1.4 lecture".getBytes(StandardCharsets.US_ASCII);
        return new NewDocument(courseId, unitName, INSTRUCTOR, "lecture-notes", ContentKind.FILE, fileName, fileName,
                bytes, null, "application/pdf", bytes.length, DocumentMetadata.empty());
    }
}

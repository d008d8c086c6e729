package com.biocbot.content.course;

import java.util.List;

public class CourseModels {
    public record NewCourse(String courseId,
                            String courseName,
                            String ownerId,
                            int weeks,
                            int lecturesPerWeek,
                            List<String> initialObjectives) {}

    public record CourseCreateResult(String courseId, boolean created, int totalUnits) {}

    public record QuestionUpsertResult(String questionId, boolean appended) {}

    public record ReferenceUpsertResult(String documentId, boolean appended) {}
}

package com.biocbot.content.exception;

public class CourseNotFoundException extends NotFoundException {
    public CourseNotFoundException(String courseId) {
        super("Course not found: " + courseId);
    }
}

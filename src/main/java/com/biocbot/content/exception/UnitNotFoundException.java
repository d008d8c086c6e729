package com.biocbot.content.exception;

public class UnitNotFoundException extends NotFoundException {
    public UnitNotFoundException(String courseId, String unitName) {
        super("Unit " + unitName + " not found in course " + courseId);
    }
}

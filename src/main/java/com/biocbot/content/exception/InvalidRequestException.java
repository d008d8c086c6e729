package com.biocbot.content.exception;

import com.biocbot.content.validation.ValidationError;

import java.util.List;

public class InvalidRequestException extends RuntimeException {
    private final List<ValidationError> errors;

    public InvalidRequestException(List<ValidationError> errors) {
        super(errors.isEmpty() ? "Invalid request" : errors.get(0).message());
        this.errors = List.copyOf(errors);
    }

    public InvalidRequestException(String code, String field, String message) {
        this(List.of(new ValidationError(code, field, message)));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}

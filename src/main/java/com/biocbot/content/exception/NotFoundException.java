package com.biocbot.content.exception;

/**
 * Target course, unit or document is absent. Never retried.
 */
public abstract class NotFoundException extends RuntimeException {
    protected NotFoundException(String message) {
        super(message);
    }
}

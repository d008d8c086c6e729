package com.biocbot.content.exception;

/**
 * Storage backend unreachable or timed out. Callers may retry.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.biocbot.content.exception;

public class DocumentNotFoundException extends NotFoundException {
    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
    }
}

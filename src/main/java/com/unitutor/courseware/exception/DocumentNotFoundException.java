package com.unitutor.courseware.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends RuntimeException {
    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}

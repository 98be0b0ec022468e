package com.unitutor.courseware.exception;

import lombok.Getter;

@Getter
public class RunInProgressException extends RuntimeException {
    private final String documentId;

    public RunInProgressException(String documentId) {
        super("A processing run is already active for document: " + documentId);
        this.documentId = documentId;
    }
}

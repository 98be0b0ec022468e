package com.unitutor.courseware.exception;

import com.unitutor.courseware.model.DocumentStatus;
import lombok.Getter;

@Getter
public class DocumentNotReadyException extends RuntimeException {
    private final String documentId;
    private final DocumentStatus status;

    public DocumentNotReadyException(String documentId, DocumentStatus status) {
        super("Document " + documentId + " is not ready for export, status: " + status);
        this.documentId = documentId;
        this.status = status;
    }
}

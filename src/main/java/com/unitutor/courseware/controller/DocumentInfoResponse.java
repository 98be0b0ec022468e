package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.unitutor.courseware.model.DocumentInfo;
import com.unitutor.courseware.model.DocumentStatus;

import java.time.OffsetDateTime;

public record DocumentInfoResponse(
    @JsonProperty("pdf_id") String pdfId,
    String filename,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("upload_time") OffsetDateTime uploadTime,
    DocumentStatus status,
    @JsonProperty("processed_pages") int processedPages,
    @JsonProperty("cached_pages") int cachedPages
) {
    public static DocumentInfoResponse from(DocumentInfo info) {
        return new DocumentInfoResponse(
            info.documentId(),
            info.filename(),
            info.totalPages(),
            info.uploadedAt(),
            info.status(),
            info.processedPages(),
            info.cachedPages()
        );
    }
}

package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.unitutor.courseware.model.DocumentStatus;
import com.unitutor.courseware.model.ProcessingProgress;

public record ProgressResponse(
    @JsonProperty("pdf_id") String pdfId,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("processed_pages") int processedPages,
    DocumentStatus status,
    double progress,
    boolean running
) {
    public static ProgressResponse from(ProcessingProgress progress, boolean running) {
        return new ProgressResponse(
            progress.documentId(),
            progress.totalSelected(),
            progress.processed(),
            progress.status(),
            progress.percent(),
            running
        );
    }
}

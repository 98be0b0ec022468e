package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.unitutor.courseware.model.SubmitResult;

public record UploadResponse(
    @JsonProperty("pdf_id") String pdfId,
    String filename,
    @JsonProperty("total_pages") int totalPages,
    boolean created
) {
    public static UploadResponse from(SubmitResult result) {
        return new UploadResponse(result.documentId(), result.filename(), result.totalPages(), result.created());
    }
}

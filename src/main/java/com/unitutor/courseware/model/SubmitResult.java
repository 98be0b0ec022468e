package com.unitutor.courseware.model;

public record SubmitResult(
    String documentId,
    String filename,
    int totalPages,
    boolean created
) {}

package com.unitutor.courseware.model;

import java.time.OffsetDateTime;

public record DocumentInfo(
    String documentId,
    String filename,
    int totalPages,
    OffsetDateTime uploadedAt,
    DocumentStatus status,
    int processedPages,
    int cachedPages
) {}

package com.unitutor.courseware.model;

import java.time.OffsetDateTime;

public record Document(
    String id,
    String filename,
    int totalPages,
    String filePath,
    DocumentStatus status,
    int processedPages,
    int selectedPages,
    OffsetDateTime uploadedAt,
    OffsetDateTime updatedAt
) {}

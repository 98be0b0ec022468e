package com.unitutor.courseware.model;

import java.time.OffsetDateTime;

public record PageArtifact(
    String documentId,
    int pageNumber,
    String pageType,
    String body,
    String summary,
    OffsetDateTime createdAt
) {
    public static final String DEFAULT_PAGE_TYPE = "CONTENT";
}

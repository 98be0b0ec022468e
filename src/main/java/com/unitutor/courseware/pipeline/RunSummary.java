package com.unitutor.courseware.pipeline;

import com.unitutor.courseware.model.DocumentStatus;

public record RunSummary(
    String documentId,
    int cached,
    int generated,
    int skipped,
    boolean cancelled,
    DocumentStatus finalStatus
) {
    public int processed() {
        return cached + generated;
    }
}

package com.unitutor.courseware.model;

public record ProcessingProgress(
    String documentId,
    int totalSelected,
    int processed,
    DocumentStatus status,
    double percent
) {
    public static ProcessingProgress of(Document document) {
        int selected = document.selectedPages();
        int processed = Math.min(document.processedPages(), selected);
        double percent = selected == 0 ? 0.0 : Math.round(processed * 1000.0 / selected) / 10.0;
        return new ProcessingProgress(document.id(), selected, processed, document.status(), percent);
    }
}

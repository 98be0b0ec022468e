package com.unitutor.courseware.model;

/**
 * Either a cached artifact or a placeholder for a page that has not been generated yet.
 */
public record PageArtifactView(
    String documentId,
    int pageNumber,
    boolean ready,
    String pageType,
    String body,
    String summary
) {
    public static PageArtifactView ready(PageArtifact artifact) {
        return new PageArtifactView(
            artifact.documentId(),
            artifact.pageNumber(),
            true,
            artifact.pageType(),
            artifact.body(),
            artifact.summary()
        );
    }

    public static PageArtifactView pending(String documentId, int pageNumber) {
        return new PageArtifactView(documentId, pageNumber, false, null, null, null);
    }
}

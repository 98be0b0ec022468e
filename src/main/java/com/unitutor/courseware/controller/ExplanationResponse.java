package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.unitutor.courseware.model.PageArtifact;
import com.unitutor.courseware.model.PageArtifactView;

public record ExplanationResponse(
    @JsonProperty("pdf_id") String pdfId,
    @JsonProperty("page_number") int pageNumber,
    boolean ready,
    @JsonProperty("page_type") String pageType,
    String explanation,
    String summary
) {
    public static ExplanationResponse from(PageArtifactView view) {
        return new ExplanationResponse(
            view.documentId(),
            view.pageNumber(),
            view.ready(),
            view.pageType(),
            view.body(),
            view.summary()
        );
    }

    public static ExplanationResponse from(PageArtifact artifact) {
        return from(PageArtifactView.ready(artifact));
    }
}

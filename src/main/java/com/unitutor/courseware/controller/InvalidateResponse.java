package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InvalidateResponse(
    @JsonProperty("pdf_id") String pdfId,
    int removed
) {}

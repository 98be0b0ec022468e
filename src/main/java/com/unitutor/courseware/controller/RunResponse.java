package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.unitutor.courseware.model.RunAdmission;

public record RunResponse(
    @JsonProperty("pdf_id") String pdfId,
    RunAdmission admission,
    String message
) {}

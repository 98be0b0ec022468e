package com.unitutor.courseware.pipeline;

import com.unitutor.courseware.model.GeneratorConfig;

public record GenerationRequest(
    int pageNumber,
    byte[] image,
    String prompt,
    String context,
    double temperature,
    int maxOutputTokens,
    GeneratorConfig config
) {}

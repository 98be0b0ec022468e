package com.unitutor.courseware.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.unitutor.courseware.model.GeneratorConfig;
import com.unitutor.courseware.model.OutputFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record StartRunRequest(
    @NotEmpty @JsonProperty("selected_pages") List<Integer> selectedPages,
    @JsonProperty("model_name") String modelName,
    @JsonProperty("api_key") String apiKey,
    @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
    @Min(1) @Max(65536) @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("output_format") OutputFormat outputFormat
) {
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(modelName, apiKey, temperature, maxTokens, outputFormat);
    }
}

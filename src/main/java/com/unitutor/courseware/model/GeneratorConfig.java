package com.unitutor.courseware.model;

/**
 * Per-run overrides for the generator. Null fields fall back to the application defaults.
 */
public record GeneratorConfig(
    String modelName,
    String apiKey,
    Double temperature,
    Integer maxOutputTokens,
    OutputFormat outputFormat
) {
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, null, null, OutputFormat.MARKDOWN);
    }

    public OutputFormat outputFormatOrDefault() {
        return outputFormat != null ? outputFormat : OutputFormat.MARKDOWN;
    }

    public boolean hasCustomModel() {
        return (apiKey != null && !apiKey.isBlank()) || (modelName != null && !modelName.isBlank());
    }
}

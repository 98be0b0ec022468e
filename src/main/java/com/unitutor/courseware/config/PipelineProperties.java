package com.unitutor.courseware.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
	@NotNull @Min(0) @Max(20) Integer contextWindow,
	@NotNull Duration pageDelay,
	@NotNull @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
	@NotNull @Min(1) @Max(65536) Integer maxOutputTokens,
	@NotNull @Min(20) @Max(2000) Integer summaryMaxChars,
	@NotNull @Min(1) Integer staleThresholdMinutes
) {}

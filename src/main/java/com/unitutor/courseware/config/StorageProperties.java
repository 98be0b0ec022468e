package com.unitutor.courseware.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
	@NotBlank String uploadDir,
	@NotNull @Min(1) @Max(1024) Integer maxFileSizeMb,
	@NotNull @Min(36) @Max(600) Integer renderDpi
) {
	public long maxFileSizeBytes() {
		return maxFileSizeMb * 1024L * 1024L;
	}
}

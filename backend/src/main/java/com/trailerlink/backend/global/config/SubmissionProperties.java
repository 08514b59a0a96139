package com.trailerlink.backend.global.config;

import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.submission")
public record SubmissionProperties(
        @DefaultValue("400") @Min(1) int pendingLimit,
        @DefaultValue("3") @Min(1) int maxIdAttempts
) {
}

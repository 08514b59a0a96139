package com.trailerlink.backend.global.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.admin")
public record AdminProperties(
        @DefaultValue Bootstrap bootstrap,
        @DefaultValue("10") @Min(4) @Max(31) int bcryptStrength
) {

    /**
     * Super admin created on startup when both values are present.
     */
    public record Bootstrap(String username, String password) {

        public boolean isConfigured() {
            return StringUtils.hasText(username) && StringUtils.hasText(password);
        }
    }
}

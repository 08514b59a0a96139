package com.trailerlink.backend.global.config;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code app.*} properties and provides the single UTC clock every module reads time from.
 */
@Configuration
@EnableConfigurationProperties({
        StoreProperties.class,
        SubmissionProperties.class,
        AdminProperties.class
})
public class ApplicationConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}

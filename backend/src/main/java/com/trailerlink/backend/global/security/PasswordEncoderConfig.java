package com.trailerlink.backend.global.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.trailerlink.backend.global.config.AdminProperties;

@Configuration
public class PasswordEncoderConfig {

    @Bean
    public PasswordEncoder passwordEncoder(AdminProperties adminProperties) {
        return new BCryptPasswordEncoder(adminProperties.bcryptStrength());
    }
}

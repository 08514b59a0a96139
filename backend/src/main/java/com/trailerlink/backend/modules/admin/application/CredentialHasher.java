package com.trailerlink.backend.modules.admin.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * One-way hashing of admin passwords with the configured BCrypt {@link PasswordEncoder}.
 * Digests in any other format (such as bare SHA-256 hex) never verify.
 */
@Component
public class CredentialHasher {

    private final PasswordEncoder passwordEncoder;

    public CredentialHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("plaintext must not be empty");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || !StringUtils.hasText(digest)) {
            return false;
        }
        return passwordEncoder.matches(plaintext, digest);
    }
}

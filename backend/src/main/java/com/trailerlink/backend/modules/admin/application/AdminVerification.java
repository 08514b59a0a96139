package com.trailerlink.backend.modules.admin.application;

import com.trailerlink.backend.modules.admin.domain.AdminRole;

/**
 * Result of a credential check. {@code role} and {@code username} are only set when {@code valid}.
 */
public record AdminVerification(boolean valid, AdminRole role, String username) {

    private static final AdminVerification INVALID = new AdminVerification(false, null, null);

    public static AdminVerification invalid() {
        return INVALID;
    }

    public static AdminVerification of(AdminRole role, String username) {
        return new AdminVerification(true, role, username);
    }
}

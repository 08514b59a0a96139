package com.trailerlink.backend.modules.admin.domain;

public enum AdminRole {
    /** May review submissions and create other admins. */
    SUPER,
    /** May review submissions only. */
    SECONDARY
}

package com.trailerlink.backend.modules.submission.domain;

public enum SubmissionStatus {
    PENDING,
    APPROVED,
    REJECTED
}

package com.trailerlink.backend.modules.submission.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A proposed film-to-trailer mapping. Rows are inserted by the submission queue and decided once
 * by moderation; they are never deleted.
 */
@Entity
@Table(name = "submission")
public class Submission {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "source_id", nullable = false, updatable = false, length = 32)
    private String sourceId;

    @Column(name = "target_url", nullable = false, updatable = false, length = 2048)
    private String targetUrl;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private OffsetDateTime submittedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SubmissionStatus status;

    protected Submission() {
    }

    public Long getId() {
        return id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public OffsetDateTime getSubmittedAt() {
        return submittedAt;
    }

    public SubmissionStatus getStatus() {
        return status;
    }

    public boolean isPending() {
        return status == SubmissionStatus.PENDING;
    }

    public void decide(SubmissionStatus decision) {
        if (decision == null || decision == SubmissionStatus.PENDING) {
            throw new IllegalArgumentException("decision must be APPROVED or REJECTED");
        }
        if (!isPending()) {
            throw new IllegalStateException("submission " + id + " already decided as " + status);
        }
        this.status = decision;
    }
}

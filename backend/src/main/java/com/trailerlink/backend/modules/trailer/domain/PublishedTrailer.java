package com.trailerlink.backend.modules.trailer.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * The approved trailer link for a film. One row per source id; a later approval overwrites it.
 */
@Entity
@Table(name = "published_trailer")
public class PublishedTrailer {

    @Id
    @Column(name = "source_id", nullable = false, updatable = false, length = 32)
    private String sourceId;

    @Column(name = "target_url", nullable = false, length = 2048)
    private String targetUrl;

    @Column(name = "approved_at", nullable = false)
    private OffsetDateTime approvedAt;

    @Column(name = "reviewer", nullable = false, length = 64)
    private String reviewer;

    protected PublishedTrailer() {
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public OffsetDateTime getApprovedAt() {
        return approvedAt;
    }

    public String getReviewer() {
        return reviewer;
    }
}

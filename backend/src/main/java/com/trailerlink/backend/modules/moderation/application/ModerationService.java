package com.trailerlink.backend.modules.moderation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.trailerlink.backend.global.error.ProblemException;
import com.trailerlink.backend.modules.submission.domain.Submission;
import com.trailerlink.backend.modules.submission.domain.SubmissionStatus;
import com.trailerlink.backend.modules.submission.infrastructure.persistence.SubmissionRepository;
import com.trailerlink.backend.modules.trailer.infrastructure.persistence.PublishedTrailerRepository;

/**
 * Decides pending submissions. The status change and the publish happen in one transaction; the
 * pending row is locked up front so a second reviewer of the same id waits, re-reads the status
 * and gets {@code moderation.submission_not_found}. The wait is bounded by a session lock timeout
 * of {@value #LOCK_TIMEOUT_SECONDS}s.
 */
@Service
public class ModerationService {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    public static final String CODE_SUBMISSION_NOT_FOUND = "moderation.submission_not_found";
    public static final String CODE_REVIEWER_REQUIRED = "moderation.reviewer_required";
    public static final String CODE_INVALID_INPUT = "moderation.invalid_input";
    public static final String CODE_REVIEW_IN_PROGRESS = "moderation.review_in_progress";

    static final int REVIEW_TIMEOUT_SECONDS = 10;
    static final int LOCK_TIMEOUT_SECONDS = 3;
    static final int MAX_REVIEWER_LENGTH = 64;

    // SET LOCAL is scoped to the surrounding transaction
    static final String LOCK_TIMEOUT_SQL = "SET LOCAL lock_timeout = '" + LOCK_TIMEOUT_SECONDS + "s'";

    private final SubmissionRepository submissionRepository;
    private final PublishedTrailerRepository publishedTrailerRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ModerationService(
            SubmissionRepository submissionRepository,
            PublishedTrailerRepository publishedTrailerRepository,
            JdbcTemplate jdbcTemplate,
            Clock clock
    ) {
        this.submissionRepository = submissionRepository;
        this.publishedTrailerRepository = publishedTrailerRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Transactional(timeout = REVIEW_TIMEOUT_SECONDS)
    public void review(long submissionId, boolean approve, String reviewer) {
        String normalizedReviewer = requireReviewer(reviewer);

        Submission submission = lockPending(submissionId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, CODE_SUBMISSION_NOT_FOUND,
                        "Submission not found or already reviewed"));

        submission.decide(approve ? SubmissionStatus.APPROVED : SubmissionStatus.REJECTED);
        submissionRepository.saveAndFlush(submission);
        if (approve) {
            publishedTrailerRepository.upsert(
                    submission.getSourceId(),
                    submission.getTargetUrl(),
                    OffsetDateTime.now(clock),
                    normalizedReviewer
            );
        }
        log.info("Submission {} for {} {} by {}", submissionId, submission.getSourceId(),
                approve ? "approved" : "rejected", normalizedReviewer);
    }

    private Optional<Submission> lockPending(long submissionId) {
        jdbcTemplate.execute(LOCK_TIMEOUT_SQL);
        try {
            return submissionRepository.findPendingByIdForUpdate(submissionId);
        } catch (PessimisticLockingFailureException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, CODE_REVIEW_IN_PROGRESS,
                    "Submission " + submissionId + " is being reviewed by someone else", ex);
        }
    }

    private static String requireReviewer(String reviewer) {
        if (!StringUtils.hasText(reviewer)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_REVIEWER_REQUIRED, "Reviewer identity is required");
        }
        String trimmed = reviewer.trim();
        if (trimmed.length() > MAX_REVIEWER_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_INVALID_INPUT,
                    "Reviewer must be at most " + MAX_REVIEWER_LENGTH + " characters");
        }
        return trimmed;
    }
}

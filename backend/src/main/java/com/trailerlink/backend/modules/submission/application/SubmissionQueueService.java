package com.trailerlink.backend.modules.submission.application;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import com.trailerlink.backend.global.config.SubmissionProperties;
import com.trailerlink.backend.global.error.ProblemException;
import com.trailerlink.backend.global.error.RetryableProblemException;
import com.trailerlink.backend.modules.submission.domain.Submission;
import com.trailerlink.backend.modules.submission.domain.SubmissionStatus;
import com.trailerlink.backend.modules.submission.infrastructure.persistence.SubmissionRepository;

/**
 * Bounded intake of proposed mappings.
 *
 * <p>The pending-count check and the insert run in one transaction that first takes a
 * transaction-scoped advisory lock, so concurrent submitters are serialized and the pending
 * queue never grows past {@link SubmissionProperties#pendingLimit()}.
 */
@Service
public class SubmissionQueueService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionQueueService.class);

    public static final String CODE_INVALID_INPUT = "submission.invalid_input";
    public static final String CODE_CAPACITY_EXCEEDED = "submission.capacity_exceeded";
    public static final String CODE_ID_ALLOCATION_FAILED = "submission.id_allocation_failed";

    static final long INTAKE_LOCK_KEY = 0x5452_4C4E_4B51L;
    static final Duration CAPACITY_RETRY_AFTER = Duration.ofMinutes(1);
    static final int MAX_SOURCE_ID_LENGTH = 32;
    static final int MAX_TARGET_URL_LENGTH = 2048;

    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final String PRIMARY_KEY_CONSTRAINT = "submission_pkey";

    private final SubmissionRepository submissionRepository;
    private final SubmissionIdAllocator idAllocator;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SubmissionProperties properties;
    private final Clock clock;

    public SubmissionQueueService(
            SubmissionRepository submissionRepository,
            SubmissionIdAllocator idAllocator,
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            SubmissionProperties properties,
            Clock clock
    ) {
        this.submissionRepository = submissionRepository;
        this.idAllocator = idAllocator;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Queues a proposal and returns its id.
     *
     * @throws RetryableProblemException {@code submission.capacity_exceeded} when the pending queue is full
     * @throws ProblemException {@code submission.invalid_input} for blank or oversized values,
     *         {@code submission.id_allocation_failed} when every id attempt collided
     */
    public long submit(String sourceId, String targetUrl) {
        String normalizedSourceId = requireText(sourceId, "sourceId", MAX_SOURCE_ID_LENGTH);
        String normalizedTargetUrl = requireText(targetUrl, "targetUrl", MAX_TARGET_URL_LENGTH);

        long candidate = idAllocator.nextId();
        for (int attempt = 1; ; attempt++) {
            long id = candidate;
            try {
                transactionTemplate.executeWithoutResult(status ->
                        insertWithinCapacity(id, normalizedSourceId, normalizedTargetUrl));
                log.info("Submission {} queued for {}", id, normalizedSourceId);
                return id;
            } catch (DataIntegrityViolationException ex) {
                if (!isPrimaryKeyConflict(ex)) {
                    throw ex;
                }
                if (attempt >= properties.maxIdAttempts()) {
                    log.error("Submission id conflict persisted after {} attempts (last id={})", attempt, id);
                    throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, CODE_ID_ALLOCATION_FAILED,
                            "Could not allocate a unique submission id, try again.", ex);
                }
                candidate = idAllocator.reallocate(id);
                log.warn("Submission id {} already taken, retrying with {} (attempt {})", id, candidate, attempt + 1);
            }
        }
    }

    @Transactional(readOnly = true)
    public int pendingCount() {
        return Math.toIntExact(submissionRepository.countByStatus(SubmissionStatus.PENDING));
    }

    /**
     * Pending submissions, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Submission> listPending() {
        return submissionRepository.findByStatusOrderBySubmittedAtAscIdAsc(SubmissionStatus.PENDING);
    }

    public int capacity() {
        return properties.pendingLimit();
    }

    @Transactional(readOnly = true)
    public int remainingCapacity() {
        return Math.max(0, properties.pendingLimit() - pendingCount());
    }

    private void insertWithinCapacity(long id, String sourceId, String targetUrl) {
        jdbcTemplate.execute("SELECT pg_advisory_xact_lock(" + INTAKE_LOCK_KEY + ")");
        long pending = submissionRepository.countByStatus(SubmissionStatus.PENDING);
        if (pending >= properties.pendingLimit()) {
            throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, CODE_CAPACITY_EXCEEDED,
                    "Pending submissions limit reached (" + properties.pendingLimit() + "). Try again later.",
                    CAPACITY_RETRY_AFTER);
        }
        submissionRepository.insertPending(id, sourceId, targetUrl, OffsetDateTime.now(clock));
    }

    private boolean isPrimaryKeyConflict(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        if (root instanceof SQLException sqlException
                && UNIQUE_VIOLATION_STATE.equals(sqlException.getSQLState())) {
            return true;
        }
        String message = root.getMessage();
        return message != null && message.contains(PRIMARY_KEY_CONSTRAINT);
    }

    private static String requireText(String value, String field, int maxLength) {
        if (!StringUtils.hasText(value)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_INVALID_INPUT, field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, CODE_INVALID_INPUT,
                    field + " must be at most " + maxLength + " characters");
        }
        return trimmed;
    }
}

package com.trailerlink.backend.modules.submission.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.trailerlink.backend.modules.submission.domain.Submission;
import com.trailerlink.backend.modules.submission.domain.SubmissionStatus;

public interface SubmissionRepository extends JpaRepository<Submission, Long> {

    long countByStatus(SubmissionStatus status);

    List<Submission> findByStatusOrderBySubmittedAtAscIdAsc(SubmissionStatus status);

    @Modifying
    @Query(value = """
            INSERT INTO submission (id, source_id, target_url, submitted_at, status)
            VALUES (:id, :sourceId, :targetUrl, :submittedAt, 'PENDING')
            """, nativeQuery = true)
    int insertPending(@Param("id") long id,
                      @Param("sourceId") String sourceId,
                      @Param("targetUrl") String targetUrl,
                      @Param("submittedAt") OffsetDateTime submittedAt);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s
              from Submission s
             where s.id = :id
               and s.status = com.trailerlink.backend.modules.submission.domain.SubmissionStatus.PENDING
            """)
    Optional<Submission> findPendingByIdForUpdate(@Param("id") long id);
}

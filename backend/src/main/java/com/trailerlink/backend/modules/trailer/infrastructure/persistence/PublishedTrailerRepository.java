package com.trailerlink.backend.modules.trailer.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.trailerlink.backend.modules.trailer.domain.PublishedTrailer;

public interface PublishedTrailerRepository extends JpaRepository<PublishedTrailer, String> {

    List<PublishedTrailer> findAllByOrderByApprovedAtDescSourceIdAsc(Pageable pageable);

    @Modifying
    @Query(value = """
            INSERT INTO published_trailer (source_id, target_url, approved_at, reviewer)
            VALUES (:sourceId, :targetUrl, :approvedAt, :reviewer)
            ON CONFLICT (source_id) DO UPDATE
               SET target_url = EXCLUDED.target_url,
                   approved_at = EXCLUDED.approved_at,
                   reviewer = EXCLUDED.reviewer
            """, nativeQuery = true)
    int upsert(@Param("sourceId") String sourceId,
               @Param("targetUrl") String targetUrl,
               @Param("approvedAt") OffsetDateTime approvedAt,
               @Param("reviewer") String reviewer);
}

package com.trailerlink.backend.modules.moderation;

import static com.trailerlink.backend.support.SubmissionFixtures.count;
import static com.trailerlink.backend.support.SubmissionFixtures.statusOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.trailerlink.backend.modules.moderation.application.ModerationService;
import com.trailerlink.backend.modules.submission.application.SubmissionQueueService;
import com.trailerlink.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class ModerationRollbackIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String BLOCKED_SOURCE_ID = "tt4444444";

    @Autowired
    SubmissionQueueService submissionQueueService;

    @Autowired
    ModerationService moderationService;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void blockPublishingOfOneSource() {
        jdbcTemplate.execute("ALTER TABLE published_trailer ADD CONSTRAINT ck_test_blocked_source CHECK (source_id <> '"
                + BLOCKED_SOURCE_ID + "')");
    }

    @AfterEach
    void unblockPublishing() {
        jdbcTemplate.execute("ALTER TABLE published_trailer DROP CONSTRAINT IF EXISTS ck_test_blocked_source");
    }

    @Test
    void failedPublishRollsBackFlushedStatusChange() {
        long id = submissionQueueService.submit(BLOCKED_SOURCE_ID, "https://acfun.cn/v/rollback");

        assertThatThrownBy(() -> moderationService.review(id, true, "alice"))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(statusOf(jdbcTemplate, id)).isEqualTo("PENDING");
        assertThat(count(jdbcTemplate, "published_trailer")).isZero();
        assertThat(submissionQueueService.pendingCount()).isEqualTo(1);

        long retry = submissionQueueService.submit("tt4444445", "https://acfun.cn/v/after");
        moderationService.review(retry, true, "alice");
        assertThat(statusOf(jdbcTemplate, retry)).isEqualTo("APPROVED");
    }

    @Test
    void rejectionIsUnaffectedByPublishFailures() {
        long id = submissionQueueService.submit(BLOCKED_SOURCE_ID, "https://acfun.cn/v/rollback");

        moderationService.review(id, false, "bob");

        assertThat(statusOf(jdbcTemplate, id)).isEqualTo("REJECTED");
    }
}

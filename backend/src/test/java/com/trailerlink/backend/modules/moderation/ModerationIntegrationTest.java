package com.trailerlink.backend.modules.moderation;

import static com.trailerlink.backend.support.SubmissionFixtures.count;
import static com.trailerlink.backend.support.SubmissionFixtures.statusOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.trailerlink.backend.global.error.ProblemException;
import com.trailerlink.backend.modules.moderation.application.ModerationService;
import com.trailerlink.backend.modules.submission.application.SubmissionQueueService;
import com.trailerlink.backend.modules.trailer.application.TrailerLookupService;
import com.trailerlink.backend.modules.trailer.domain.PublishedTrailer;
import com.trailerlink.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class ModerationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    SubmissionQueueService submissionQueueService;

    @Autowired
    ModerationService moderationService;

    @Autowired
    TrailerLookupService trailerLookupService;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    void approvedSubmissionBecomesVisibleToLookup() {
        int pendingBefore = submissionQueueService.pendingCount();
        long id = submissionQueueService.submit("tt1234567", "https://acfun.cn/v/x");

        moderationService.review(id, true, "alice");

        assertThat(trailerLookupService.lookup("tt1234567")).contains("https://acfun.cn/v/x");
        assertThat(trailerLookupService.lookup(" tt1234567 ")).contains("https://acfun.cn/v/x");
        assertThat(statusOf(jdbcTemplate, id)).isEqualTo("APPROVED");
        assertThat(submissionQueueService.pendingCount()).isEqualTo(pendingBefore);
        assertThat(trailerLookupService.recentPublished())
                .singleElement()
                .satisfies(published -> {
                    assertThat(published.getSourceId()).isEqualTo("tt1234567");
                    assertThat(published.getReviewer()).isEqualTo("alice");
                    assertThat(published.getApprovedAt()).isNotNull();
                });
    }

    @Test
    void rejectionNeverPublishes() {
        long id = submissionQueueService.submit("tt7654321", "https://acfun.cn/v/y");

        moderationService.review(id, false, "bob");

        assertThat(statusOf(jdbcTemplate, id)).isEqualTo("REJECTED");
        assertThat(trailerLookupService.lookup("tt7654321")).isEmpty();
        assertThat(count(jdbcTemplate, "published_trailer")).isZero();
    }

    @Test
    void secondReviewOfSameSubmissionIsNotFoundAndChangesNothing() {
        long id = submissionQueueService.submit("tt1234567", "https://acfun.cn/v/x");
        moderationService.review(id, true, "alice");

        assertThatThrownBy(() -> moderationService.review(id, false, "bob"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo(ModerationService.CODE_SUBMISSION_NOT_FOUND);
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                });

        assertThat(statusOf(jdbcTemplate, id)).isEqualTo("APPROVED");
        assertThat(jdbcTemplate.queryForObject(
                "SELECT reviewer FROM published_trailer WHERE source_id = ?", String.class, "tt1234567"))
                .isEqualTo("alice");
    }

    @Test
    void unknownSubmissionIsNotFound() {
        assertThatThrownBy(() -> moderationService.review(987_654_321L, true, "alice"))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(ModerationService.CODE_SUBMISSION_NOT_FOUND));
        assertThat(count(jdbcTemplate, "published_trailer")).isZero();
    }

    @Test
    void laterApprovalForSameSourceOverwritesMapping() {
        long first = submissionQueueService.submit("tt0000001", "https://acfun.cn/v/first");
        long second = submissionQueueService.submit("tt0000001", "https://acfun.cn/v/second");

        moderationService.review(first, true, "alice");
        moderationService.review(second, true, "bob");

        assertThat(count(jdbcTemplate, "published_trailer")).isEqualTo(1);
        assertThat(trailerLookupService.lookup("tt0000001")).contains("https://acfun.cn/v/second");
        assertThat(trailerLookupService.recentPublished())
                .extracting(PublishedTrailer::getReviewer)
                .containsExactly("bob");
    }

    @Test
    void concurrentReviewsOfOneSubmissionLetExactlyOneWin() throws Exception {
        long id = submissionQueueService.submit("tt2222222", "https://acfun.cn/v/race");
        int reviewers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(reviewers);
        CountDownLatch start = new CountDownLatch(1);
        int succeeded = 0;
        int notFound = 0;
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < reviewers; i++) {
                boolean approve = i % 2 == 0;
                String reviewer = "reviewer-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    moderationService.review(id, approve, reviewer);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause())
                            .isInstanceOfSatisfying(ProblemException.class, problem ->
                                    assertThat(problem.getCode())
                                            .isEqualTo(ModerationService.CODE_SUBMISSION_NOT_FOUND));
                    notFound++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(succeeded).isEqualTo(1);
        assertThat(notFound).isEqualTo(reviewers - 1);
        assertThat(statusOf(jdbcTemplate, id)).isIn("APPROVED", "REJECTED");
        assertThat(count(jdbcTemplate, "published_trailer"))
                .isEqualTo("APPROVED".equals(statusOf(jdbcTemplate, id)) ? 1 : 0);
    }

    @Test
    void blankReviewerIsRejectedBeforeTouchingTheSubmission() {
        long id = submissionQueueService.submit("tt3333333", "https://acfun.cn/v/z");

        assertThatThrownBy(() -> moderationService.review(id, true, "  "))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(ModerationService.CODE_REVIEWER_REQUIRED));
        assertThat(statusOf(jdbcTemplate, id)).isEqualTo("PENDING");
    }

    @Test
    void recentPublishedIsNewestFirstAndClamped() {
        for (int i = 0; i < 3; i++) {
            String sourceId = "tt900000" + i;
            long id = submissionQueueService.submit(sourceId, "https://acfun.cn/v/" + i);
            moderationService.review(id, true, "alice");
        }

        assertThat(trailerLookupService.recentPublished(2))
                .extracting(PublishedTrailer::getSourceId)
                .containsExactly("tt9000002", "tt9000001");
        assertThat(trailerLookupService.recentPublished(0)).hasSize(1);
        assertThat(trailerLookupService.recentPublished(500)).hasSize(3);
    }
}

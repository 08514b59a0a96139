package com.trailerlink.backend.modules.submission.application;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

/**
 * Hands out time-derived submission ids: epoch milliseconds scaled by {@value #SEQUENCE_SPAN},
 * kept strictly increasing within this process so two calls never return the same id.
 *
 * <p>Other processes sharing the store can still land on the same value; the queue reacts to the
 * resulting primary-key conflict with {@link #reallocate(long)}.
 */
@Component
public class SubmissionIdAllocator {

    static final long SEQUENCE_SPAN = 1_000L;
    static final long JITTER_BOUND = 1_000L;

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public SubmissionIdAllocator(Clock clock) {
        this.clock = clock;
    }

    public long nextId() {
        long floor = clock.millis() * SEQUENCE_SPAN;
        return last.updateAndGet(previous -> Math.max(previous + 1, floor));
    }

    /**
     * Returns an id above both {@code conflicted} and anything handed out so far, pushed forward by
     * a random jitter so competing processes stop colliding.
     */
    public long reallocate(long conflicted) {
        long jitter = ThreadLocalRandom.current().nextLong(1, JITTER_BOUND);
        long floor = clock.millis() * SEQUENCE_SPAN;
        return last.updateAndGet(previous -> Math.max(Math.max(previous, conflicted), floor) + jitter);
    }
}

package com.trailerlink.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * A {@link ProblemException} for a transient condition, such as a full submission queue. The caller
 * may try again once {@link #getRetryAfter()} has passed; routing collaborators surface it as a
 * {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be zero or positive: " + retryAfter);
        }
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Whole seconds, rounded up, as a {@code Retry-After} value.
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}

package com.unifiedplatform.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A problem the caller may retry after {@link #getRetryAfterSeconds()}; rendered with a
 * {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RetryableProblemException(HttpStatus status, String code, int retryAfterSeconds) {
        this(status, code, null, retryAfterSeconds);
    }

    public static RetryableProblemException storeUnavailable(String detail, int retryAfterSeconds) {
        return new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, STORE_UNAVAILABLE, detail, retryAfterSeconds);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

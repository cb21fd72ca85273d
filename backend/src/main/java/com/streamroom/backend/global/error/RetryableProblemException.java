package com.streamroom.backend.global.error;

public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(ErrorCode errorCode, String detail, int retryAfterSeconds, Throwable cause) {
        super(errorCode, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RetryableProblemException(ErrorCode errorCode, String detail, int retryAfterSeconds) {
        this(errorCode, detail, retryAfterSeconds, null);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

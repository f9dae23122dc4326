package com.github.dimitryivaniuta.cmdb.error;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    public static final String CODE = "RATE_LIMIT_EXCEEDED";

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}

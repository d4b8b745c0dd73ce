package com.polyglot.backend.common.error;

public class RateLimitedException extends ApiException {

    private final int retryAfterSec;

    public RateLimitedException(String message, int retryAfterSec, String clientAction) {
        super("RATE_LIMITED", message, clientAction);
        this.retryAfterSec = retryAfterSec;
    }

    public int retryAfterSec() { return retryAfterSec; }
}

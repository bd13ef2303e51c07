package com.bastion.fetch;

import java.time.Duration;

/**
 * Outcome of one feed retrieval: either the body text or a failure.
 */
public final class FetchResult {

    private final String body;
    private final FetchFailure failure;
    private final Duration elapsed;

    private FetchResult(String body, FetchFailure failure, Duration elapsed) {
        this.body = body;
        this.failure = failure;
        this.elapsed = elapsed;
    }

    public static FetchResult success(String body, Duration elapsed) {
        return new FetchResult(body == null ? "" : body, null, elapsed);
    }

    public static FetchResult failure(FetchFailure failure, Duration elapsed) {
        return new FetchResult(null, failure, elapsed);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String getBody() {
        return body;
    }

    public FetchFailure getFailure() {
        return failure;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}

package com.delta.cnpjresolver.resolve.model;

import java.util.List;

/**
 * Result of a retry loop: the accepted attempt, if any, and every attempt made.
 */
public record FetchResult(
    String url,
    PageFetchOutcome accepted,
    List<PageFetchOutcome> attempts,
    boolean cancelled
) {
    public FetchResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public boolean isSuccessful() {
        return accepted != null;
    }

    public boolean isExhausted() {
        return accepted == null;
    }

    public String body() {
        return accepted == null ? null : accepted.body();
    }

    public int attemptCount() {
        return attempts.size();
    }

    public String lastReason() {
        if (attempts.isEmpty()) {
            return cancelled ? "cancelled" : null;
        }
        return attempts.get(attempts.size() - 1).reason();
    }
}

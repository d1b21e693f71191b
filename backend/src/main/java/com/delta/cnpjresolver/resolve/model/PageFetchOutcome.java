package com.delta.cnpjresolver.resolve.model;

import java.time.Duration;

/**
 * One HTTP attempt. {@code proxy} is the masked proxy label, or {@code null} for a direct connection.
 */
public record PageFetchOutcome(
    String url,
    int statusCode,
    String body,
    FetchStatus status,
    String proxy,
    Duration duration,
    String reason
) {
    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    public boolean isFatal() {
        return status == FetchStatus.FATAL_ERROR;
    }
}

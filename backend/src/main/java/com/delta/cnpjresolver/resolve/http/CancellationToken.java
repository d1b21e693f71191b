package com.delta.cnpjresolver.resolve.http;

import com.delta.cnpjresolver.resolve.util.ReasonCodes;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative stop signal for one company: an explicit cancel flag plus an optional wall-clock deadline.
 */
public class CancellationToken {
    private final Clock clock;
    private final Instant deadline;
    private volatile boolean cancelled;

    public CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.deadline = deadline;
    }

    public static CancellationToken none() {
        return new CancellationToken(Clock.systemUTC(), null);
    }

    public static CancellationToken withBudget(Clock clock, Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return new CancellationToken(clock, null);
        }
        Clock effective = clock == null ? Clock.systemUTC() : clock;
        return new CancellationToken(effective, effective.instant().plus(budget));
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || deadlineExceeded();
    }

    public String reason() {
        if (cancelled) {
            return ReasonCodes.CANCELLED;
        }
        if (deadlineExceeded()) {
            return ReasonCodes.DEADLINE_EXCEEDED;
        }
        return null;
    }

    private boolean deadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}

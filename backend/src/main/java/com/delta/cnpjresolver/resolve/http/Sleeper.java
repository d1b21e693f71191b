package com.delta.cnpjresolver.resolve.http;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            long millis = duration == null ? 0 : duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }

    static Sleeper noop() {
        return duration -> {
        };
    }
}
